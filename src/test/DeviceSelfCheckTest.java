import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DeviceSelfCheckTest {
    private final PrintStream originalOut = System.out;
    private final ByteArrayOutputStream captured = new ByteArrayOutputStream();

    @BeforeEach
    void captureOutput() {
        System.setOut(new PrintStream(captured, true));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
    }

    @Test
    void run_PassesAndPrintsEveryStatusLine() {
        assertDoesNotThrow(() -> new DeviceSelfCheck().run());

        assertEquals(List.of(
                "Light is ON",
                "Light is OFF",
                "Thermostat is ON",
                "Thermostat temperature set to: 25",
                "Thermostat is OFF",
                "Cannot set temperature, thermostat is off.",
                "Smart Lock is UNLOCKED",
                "Smart Lock is LOCKED",
                "Garage Door is OPEN",
                "Garage Door is CLOSED"), captured.toString().lines().toList());
    }

    @Test
    void check_FailedCondition_ThrowsWithDescription() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> DeviceSelfCheck.check(false, "light starts off"));
        assertEquals("Self-check failed: light starts off", ex.getMessage());

        assertDoesNotThrow(() -> DeviceSelfCheck.check(true, "light starts off"));
    }
}
