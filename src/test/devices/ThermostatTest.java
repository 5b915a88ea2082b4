package devices;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ThermostatTest {
    private final PrintStream originalOut = System.out;
    private final ByteArrayOutputStream captured = new ByteArrayOutputStream();

    private Thermostat thermostat;

    @BeforeEach
    void setUp() {
        System.setOut(new PrintStream(captured, true));
        thermostat = new Thermostat();
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
    }

    private List<String> outputLines() {
        return captured.toString().lines().toList();
    }

    // =========================================================================
    // Initial state and switching
    // =========================================================================

    @Test
    void newThermostat_IsOffAtTwentyDegrees() {
        assertFalse(thermostat.isOn());
        assertEquals(20, thermostat.getTemperature());
        assertEquals("THERMOSTAT", thermostat.getType());
    }

    @Test
    void activateThenDeactivate_PrintsStatus() {
        thermostat.activate();
        assertTrue(thermostat.isOn());
        thermostat.deactivate();
        assertFalse(thermostat.isOn());

        assertEquals(List.of("Thermostat is ON", "Thermostat is OFF"), outputLines());
    }

    // =========================================================================
    // setTemperature guards
    // =========================================================================

    @Test
    void setTemperature_WhileOn_Applies() {
        thermostat.activate();
        captured.reset();

        assertEquals(TemperatureResult.APPLIED, thermostat.setTemperature(25));
        assertEquals(25, thermostat.getTemperature());
        assertEquals(List.of("Thermostat temperature set to: 25"), outputLines());
    }

    @Test
    void setTemperature_WhileOff_IsRejectedAndKeepsValue() {
        assertEquals(TemperatureResult.REJECTED_OFF, thermostat.setTemperature(25));
        assertEquals(20, thermostat.getTemperature());
        assertEquals(List.of("Cannot set temperature, thermostat is off."), outputLines());
    }

    @Test
    void setTemperature_AfterDeactivate_KeepsPreviousValue() {
        thermostat.activate();
        thermostat.setTemperature(25);
        thermostat.deactivate();

        assertEquals(TemperatureResult.REJECTED_OFF, thermostat.setTemperature(30));
        assertEquals(25, thermostat.getTemperature(), "Temperature must not change while off.");
    }

    @Test
    void setTemperature_OutOfRange_IsRejected() {
        thermostat.activate();
        thermostat.setTemperature(22);
        captured.reset();

        assertEquals(TemperatureResult.REJECTED_OUT_OF_RANGE, thermostat.setTemperature(5));
        assertEquals(TemperatureResult.REJECTED_OUT_OF_RANGE, thermostat.setTemperature(31));
        assertEquals(TemperatureResult.REJECTED_OUT_OF_RANGE, thermostat.setTemperature(9));
        assertEquals(22, thermostat.getTemperature());

        String expected = "Invalid temperature. Temperature must be between 10 and 30.";
        assertEquals(List.of(expected, expected, expected), outputLines());
    }

    @Test
    void setTemperature_BoundariesAreInclusive() {
        thermostat.activate();

        assertTrue(thermostat.setTemperature(10).isApplied());
        assertEquals(10, thermostat.getTemperature());

        assertTrue(thermostat.setTemperature(30).isApplied());
        assertEquals(30, thermostat.getTemperature());
    }

    @Test
    void setTemperature_OffCheckTakesPrecedenceOverRangeCheck() {
        assertEquals(TemperatureResult.REJECTED_OFF, thermostat.setTemperature(99));
        assertEquals(List.of("Cannot set temperature, thermostat is off."), outputLines());
    }

    // =========================================================================
    // Value semantics
    // =========================================================================

    @Test
    void copyAndRestore_KeepPowerAndTemperature() {
        thermostat.activate();
        thermostat.setTemperature(27);
        Thermostat snapshot = thermostat.copy();

        thermostat.setTemperature(12);
        thermostat.deactivate();
        captured.reset();

        thermostat.restore(snapshot);
        assertTrue(thermostat.isOn());
        assertEquals(27, thermostat.getTemperature());
        assertTrue(outputLines().isEmpty());
    }
}
