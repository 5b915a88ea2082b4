package devices;

import java.util.Objects;

/**
 * Thermostat:
 *  - on: Boolean, starts OFF
 *  - temperature: Integer (10-30), starts at 20
 *
 * The temperature can only be changed while the thermostat is on. Turning it
 * off keeps the last temperature.
 */
public class Thermostat implements Device<Thermostat> {
    public static final String TYPE = "THERMOSTAT";
    public static final int MIN_TEMPERATURE = 10;
    public static final int MAX_TEMPERATURE = 30;
    public static final int DEFAULT_TEMPERATURE = 20;

    private final String name;
    private boolean on;
    private int temperature;

    public Thermostat() {
        this("Thermostat");
    }

    public Thermostat(String name) {
        this.name = Devices.requireName(name);
        this.on = false;
        this.temperature = DEFAULT_TEMPERATURE;
    }

    public Thermostat(Thermostat other) {
        Objects.requireNonNull(other, "other");
        this.name = other.name;
        this.on = other.on;
        this.temperature = other.temperature;
    }

    @Override
    public void activate() {
        on = true;
        System.out.println("Thermostat is ON");
    }

    @Override
    public void deactivate() {
        on = false;
        System.out.println("Thermostat is OFF");
    }

    /**
     * Applies a new target temperature. The off check runs before the range
     * check, so an out-of-range value sent to an off thermostat reports
     * {@link TemperatureResult#REJECTED_OFF}.
     */
    public TemperatureResult setTemperature(int value) {
        if (!on) {
            System.out.println("Cannot set temperature, thermostat is off.");
            return TemperatureResult.REJECTED_OFF;
        }
        if (value < MIN_TEMPERATURE || value > MAX_TEMPERATURE) {
            System.out.println("Invalid temperature. Temperature must be between "
                    + MIN_TEMPERATURE + " and " + MAX_TEMPERATURE + ".");
            return TemperatureResult.REJECTED_OUT_OF_RANGE;
        }
        temperature = value;
        System.out.println("Thermostat temperature set to: " + value);
        return TemperatureResult.APPLIED;
    }

    public int getTemperature() { return temperature; }

    public boolean isOn() { return on; }

    @Override
    public String getName() { return name; }

    @Override
    public String getType() { return TYPE; }

    @Override
    public Thermostat copy() {
        return new Thermostat(this);
    }

    @Override
    public void restore(Thermostat snapshot) {
        this.on = snapshot.on;
        this.temperature = snapshot.temperature;
    }

    @Override
    public String toString() {
        return String.format("Thermostat{name='%s', on=%s, temperature=%d}", name, on, temperature);
    }
}
