package devices;

/**
 * Outcome of {@link Thermostat#setTemperature(int)}.
 */
public enum TemperatureResult {
    APPLIED,
    REJECTED_OFF,
    REJECTED_OUT_OF_RANGE;

    public boolean isApplied() {
        return this == APPLIED;
    }
}
