package hub;

import devices.Device;
import devices.TemperatureResult;
import devices.Thermostat;
import exceptions.ExecutionException;
import exceptions.ValidationException;

/**
 * One step of a scene, addressed to a device by name.
 */
public class SceneAction {

    public enum Kind { ACTIVATE, DEACTIVATE, SET_TEMPERATURE }

    private final String deviceName;
    private final Kind kind;
    private final int temperature;

    private SceneAction(String deviceName, Kind kind, int temperature) {
        this.deviceName = deviceName;
        this.kind = kind;
        this.temperature = temperature;
    }

    public static SceneAction activate(String deviceName) {
        return new SceneAction(deviceName, Kind.ACTIVATE, 0);
    }

    public static SceneAction deactivate(String deviceName) {
        return new SceneAction(deviceName, Kind.DEACTIVATE, 0);
    }

    public static SceneAction setTemperature(String deviceName, int temperature) {
        return new SceneAction(deviceName, Kind.SET_TEMPERATURE, temperature);
    }

    public String getDeviceName() { return deviceName; }
    public Kind getKind() { return kind; }
    public int getTemperature() { return temperature; }

    public void execute(DeviceRegistry registry) throws ValidationException, ExecutionException {
        Device<?> device = registry.get(deviceName)
                .orElseThrow(() -> new ExecutionException("Scene action failed, device missing " + deviceName));

        switch (kind) {
            case ACTIVATE:
                device.activate();
                break;
            case DEACTIVATE:
                device.deactivate();
                break;
            case SET_TEMPERATURE:
                if (!(device instanceof Thermostat thermostat)) {
                    throw new ValidationException("Device " + deviceName + " is not a thermostat");
                }
                TemperatureResult result = thermostat.setTemperature(temperature);
                if (!result.isApplied()) {
                    throw new ValidationException("Temperature " + temperature + " rejected for "
                            + deviceName + ": " + result);
                }
                break;
            default:
                throw new IllegalStateException("Unknown action kind: " + kind);
        }
    }

    @Override
    public String toString() {
        return kind == Kind.SET_TEMPERATURE
                ? "SceneAction{" + deviceName + ", " + kind + "=" + temperature + "}"
                : "SceneAction{" + deviceName + ", " + kind + "}";
    }
}
