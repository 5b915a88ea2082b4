package devices;

/**
 * Uniform entry points for switching any device.
 */
public final class DeviceControl {

    private DeviceControl() {
    }

    public static <D extends Device<D>> D turnOn(D device) {
        device.activate();
        return device;
    }

    public static <D extends Device<D>> D turnOff(D device) {
        device.deactivate();
        return device;
    }

    /**
     * Captures the current state of the device; running the returned task puts it back.
     */
    public static <D extends Device<D>> Runnable snapshot(Device<D> device) {
        D saved = device.copy();
        return () -> device.restore(saved);
    }
}
