package hub;

import devices.Device;
import exceptions.ExecutionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named set of devices that are switched together, in the order they were added.
 * Members are kept by name and looked up in the registry on every switch, so a
 * device re-registered under the same name is the one that gets switched.
 */
public class DeviceGroup {
    private final String name;
    private final List<String> deviceNames = new ArrayList<>();

    public DeviceGroup(String name) {
        this.name = name;
    }

    public String getName() { return name; }

    public void addDevice(String deviceName) {
        if (!deviceNames.contains(deviceName)) {
            deviceNames.add(deviceName);
        }
    }

    public void removeDevice(String deviceName) {
        deviceNames.remove(deviceName);
    }

    public List<String> getDeviceNames() {
        return Collections.unmodifiableList(deviceNames);
    }

    public void activateAll(DeviceRegistry registry) throws ExecutionException {
        for (Device<?> device : resolve(registry)) {
            device.activate();
        }
    }

    public void deactivateAll(DeviceRegistry registry) throws ExecutionException {
        for (Device<?> device : resolve(registry)) {
            device.deactivate();
        }
    }

    // resolve every member first so a missing one leaves the whole group untouched
    private List<Device<?>> resolve(DeviceRegistry registry) throws ExecutionException {
        List<Device<?>> devices = new ArrayList<>(deviceNames.size());
        for (String deviceName : deviceNames) {
            devices.add(registry.require(deviceName));
        }
        return devices;
    }

    @Override
    public String toString() {
        return "DeviceGroup{" + name + ", size=" + deviceNames.size() + "}";
    }
}
