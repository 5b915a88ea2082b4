package hub;

import devices.Device;
import exceptions.ExecutionException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class DeviceRegistry {
    private final Map<String, Device<?>> devices = new LinkedHashMap<>();

    // a device registered under an existing name replaces the old one
    public void register(Device<?> device) {
        devices.put(device.getName(), device);
    }

    public void deregister(String name) {
        if (name != null) {
            devices.remove(name);
        }
    }

    public Optional<Device<?>> get(String name) {
        return Optional.ofNullable(devices.get(name));
    }

    public Device<?> require(String name) throws ExecutionException {
        Device<?> device = devices.get(name);
        if (device == null) throw new ExecutionException("Device not found: " + name);
        return device;
    }

    public Collection<Device<?>> getAll() {
        return Collections.unmodifiableCollection(devices.values());
    }
}
