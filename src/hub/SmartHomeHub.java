package hub;

import devices.Device;
import devices.TemperatureResult;
import devices.Thermostat;
import exceptions.ExecutionException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class SmartHomeHub {
    private final DeviceRegistry deviceRegistry = new DeviceRegistry();
    private final SceneExecutor sceneExecutor = new SceneExecutor();
    private final Map<String, Scene> scenes = new LinkedHashMap<>();
    private final Map<String, DeviceGroup> groups = new LinkedHashMap<>();

    public void registerDevice(Device<?> device) {
        if (device == null) throw new IllegalArgumentException("Device must not be null");
        deviceRegistry.register(device);
    }

    public void deregisterDevice(String deviceName) {
        deviceRegistry.deregister(deviceName);
        groups.values().forEach(group -> group.removeDevice(deviceName));
    }

    public Collection<Device<?>> getAllDevices() {
        return deviceRegistry.getAll();
    }

    public Optional<Device<?>> getDevice(String name) {
        return deviceRegistry.get(name);
    }

    public void activate(String deviceName) throws ExecutionException {
        deviceRegistry.require(deviceName).activate();
    }

    public void deactivate(String deviceName) throws ExecutionException {
        deviceRegistry.require(deviceName).deactivate();
    }

    public TemperatureResult setTemperature(String deviceName, int value) throws ExecutionException {
        Device<?> device = deviceRegistry.require(deviceName);
        if (device instanceof Thermostat thermostat) {
            return thermostat.setTemperature(value);
        }
        throw new ExecutionException("Device " + deviceName + " is a " + device.getType() + ", not a thermostat");
    }

    // --- groups ---

    public DeviceGroup createGroup(String groupName, List<String> deviceNames) throws ExecutionException {
        if (deviceNames == null) throw new IllegalArgumentException("Device names must not be null");
        DeviceGroup group = new DeviceGroup(groupName);
        for (String deviceName : deviceNames) {
            deviceRegistry.require(deviceName);
            group.addDevice(deviceName);
        }
        groups.put(groupName, group);
        return group;
    }

    public Optional<DeviceGroup> getGroup(String groupName) {
        return Optional.ofNullable(groups.get(groupName));
    }

    public void deleteGroup(String groupName) {
        groups.remove(groupName);
    }

    public void activateGroup(String groupName) throws ExecutionException {
        requireGroup(groupName).activateAll(deviceRegistry);
    }

    public void deactivateGroup(String groupName) throws ExecutionException {
        requireGroup(groupName).deactivateAll(deviceRegistry);
    }

    private DeviceGroup requireGroup(String groupName) throws ExecutionException {
        DeviceGroup group = groups.get(groupName);
        if (group == null) throw new ExecutionException("Group not found: " + groupName);
        return group;
    }

    // --- scenes ---

    public void createScene(Scene scene) {
        if (scene == null) throw new IllegalArgumentException("Scene must not be null");
        scenes.put(scene.getName(), scene);
    }

    public Optional<Scene> getScene(String sceneName) {
        return Optional.ofNullable(scenes.get(sceneName));
    }

    public Collection<Scene> getAllScenes() {
        return Collections.unmodifiableCollection(scenes.values());
    }

    public void executeScene(String sceneName) throws ExecutionException {
        Scene scene = scenes.get(sceneName);
        if (scene == null) throw new ExecutionException("Scene not found: " + sceneName);
        sceneExecutor.execute(scene, deviceRegistry);
    }
}
