package hub;

import devices.DeviceControl;
import exceptions.ExecutionException;

import java.util.LinkedHashMap;
import java.util.Map;

public class SceneExecutor {

    public void execute(Scene scene, DeviceRegistry registry) throws ExecutionException {
        Map<String, Runnable> originalStates = new LinkedHashMap<>();

        // save original states of every device the scene can reach
        for (SceneAction action : scene.getActions()) {
            String name = action.getDeviceName();
            if (!originalStates.containsKey(name)) {
                registry.get(name).ifPresent(device -> originalStates.put(name, DeviceControl.snapshot(device)));
            }
        }

        // execute actions
        try {
            for (SceneAction action : scene.getActions()) {
                action.execute(registry);
            }
            System.out.println("Scene '" + scene.getName() + "' executed successfully.");
        } catch (Exception e) {
            System.err.println("Scene execution failed (" + e.getMessage() + "). Rolling back...");
            rollback(originalStates);
            throw new ExecutionException("Scene '" + scene.getName() + "' failed and rolled back: "
                    + e.getMessage(), e);
        }
    }

    private void rollback(Map<String, Runnable> originalStates) {
        originalStates.forEach((name, restore) -> {
            try {
                restore.run();
            } catch (RuntimeException e) {
                System.err.println("Failed to rollback device: " + name);
            }
        });
        System.out.println("Rollback complete.");
    }
}
