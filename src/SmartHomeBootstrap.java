import devices.*;
import hub.*;

import java.util.List;

/**
 * responsible for loading the default household into the smart home hub.
 */
public class SmartHomeBootstrap {

    public static final String LIGHT = "LivingRoomLight";
    public static final String THERMOSTAT = "HallwayThermostat";
    public static final String LOCK = "FrontDoorLock";
    public static final String GARAGE = "GarageDoor";

    public void loadInitialData(SmartHomeHub hub) {
        System.out.println("Loading system data...");

        try {
            // register devices
            hub.registerDevice(new Light(LIGHT));
            hub.registerDevice(new Thermostat(THERMOSTAT));
            hub.registerDevice(new SmartLock(LOCK));
            hub.registerDevice(new GarageDoor(GARAGE));

            hub.createGroup("Downstairs", List.of(LIGHT, THERMOSTAT));

            // default scenes
            hub.createScene(new Scene("Leaving Home")
                    .addAction(SceneAction.deactivate(LIGHT))
                    .addAction(SceneAction.deactivate(THERMOSTAT))
                    .addAction(SceneAction.deactivate(LOCK))
                    .addAction(SceneAction.deactivate(GARAGE)));

            hub.createScene(new Scene("Arriving Home")
                    .addAction(SceneAction.activate(LOCK))
                    .addAction(SceneAction.activate(LIGHT))
                    .addAction(SceneAction.activate(THERMOSTAT))
                    .addAction(SceneAction.setTemperature(THERMOSTAT, 22)));

            System.out.println("System data loaded successfully.");

        } catch (Exception e) {
            System.err.println("Bootstrap Error: " + e.getMessage());
        }
    }
}
