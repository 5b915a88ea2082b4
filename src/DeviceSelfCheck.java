import devices.*;

/**
 * Runs every device through its on/off cycle and checks the observable state
 * after each step. The first failed check throws, so {@link #main(String[])}
 * exits with a non-zero status.
 */
public class DeviceSelfCheck {

    public void run() {
        // light
        Light light = new Light();
        check(!light.isOn(), "light starts off");
        DeviceControl.turnOn(light);
        check(light.isOn(), "light is on after activate");
        DeviceControl.turnOff(light);
        check(!light.isOn(), "light is off after deactivate");

        // thermostat
        Thermostat thermostat = new Thermostat();
        check(thermostat.getTemperature() == Thermostat.DEFAULT_TEMPERATURE, "thermostat starts at 20");
        DeviceControl.turnOn(thermostat);
        thermostat.setTemperature(25);
        check(thermostat.getTemperature() == 25, "thermostat accepts 25 while on");
        DeviceControl.turnOff(thermostat);
        thermostat.setTemperature(30);
        check(thermostat.getTemperature() == 25, "thermostat ignores changes while off");

        // smart lock
        SmartLock lock = new SmartLock();
        check(lock.isLocked(), "lock starts locked");
        DeviceControl.turnOn(lock);
        check(!lock.isLocked(), "lock is unlocked after activate");
        DeviceControl.turnOff(lock);
        check(lock.isLocked(), "lock is locked after deactivate");

        // garage door
        GarageDoor garageDoor = new GarageDoor();
        check(!garageDoor.isOpen(), "garage door starts closed");
        DeviceControl.turnOn(garageDoor);
        check(garageDoor.isOpen(), "garage door is open after activate");
        DeviceControl.turnOff(garageDoor);
        check(!garageDoor.isOpen(), "garage door is closed after deactivate");
    }

    static void check(boolean condition, String description) {
        if (!condition) {
            throw new IllegalStateException("Self-check failed: " + description);
        }
    }

    public static void main(String[] args) {
        new DeviceSelfCheck().run();
        System.out.println("All device checks passed.");
    }
}
