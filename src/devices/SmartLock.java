package devices;

import java.util.Objects;

/**
 * SmartLock:
 *  - locked: Boolean, starts LOCKED
 * Activating the lock unlocks it.
 */
public class SmartLock implements Device<SmartLock> {
    public static final String TYPE = "LOCK";

    private final String name;
    private boolean locked;

    public SmartLock() {
        this("Smart Lock");
    }

    public SmartLock(String name) {
        this.name = Devices.requireName(name);
        this.locked = true;
    }

    public SmartLock(SmartLock other) {
        Objects.requireNonNull(other, "other");
        this.name = other.name;
        this.locked = other.locked;
    }

    @Override
    public void activate() {
        locked = false;
        System.out.println("Smart Lock is UNLOCKED");
    }

    @Override
    public void deactivate() {
        locked = true;
        System.out.println("Smart Lock is LOCKED");
    }

    public boolean isLocked() { return locked; }

    @Override
    public String getName() { return name; }

    @Override
    public String getType() { return TYPE; }

    @Override
    public SmartLock copy() {
        return new SmartLock(this);
    }

    @Override
    public void restore(SmartLock snapshot) {
        this.locked = snapshot.locked;
    }

    @Override
    public String toString() {
        return String.format("SmartLock{name='%s', locked=%s}", name, locked);
    }
}
