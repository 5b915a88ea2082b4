package devices;

import java.util.Objects;

/**
 * GarageDoor:
 *  - open: Boolean, starts CLOSED
 */
public class GarageDoor implements Device<GarageDoor> {
    public static final String TYPE = "GARAGE_DOOR";

    private final String name;
    private boolean open;

    public GarageDoor() {
        this("Garage Door");
    }

    public GarageDoor(String name) {
        this.name = Devices.requireName(name);
        this.open = false;
    }

    public GarageDoor(GarageDoor other) {
        Objects.requireNonNull(other, "other");
        this.name = other.name;
        this.open = other.open;
    }

    @Override
    public void activate() {
        open = true;
        System.out.println("Garage Door is OPEN");
    }

    @Override
    public void deactivate() {
        open = false;
        System.out.println("Garage Door is CLOSED");
    }

    public boolean isOpen() { return open; }

    @Override
    public String getName() { return name; }

    @Override
    public String getType() { return TYPE; }

    @Override
    public GarageDoor copy() {
        return new GarageDoor(this);
    }

    @Override
    public void restore(GarageDoor snapshot) {
        this.open = snapshot.open;
    }

    @Override
    public String toString() {
        return String.format("GarageDoor{name='%s', open=%s}", name, open);
    }
}
