package devices;

import java.util.Objects;

/**
 * Light:
 *  - on: Boolean (true=ON, false=OFF), starts OFF
 */
public class Light implements Device<Light> {
    public static final String TYPE = "LIGHT";

    private final String name;
    private boolean on;

    public Light() {
        this("Light");
    }

    public Light(String name) {
        this.name = Devices.requireName(name);
        this.on = false;
    }

    public Light(Light other) {
        Objects.requireNonNull(other, "other");
        this.name = other.name;
        this.on = other.on;
    }

    @Override
    public void activate() {
        on = true;
        System.out.println("Light is ON");
    }

    @Override
    public void deactivate() {
        on = false;
        System.out.println("Light is OFF");
    }

    public boolean isOn() { return on; }

    @Override
    public String getName() { return name; }

    @Override
    public String getType() { return TYPE; }

    @Override
    public Light copy() {
        return new Light(this);
    }

    @Override
    public void restore(Light snapshot) {
        this.on = snapshot.on;
    }

    @Override
    public String toString() {
        return String.format("Light{name='%s', on=%s}", name, on);
    }
}
