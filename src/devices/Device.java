package devices;

/**
 * Capability set shared by every device.
 * <p>
 * The type parameter is the implementing class itself, so {@link #copy()} and
 * {@link #restore(Device)} stay typed to the concrete device and callers going
 * through {@link DeviceControl} never need a cast.
 *
 * @param <D> the concrete device type
 */
public interface Device<D extends Device<D>> {

    void activate();

    void deactivate();

    String getName();

    String getType();

    /**
     * Independent copy with the same name and state.
     */
    D copy();

    /**
     * Overwrites this device's state with the snapshot's. Prints nothing.
     */
    void restore(D snapshot);
}
