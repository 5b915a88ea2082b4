package devices;

final class Devices {

    private Devices() {
    }

    static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Device name must not be blank");
        }
        return name;
    }
}
