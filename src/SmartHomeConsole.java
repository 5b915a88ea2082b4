import hub.*;
import exceptions.*;

import java.util.Scanner;

public class SmartHomeConsole {

    private static final String HELP = "Commands: list, on <device>, off <device>, temp <device> <value>, "
            + "group on|off <group>, scene <name>, help, exit";

    private final SmartHomeHub hub;
    private final Scanner scanner;

    public SmartHomeConsole(SmartHomeHub hub, Scanner scanner) {
        this.hub = hub;
        this.scanner = scanner;
    }

    public void start() {
        System.out.println("=== Smart Home Device Controls ===");
        System.out.println(HELP);
        boolean running = true;
        while (running) {
            System.out.print("Home > ");
            if (!scanner.hasNextLine()) {
                break;
            }
            running = handleCommand(scanner.nextLine());
        }
        System.out.println("Bye.");
    }

    /**
     * Runs one command line. Returns false when the console should stop.
     */
    public boolean handleCommand(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) return true;

        String[] parts = trimmed.split("\\s+", 2);
        String cmd = parts[0].toLowerCase();
        String arg = parts.length > 1 ? parts[1].trim() : "";

        try {
            switch (cmd) {
                case "list":
                    hub.getAllDevices().forEach(d -> System.out.println(d));
                    break;
                case "on":
                    if (arg.isEmpty()) System.out.println("Usage: on <device>");
                    else hub.activate(arg);
                    break;
                case "off":
                    if (arg.isEmpty()) System.out.println("Usage: off <device>");
                    else hub.deactivate(arg);
                    break;
                case "temp":
                    handleTemperatureCommand(arg);
                    break;
                case "group":
                    handleGroupCommand(arg);
                    break;
                case "scene":
                    if (arg.isEmpty()) System.out.println("Usage: scene <name>");
                    else hub.executeScene(arg);
                    break;
                case "help":
                    System.out.println(HELP);
                    break;
                case "exit":
                    return false;
                default:
                    System.out.println("Unknown command.");
            }
        } catch (ExecutionException e) {
            System.out.println("Error: " + e.getMessage());
        }
        return true;
    }

    private void handleTemperatureCommand(String args) throws ExecutionException {
        // device names may contain spaces, the value is the last token
        int split = args.lastIndexOf(' ');
        if (split < 0) {
            System.out.println("Usage: temp <device> <value>");
            return;
        }
        String deviceName = args.substring(0, split).trim();
        String value = args.substring(split + 1);

        int temperature;
        try {
            temperature = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            System.out.println("Error: Invalid number format for value '" + value + "'");
            return;
        }
        hub.setTemperature(deviceName, temperature);
    }

    private void handleGroupCommand(String args) throws ExecutionException {
        String[] parts = args.split("\\s+", 2);
        if (parts.length < 2) {
            System.out.println("Usage: group on|off <group>");
            return;
        }
        switch (parts[0].toLowerCase()) {
            case "on":
                hub.activateGroup(parts[1]);
                break;
            case "off":
                hub.deactivateGroup(parts[1]);
                break;
            default:
                System.out.println("Usage: group on|off <group>");
        }
    }

    public static void main(String[] args) {
        if (args.length > 0 && args[0].equals("--self-check")) {
            DeviceSelfCheck.main(new String[0]);
            return;
        }
        SmartHomeHub hub = new SmartHomeHub();
        new SmartHomeBootstrap().loadInitialData(hub);
        new SmartHomeConsole(hub, new Scanner(System.in)).start();
    }
}
