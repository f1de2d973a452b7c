package cmdserver;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Example command set for a beacon transmitter control port.
 * Setting commands echo their argument back ("Power set to 100"); without an
 * argument they return a placeholder ("Power <example response>").
 */
public final class ExampleCommands {

    public static final String VERSION = "1.0.0";
    static final String EXAMPLE_RESPONSE = "<example response>";

    private ExampleCommands() {}

    /** Builds a dispatcher holding every example command, help last. */
    public static CommandDispatcher createDispatcher() {
        Map<String, Command> table = new LinkedHashMap<>();
        register(table);
        return new CommandDispatcher(table);
    }

    /**
     * Adds the example commands to a table.
     * The help command lists whatever the table holds at this point, itself included.
     */
    public static void register(Map<String, Command> table) {
        table.put("transmit", setting("Transmit"));
        table.put("call", setting("Call"));
        table.put("grid", setting("Grid"));
        table.put("power", setting("Power"));
        table.put("freq", setting("Freq"));
        table.put("ppm", setting("PPM"));
        table.put("selfcal", setting("SelfCal"));
        table.put("offset", setting("Offset"));
        table.put("led", setting("LED"));

        // Read-only commands ignore their argument
        table.put("port", argument -> "Port " + EXAMPLE_RESPONSE);
        table.put("xmit", argument -> "Xmit " + EXAMPLE_RESPONSE);
        table.put("version", argument -> "Version " + VERSION);

        List<String> names = new ArrayList<>(table.keySet());
        names.add(ServerConstants.HELP_COMMAND);
        String helpText = "Available commands: " + String.join(", ", names);
        table.put(ServerConstants.HELP_COMMAND, argument -> helpText);
    }

    /** A command that acknowledges a new value, or returns a placeholder when none is given. */
    static Command setting(String label) {
        return argument -> argument == null || argument.isEmpty()
                ? label + " " + EXAMPLE_RESPONSE
                : label + " set to " + argument;
    }
}
