package cmdserver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Maps command names to commands.
 * The table is copied once at construction and never changes afterwards, so it
 * is read without locking from any number of connection threads.
 */
public class CommandDispatcher implements CommandHandler {
    private final Map<String, Command> commands;

    public CommandDispatcher(Map<String, Command> commands) {
        if (commands == null) {
            throw new IllegalArgumentException("command table must not be null");
        }
        Map<String, Command> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Command> entry : commands.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isEmpty()) {
                throw new IllegalArgumentException("command name must not be empty");
            }
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("no command registered for '" + entry.getKey() + "'");
            }
            copy.put(entry.getKey(), entry.getValue());
        }
        this.commands = Collections.unmodifiableMap(copy);
    }

    @Override
    public String handleCommand(String name, String argument) {
        Command command = name != null ? commands.get(name) : null;
        if (command == null) {
            return unknownCommand(name);
        }
        return command.execute(argument != null ? argument : "");
    }

    @Override
    public Set<String> getValidCommands() {
        return commands.keySet();
    }

    /** Response for a name with no registered command. */
    public static String unknownCommand(String name) {
        return String.format(ServerConstants.UNKNOWN_COMMAND_FORMAT, name != null ? name : "");
    }
}
