package cmdserver;

import java.util.Set;

/**
 * Turns a parsed request into response text.
 * The server calls this concurrently from every connection thread, so
 * implementations must be safe for concurrent use.
 */
public interface CommandHandler {

    /**
     * Handles a command received from a client.
     * @param name The command name, case-sensitive.
     * @param argument The argument, empty when none was given.
     * @return The response to send back, without the trailing newline.
     */
    String handleCommand(String name, String argument);

    /** @return The names this handler recognises. */
    Set<String> getValidCommands();
}
