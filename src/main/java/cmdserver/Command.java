package cmdserver;

/**
 * A single named command.
 * (Command Pattern Interface)
 */
@FunctionalInterface
public interface Command {
    /**
     * Executes the command.
     * Implementations only look at their argument; they never touch the connection.
     * @param argument The text after the command name, empty when none was given.
     * @return The response text, without the trailing newline.
     */
    String execute(String argument);
}
