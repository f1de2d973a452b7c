package cmdserver;

/**
 * Defines constants for the command protocol and the server defaults.
 */
public final class ServerConstants {

    // Wire protocol
    public static final int MAX_REQUEST_BYTES = 1024;           // Largest request read from a client in one go
    public static final String RESPONSE_TERMINATOR = "\n";      // Appended to every response
    public static final String REQUEST_WHITESPACE = " \t\r\n";  // Stripped from both ends of a request
    public static final char ARGUMENT_SEPARATOR = ' ';          // Splits command name from argument
    public static final String HELP_COMMAND = "help";
    public static final String UNKNOWN_COMMAND_FORMAT = "ERROR: Unknown command '%s'. Type '" + HELP_COMMAND + "' for a list of commands.";

    // Server configuration
    public static final int DEFAULT_PORT = 31415;
    public static final String DEFAULT_BIND_ADDRESS = "127.0.0.1"; // Loopback only unless configured otherwise
    public static final int BACKLOG = 15;                       // Pending connections queued by the OS
    public static final int ACCEPT_POLL_INTERVAL_MS = 100;      // Accept wait between checks of the running state
    public static final int CLIENT_READ_TIMEOUT_MS = 5000;      // SO_TIMEOUT on accepted connections
    public static final long SHUTDOWN_DRAIN_MS = 0;             // 0 leaves connection threads detached on stop
    public static final int MIN_PORT = 1024;
    public static final int MAX_PORT = 65535;

    private ServerConstants() {}
}
