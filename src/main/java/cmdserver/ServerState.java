package cmdserver;

/**
 * Lifecycle of a {@link CommandServer}: IDLE -> STARTING -> RUNNING -> STOPPING -> IDLE.
 */
public enum ServerState {
    IDLE, STARTING, RUNNING, STOPPING
}
