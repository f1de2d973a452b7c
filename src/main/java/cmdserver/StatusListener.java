package cmdserver;

/**
 * Observer for server status events.
 * Called synchronously from whichever thread produced the event (accept thread,
 * connection thread, or the caller of start/stop), so implementations must be
 * thread-safe and return quickly. Wrap a slow sink in {@link AsyncStatusDispatcher}.
 */
@FunctionalInterface
public interface StatusListener {

    /** Listener that discards every event. */
    StatusListener NONE = (severity, message, success) -> { };

    /**
     * Receives one status event.
     * @param severity The event severity.
     * @param message Human readable description.
     * @param success Whether the reported operation succeeded.
     */
    void onStatus(Severity severity, String message, boolean success);
}
