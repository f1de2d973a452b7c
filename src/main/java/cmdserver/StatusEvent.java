package cmdserver;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * A status event with a timestamp, severity, message and success flag.
 * Used by sinks that print or buffer events.
 */
public class StatusEvent {
    private static final DateTimeFormatter formatter = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final LocalDateTime timestamp;
    private final Severity severity;
    private final String message;
    private final boolean success;

    public StatusEvent(Severity severity, String message, boolean success) {
        this(LocalDateTime.now(), severity, message, success);
    }

    public StatusEvent(LocalDateTime timestamp, Severity severity, String message, boolean success) {
        if (severity == null) {
            throw new IllegalArgumentException("severity must not be null");
        }
        this.timestamp = timestamp;
        this.severity = severity;
        this.message = message != null ? message : "";
        this.success = success;
    }

    public LocalDateTime getTimestamp() { return timestamp; }
    public Severity getSeverity() { return severity; }
    public String getMessage() { return message; }
    public boolean isSuccess() { return success; }

    /**
     * Formats the event as a single log line.
     * Example: 2025-02-10 08:15:00 | INFO | Server is listening on 127.0.0.1:31415
     * Example: 2025-02-10 08:15:01 | ERROR | Bind failed on 127.0.0.1:31415: Address already in use (failed)
     */
    public String format() {
        String line = timestamp.format(formatter) + " | " + severity.name() + " | " + message;
        return success ? line : line + " (failed)";
    }

    @Override
    public String toString() {
        return format();
    }
}
