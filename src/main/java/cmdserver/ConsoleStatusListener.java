package cmdserver;

import java.io.PrintStream;

/**
 * Prints status events as timestamped lines.
 * Events below the minimum severity are dropped; ERROR and FATAL go to the error stream.
 */
public class ConsoleStatusListener implements StatusListener {
    private final PrintStream out;
    private final PrintStream err;
    private final Severity minimum;

    public ConsoleStatusListener(Severity minimum) {
        this(System.out, System.err, minimum);
    }

    public ConsoleStatusListener(PrintStream out, PrintStream err, Severity minimum) {
        this.out = out;
        this.err = err != null ? err : out;
        this.minimum = minimum != null ? minimum : Severity.DEBUG;
    }

    @Override
    public synchronized void onStatus(Severity severity, String message, boolean success) {
        if (!severity.isAtLeast(minimum)) return;
        String line = new StatusEvent(severity, message, success).format();
        if (severity.isAtLeast(Severity.ERROR)) {
            err.println(line);
        } else {
            out.println(line);
        }
    }

    public Severity getMinimum() { return minimum; }
}
