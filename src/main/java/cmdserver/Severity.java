package cmdserver;

/**
 * Severity attached to every status event, lowest first.
 */
public enum Severity {
    DEBUG, INFO, WARN, ERROR, FATAL;

    /** True when this severity is at least as severe as {@code minimum}. */
    public boolean isAtLeast(Severity minimum) {
        return compareTo(minimum) >= 0;
    }
}
