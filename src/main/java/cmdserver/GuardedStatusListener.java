package cmdserver;

/**
 * Wraps a status listener so that a listener failure never reaches server code.
 * A {@link RuntimeException} thrown by the delegate is handed to the current
 * thread's uncaught exception handler and the caller carries on.
 */
final class GuardedStatusListener implements StatusListener {
    private final StatusListener delegate;

    private GuardedStatusListener(StatusListener delegate) {
        this.delegate = delegate;
    }

    /** Guards a listener; null becomes {@link StatusListener#NONE}, an already guarded listener is returned as is. */
    static StatusListener guard(StatusListener listener) {
        if (listener == null) return StatusListener.NONE;
        if (listener == StatusListener.NONE || listener instanceof GuardedStatusListener) return listener;
        return new GuardedStatusListener(listener);
    }

    @Override
    public void onStatus(Severity severity, String message, boolean success) {
        try {
            delegate.onStatus(severity, message, success);
        } catch (RuntimeException e) {
            Thread current = Thread.currentThread();
            current.getUncaughtExceptionHandler().uncaughtException(current, e);
        }
    }
}
