package cmdserver;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Queues status events and hands them to a delegate listener on a single worker thread.
 * Server threads only enqueue, so the delegate never needs to be thread-safe and
 * events are delivered in the order they were reported.
 */
public class AsyncStatusDispatcher implements StatusListener, AutoCloseable {
    private static final long CLOSE_TIMEOUT_SECONDS = 5;

    private final StatusListener delegate;
    private final ExecutorService worker;

    public AsyncStatusDispatcher(StatusListener delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate listener must not be null");
        }
        this.delegate = delegate;
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "status-dispatcher");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void onStatus(Severity severity, String message, boolean success) {
        try {
            worker.execute(() -> delegate.onStatus(severity, message, success));
        } catch (RejectedExecutionException e) {
            // Closed: deliver on the caller's thread so late shutdown messages still show up
            synchronized (delegate) {
                delegate.onStatus(severity, message, success);
            }
        }
    }

    /**
     * Delivers everything already queued, then stops the worker thread.
     * Events reported after this call are delivered inline.
     */
    @Override
    public void close() {
        worker.shutdown();
        try {
            if (!worker.awaitTermination(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                worker.shutdownNow();
            }
        } catch (InterruptedException ie) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isClosed() {
        return worker.isShutdown();
    }
}
