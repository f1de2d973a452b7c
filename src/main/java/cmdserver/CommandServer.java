package cmdserver;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * TCP server that answers one text command per connection.
 * Owns the listening socket and the accept thread; every accepted connection is
 * handed to a {@link ConnectionHandler} on its own daemon thread.
 * All status output goes through the {@link StatusListener} given to {@link #start}.
 */
public class CommandServer implements AutoCloseable {
    private final ServerConfig config;

    // State variables
    private final AtomicReference<ServerState> state = new AtomicReference<>(ServerState.IDLE);
    private final Object socketLock = new Object();
    private ServerSocket serverSocket; // guarded by socketLock
    private volatile Thread acceptThread;
    private volatile CommandHandler commandHandler;
    private volatile StatusListener listener = StatusListener.NONE;
    private volatile int acceptThreadPriority = Thread.NORM_PRIORITY;
    private volatile boolean stopRequested = false; // stop() arrived while STARTING

    // Connection threads are detached; the set only exists for counting and optional draining
    private final Set<Thread> connectionThreads = ConcurrentHashMap.newKeySet();
    private final AtomicInteger connectionCounter = new AtomicInteger();

    public CommandServer() {
        this(ServerConfig.defaults());
    }

    public CommandServer(ServerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        this.config = config;
    }

    /**
     * Binds the listening socket and starts the accept thread.
     * @param port The port to listen on; 0 picks a free port (see {@link #getLocalPort()}).
     * @param handler The command handler every connection dispatches to.
     * @param statusListener Receives status events; null discards them.
     * @return true if the server is now running, false if it was already running,
     *         the handler was missing, or the socket could not be bound.
     */
    public boolean start(int port, CommandHandler handler, StatusListener statusListener) {
        StatusListener sink = GuardedStatusListener.guard(statusListener);
        if (handler == null) {
            sink.onStatus(Severity.ERROR, "No command handler provided; server not started.", false);
            return false;
        }
        if (port < 0 || port > ServerConstants.MAX_PORT) {
            sink.onStatus(Severity.ERROR, "Invalid port: " + port, false);
            return false;
        }
        if (!state.compareAndSet(ServerState.IDLE, ServerState.STARTING)) {
            sink.onStatus(Severity.ERROR, "Server is already running; start ignored.", false);
            return false;
        }

        stopRequested = false;
        this.listener = sink;
        this.commandHandler = handler;
        sink.onStatus(Severity.INFO, "Starting server on port: " + port, true);

        ServerSocket socket;
        try {
            socket = openServerSocket(port);
        } catch (IOException e) {
            sink.onStatus(Severity.ERROR, "Bind failed on " + config.getBindAddress() + ":" + port + ": " + e.getMessage(), false);
            state.set(ServerState.IDLE);
            return false;
        }
        synchronized (socketLock) {
            serverSocket = socket;
        }
        sink.onStatus(Severity.INFO, "Server is listening on " + config.getBindAddress() + ":" + socket.getLocalPort(), true);

        Thread t = new Thread(() -> acceptLoop(socket), "command-server-accept");
        t.setPriority(acceptThreadPriority);
        acceptThread = t;
        state.set(ServerState.RUNNING);
        t.start();

        // A stop() that arrived while binding, e.g. from a shutdown hook
        if (stopRequested) {
            sink.onStatus(Severity.WARN, "Stop requested during startup; stopping now.", false);
            stop();
            return false;
        }
        return true;
    }

    /** Creates the listening socket: address reuse, configured bind address, bounded backlog, polled accept. */
    private ServerSocket openServerSocket(int port) throws IOException {
        InetAddress address = InetAddress.getByName(config.getBindAddress());
        ServerSocket socket = createServerSocket();
        boolean bound = false;
        try {
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress(address, port), config.getBacklog());
            socket.setSoTimeout(config.getAcceptPollIntervalMillis());
            bound = true;
            return socket;
        } finally {
            if (!bound) closeServerSocket(socket);
        }
    }

    /** Unbound listening socket; overridable so tests can inject accept failures. */
    ServerSocket createServerSocket() throws IOException {
        return new ServerSocket();
    }

    /**
     * Main accept loop. Each accept waits at most one poll interval so a stop
     * request is noticed promptly; the loop ends once its socket is closed.
     */
    private void acceptLoop(ServerSocket socket) {
        StatusListener sink = listener;
        sink.onStatus(Severity.DEBUG, "Accept loop started.", true);

        try {
            while (state.get() == ServerState.RUNNING && !socket.isClosed()) {
                Socket clientSocket;
                try {
                    clientSocket = socket.accept();
                } catch (SocketTimeoutException ste) {
                    continue; // Poll interval elapsed, re-check state
                } catch (IOException e) {
                    // Expected when stop() closes the socket
                    if (state.get() != ServerState.RUNNING || socket.isClosed()) break;
                    sink.onStatus(Severity.ERROR, "Accept failed: " + e.getMessage(), false);
                    // Brief pause to prevent tight loop on persistent error
                    try { Thread.sleep(config.getAcceptPollIntervalMillis()); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); break; }
                    continue;
                }

                sink.onStatus(Severity.INFO, "Client connected: " + clientSocket.getRemoteSocketAddress(), true);
                spawnConnection(clientSocket, sink);
            }
        } finally {
            // If the loop exits while this run is still current, stop() did not end it
            if (state.get() == ServerState.RUNNING && isCurrentSocket(socket)) {
                sink.onStatus(Severity.ERROR, "Accept loop exited unexpectedly; stopping server.", false);
                stop();
            }
            sink.onStatus(Severity.INFO, "Server is shutting down.", true);
        }
    }

    private boolean isCurrentSocket(ServerSocket socket) {
        synchronized (socketLock) {
            return serverSocket == socket;
        }
    }

    private void spawnConnection(Socket clientSocket, StatusListener sink) {
        ConnectionHandler handler = new ConnectionHandler(clientSocket, commandHandler, sink, config);
        Thread t = new Thread(() -> {
            try {
                handler.run();
            } finally {
                connectionThreads.remove(Thread.currentThread());
            }
        }, "command-conn-" + connectionCounter.incrementAndGet());
        t.setDaemon(true);
        connectionThreads.add(t);
        try {
            t.start();
        } catch (RuntimeException | OutOfMemoryError e) {
            // Thread could not be created; drop this connection and keep accepting
            connectionThreads.remove(t);
            sink.onStatus(Severity.ERROR, "Could not start connection thread: " + e.getMessage(), false);
            try {
                clientSocket.close();
            } catch (IOException ce) {
                sink.onStatus(Severity.DEBUG, "Error closing client socket: " + ce.getMessage(), false);
            }
        }
    }

    /**
     * Stops accepting connections and waits for the accept thread to exit.
     * A no-op when idle or already stopping; while starting, the stop is recorded
     * and carried out by {@link #start} before it returns. Connections already accepted keep
     * running unless a shutdown drain is configured. Safe to call from any thread,
     * including the accept thread itself and JVM shutdown hooks.
     */
    public void stop() {
        while (!state.compareAndSet(ServerState.RUNNING, ServerState.STOPPING)) {
            if (state.get() != ServerState.STARTING) return;
            stopRequested = true;
            // Re-check: start() reads the flag after it leaves STARTING
            if (state.get() == ServerState.STARTING) return;
        }
        StatusListener sink = listener;
        sink.onStatus(Severity.INFO, "Stopping server.", true);

        // 1. Stop accepting new connections
        ServerSocket socket;
        synchronized (socketLock) {
            socket = serverSocket;
            serverSocket = null;
        }
        if (socket != null) {
            sink.onStatus(Severity.DEBUG, "Shutting down server socket.", true);
            closeServerSocket(socket);
        }

        // 2. Wait for the accept loop, unless we are the accept loop
        Thread t = acceptThread;
        if (t != null && t != Thread.currentThread()) {
            sink.onStatus(Severity.DEBUG, "Waiting for accept thread to exit.", true);
            try {
                t.join();
            } catch (InterruptedException ie) {
                sink.onStatus(Severity.WARN, "Interrupted while waiting for accept thread to exit.", false);
                Thread.currentThread().interrupt();
            }
        }
        acceptThread = null;

        // 3. Optionally wait for in-flight connections
        drainConnections(sink);

        state.set(ServerState.IDLE);
        sink.onStatus(Severity.INFO, "Server shutdown complete.", true);
    }

    private void drainConnections(StatusListener sink) {
        long drainMillis = config.getShutdownDrainMillis();
        if (drainMillis <= 0) {
            int inFlight = connectionThreads.size();
            if (inFlight > 0) {
                sink.onStatus(Severity.INFO, inFlight + " connection(s) still completing in the background.", true);
            }
            return;
        }

        sink.onStatus(Severity.DEBUG, "Draining " + connectionThreads.size() + " connection(s).", true);
        long deadline = System.currentTimeMillis() + drainMillis;
        List<Thread> pending = new ArrayList<>(connectionThreads);
        for (Thread t : pending) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) break;
            try {
                t.join(remaining);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        int left = connectionThreads.size();
        if (left > 0) {
            sink.onStatus(Severity.WARN, left + " connection(s) did not finish within " + drainMillis + " ms.", false);
        }
    }

    private void closeServerSocket(ServerSocket socket) {
        try {
            if (!socket.isClosed()) socket.close();
        } catch (IOException e) {
            listener.onStatus(Severity.WARN, "Error closing server socket: " + e.getMessage(), false);
        }
    }

    /** Same as {@link #stop()}, so the server can be used in try-with-resources. */
    @Override
    public void close() {
        stop();
    }

    /**
     * Sets the scheduling priority of the accept thread.
     * Applied immediately when running, otherwise on the next start. A failure is reported but never stops the server.
     * @param priority A Java thread priority between {@link Thread#MIN_PRIORITY} and {@link Thread#MAX_PRIORITY}.
     * @return true if the priority was accepted.
     */
    public boolean setSchedulingPriority(int priority) {
        StatusListener sink = listener;
        if (priority < Thread.MIN_PRIORITY || priority > Thread.MAX_PRIORITY) {
            sink.onStatus(Severity.ERROR, "Invalid accept thread priority: " + priority, false);
            return false;
        }
        acceptThreadPriority = priority;
        Thread t = acceptThread;
        if (t != null) {
            try {
                t.setPriority(priority);
            } catch (SecurityException e) {
                sink.onStatus(Severity.ERROR, "Failed to set accept thread priority: " + e.getMessage(), false);
                return false;
            }
        }
        sink.onStatus(Severity.INFO, "Accept thread priority set to " + priority, true);
        return true;
    }

    public boolean isRunning() {
        return state.get() == ServerState.RUNNING;
    }

    public ServerState getState() {
        return state.get();
    }

    /** @return The bound port, or -1 when not running. */
    public int getLocalPort() {
        synchronized (socketLock) {
            return serverSocket != null ? serverSocket.getLocalPort() : -1;
        }
    }

    /** @return Connection threads that have not finished yet. */
    public int getActiveConnectionCount() {
        return connectionThreads.size();
    }

    public int getSchedulingPriority() {
        return acceptThreadPriority;
    }

    public ServerConfig getConfig() {
        return config;
    }
}
