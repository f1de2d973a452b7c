package cmdserver;

import java.io.PrintStream;

/**
 * Knobs for the listening socket, accept polling and connection timeouts.
 * Immutable; use {@link #defaults()} and the {@code with*} copies to change values.
 */
public final class ServerConfig {
    private final String bindAddress;
    private final int backlog;
    private final int acceptPollIntervalMillis;
    private final int clientReadTimeoutMillis;
    private final int maxRequestBytes;
    private final long shutdownDrainMillis;

    public ServerConfig(String bindAddress, int backlog, int acceptPollIntervalMillis,
                        int clientReadTimeoutMillis, int maxRequestBytes, long shutdownDrainMillis) {
        if (bindAddress == null || bindAddress.trim().isEmpty()) {
            throw new IllegalArgumentException("bind address must not be empty");
        }
        if (backlog < 1) throw new IllegalArgumentException("backlog must be positive: " + backlog);
        if (acceptPollIntervalMillis < 1) throw new IllegalArgumentException("accept poll interval must be positive: " + acceptPollIntervalMillis);
        if (clientReadTimeoutMillis < 0) throw new IllegalArgumentException("client read timeout must not be negative: " + clientReadTimeoutMillis);
        if (maxRequestBytes < 1) throw new IllegalArgumentException("max request bytes must be positive: " + maxRequestBytes);
        if (shutdownDrainMillis < 0) throw new IllegalArgumentException("shutdown drain must not be negative: " + shutdownDrainMillis);
        this.bindAddress = bindAddress.trim();
        this.backlog = backlog;
        this.acceptPollIntervalMillis = acceptPollIntervalMillis;
        this.clientReadTimeoutMillis = clientReadTimeoutMillis;
        this.maxRequestBytes = maxRequestBytes;
        this.shutdownDrainMillis = shutdownDrainMillis;
    }

    /** Loopback bind, backlog 15, 100 ms accept polling, 5 s read timeout, detached connections. */
    public static ServerConfig defaults() {
        return new ServerConfig(
                ServerConstants.DEFAULT_BIND_ADDRESS,
                ServerConstants.BACKLOG,
                ServerConstants.ACCEPT_POLL_INTERVAL_MS,
                ServerConstants.CLIENT_READ_TIMEOUT_MS,
                ServerConstants.MAX_REQUEST_BYTES,
                ServerConstants.SHUTDOWN_DRAIN_MS
        );
    }

    public ServerConfig withBindAddress(String address) {
        return new ServerConfig(address, backlog, acceptPollIntervalMillis, clientReadTimeoutMillis, maxRequestBytes, shutdownDrainMillis);
    }

    public ServerConfig withClientReadTimeoutMillis(int millis) {
        return new ServerConfig(bindAddress, backlog, acceptPollIntervalMillis, millis, maxRequestBytes, shutdownDrainMillis);
    }

    public ServerConfig withAcceptPollIntervalMillis(int millis) {
        return new ServerConfig(bindAddress, backlog, millis, clientReadTimeoutMillis, maxRequestBytes, shutdownDrainMillis);
    }

    public ServerConfig withShutdownDrainMillis(long millis) {
        return new ServerConfig(bindAddress, backlog, acceptPollIntervalMillis, clientReadTimeoutMillis, maxRequestBytes, millis);
    }

    public String getBindAddress() { return bindAddress; }
    public int getBacklog() { return backlog; }
    public int getAcceptPollIntervalMillis() { return acceptPollIntervalMillis; }
    public int getClientReadTimeoutMillis() { return clientReadTimeoutMillis; }
    public int getMaxRequestBytes() { return maxRequestBytes; }
    public long getShutdownDrainMillis() { return shutdownDrainMillis; }

    /**
     * Reads the port from the first command line argument, falling back to the default
     * with a message on {@code warnings} when it is missing or invalid.
     */
    public static int parsePort(String[] args, PrintStream warnings) {
        int port = ServerConstants.DEFAULT_PORT;
        if (args != null && args.length > 0) {
            try {
                int parsedPort = Integer.parseInt(args[0]);
                if (parsedPort >= ServerConstants.MIN_PORT && parsedPort <= ServerConstants.MAX_PORT) {
                    port = parsedPort;
                } else {
                    warnings.println("Invalid port number: " + args[0] + ". Using default " + port + ".");
                }
            } catch (NumberFormatException e) {
                warnings.println("Invalid port argument: " + args[0] + ". Must be a number. Using default " + port + ".");
            }
        }
        return port;
    }

    /** Builds a config from {@code <port> [bindAddress]}; only the bind address is taken from the arguments. */
    public static ServerConfig fromArgs(String[] args) {
        ServerConfig config = defaults();
        if (args != null && args.length > 1) {
            config = config.withBindAddress(args[1]);
        }
        return config;
    }

    @Override
    public String toString() {
        return "ServerConfig{" + "bindAddress='" + bindAddress + '\'' + ", backlog=" + backlog
                + ", acceptPollIntervalMillis=" + acceptPollIntervalMillis
                + ", clientReadTimeoutMillis=" + clientReadTimeoutMillis
                + ", maxRequestBytes=" + maxRequestBytes
                + ", shutdownDrainMillis=" + shutdownDrainMillis + '}';
    }
}
