package cmdserver;

/**
 * Entry point: runs the example command set on a {@link CommandServer} until the JVM is told to stop.
 */
public class ServerMain {
    private static final long WAIT_INTERVAL_MS = 500;

    public static void main(String[] args) {
        int port = ServerConfig.parsePort(args, System.err);
        ServerConfig config;
        try {
            config = ServerConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            System.exit(1);
            return;
        }

        AsyncStatusDispatcher statusDispatcher = new AsyncStatusDispatcher(new ConsoleStatusListener(Severity.DEBUG));
        CommandServer server = new CommandServer(config);

        // Stop cleanly on Ctrl+C or SIGTERM
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            statusDispatcher.onStatus(Severity.INFO, "Shutdown hook triggered.", true);
            server.stop();
            statusDispatcher.close();
        }, "ServerShutdownHook"));

        if (!server.start(port, ExampleCommands.createDispatcher(), statusDispatcher)) {
            statusDispatcher.onStatus(Severity.FATAL, "Could not start server on " + config.getBindAddress() + ":" + port
                    + ". Address already in use?", false);
            statusDispatcher.close();
            System.exit(1);
            return;
        }

        while (server.isRunning()) {
            try {
                Thread.sleep(WAIT_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                server.stop();
            }
        }

        statusDispatcher.onStatus(Severity.INFO, "Exiting main.", true);
        statusDispatcher.close();
    }
}
