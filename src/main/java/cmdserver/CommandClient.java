package cmdserver;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * Command line client: sends one command to a command server and prints the reply.
 * Also used programmatically to exercise a running server.
 */
public class CommandClient {
    private static final int CONNECT_TIMEOUT_MS = 2000;

    private final String serverAddress;
    private final int port;
    private final int timeoutMillis;

    public CommandClient(String serverAddress, int port) {
        this(serverAddress, port, ServerConstants.CLIENT_READ_TIMEOUT_MS);
    }

    public CommandClient(String serverAddress, int port, int timeoutMillis) {
        this.serverAddress = serverAddress;
        this.port = port;
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * Sends a single request line and reads the reply until the server closes the connection.
     * @param request The command, e.g. "power 100".
     * @return The full reply including its trailing newline; empty if the server closed without answering.
     * @throws IOException If the connection fails or times out.
     */
    public String send(String request) throws IOException {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(serverAddress, port), CONNECT_TIMEOUT_MS);
            socket.setSoTimeout(timeoutMillis);

            OutputStream out = socket.getOutputStream();
            out.write((request + "\n").getBytes(StandardCharsets.UTF_8));
            out.flush();
            socket.shutdownOutput();

            InputStream in = socket.getInputStream();
            ByteArrayOutputStream reply = new ByteArrayOutputStream();
            byte[] buffer = new byte[ServerConstants.MAX_REQUEST_BYTES];
            int n;
            while ((n = in.read(buffer)) != -1) {
                reply.write(buffer, 0, n);
            }
            return new String(reply.toByteArray(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Main method to send one command.
     * @param args Command line arguments: <command> [argument...] [--host <address>] [--port <port>]
     */
    public static void main(String[] args) {
        String host = ServerConstants.DEFAULT_BIND_ADDRESS;
        int port = ServerConstants.DEFAULT_PORT;
        StringBuilder request = new StringBuilder();

        for (int i = 0; i < args.length; i++) {
            if ("--host".equals(args[i]) && i + 1 < args.length) {
                host = args[++i];
            } else if ("--port".equals(args[i]) && i + 1 < args.length) {
                try {
                    port = Integer.parseInt(args[++i]);
                } catch (NumberFormatException e) {
                    System.err.println("Invalid port number. Using default: " + port);
                }
            } else {
                if (request.length() > 0) request.append(' ');
                request.append(args[i]);
            }
        }

        if (request.length() == 0) {
            System.out.println("Usage: java cmdserver.CommandClient <command> [argument] [--host <address>] [--port <port>]");
            request.append(ServerConstants.HELP_COMMAND);
        }

        try {
            System.out.print(new CommandClient(host, port).send(request.toString()));
        } catch (ConnectException e) {
            System.err.println("Error: Cannot connect to server at " + host + ":" + port);
            System.err.println("Make sure the server is running and the address/port are correct.");
            System.exit(1);
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }
}
