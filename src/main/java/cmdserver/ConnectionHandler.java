package cmdserver;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;

/**
 * Handles one accepted connection: a single read, dispatch and write, then close.
 * Each instance runs on its own thread and owns its socket exclusively.
 */
public class ConnectionHandler implements Runnable {
    private final Socket socket;
    private final CommandHandler commandHandler;
    private final StatusListener listener;
    private final int maxRequestBytes;
    private final int readTimeoutMillis;

    public ConnectionHandler(Socket socket, CommandHandler commandHandler, StatusListener listener, ServerConfig config) {
        this.socket = socket;
        this.commandHandler = commandHandler;
        this.listener = GuardedStatusListener.guard(listener);
        this.maxRequestBytes = config.getMaxRequestBytes();
        this.readTimeoutMillis = config.getClientReadTimeoutMillis();
    }

    @Override
    public void run() {
        String remoteDesc = getClientDescription();
        try {
            String raw = readRequest();
            if (raw == null) {
                listener.onStatus(Severity.DEBUG, "Client " + remoteDesc + " closed the connection before sending a command.", false);
                return;
            }

            CommandRequest request = CommandRequest.parse(raw);
            listener.onStatus(Severity.DEBUG, "Processed command: '" + request.getName() + "', arg: '" + request.getArgument() + "'", true);

            String response;
            try {
                response = commandHandler.handleCommand(request.getName(), request.getArgument());
            } catch (RuntimeException | Error e) {
                // Includes errors such as StackOverflowError from a runaway command
                listener.onStatus(Severity.ERROR, "Command '" + request.getName() + "' failed for " + remoteDesc + ": "
                        + e.getClass().getSimpleName() + " - " + e.getMessage(), false);
                return;
            }
            if (response == null) {
                response = "";
            }
            listener.onStatus(Severity.DEBUG, "Response to client: '" + response + "'", true);

            writeResponse(response);
            listener.onStatus(Severity.INFO, "Response sent to " + remoteDesc + ".", true);

        } catch (SocketTimeoutException ste) {
            listener.onStatus(Severity.WARN, "Client " + remoteDesc + " sent nothing within " + readTimeoutMillis + " ms; closing.", false);
        } catch (IOException e) {
            listener.onStatus(Severity.DEBUG, "IOException for " + remoteDesc + ": " + e.getMessage(), false);
        } catch (RuntimeException e) {
            listener.onStatus(Severity.ERROR, "ERROR in ConnectionHandler for " + remoteDesc + ": "
                    + e.getClass().getSimpleName() + " - " + e.getMessage(), false);
        } finally {
            closeSocket(remoteDesc);
        }
    }

    /**
     * Reads at most {@code maxRequestBytes} in a single read.
     * @return The decoded request, or null when the client sent nothing.
     */
    private String readRequest() throws IOException {
        if (readTimeoutMillis > 0) {
            socket.setSoTimeout(readTimeoutMillis);
        }
        InputStream in = socket.getInputStream();
        byte[] buffer = new byte[maxRequestBytes];
        int bytesRead = in.read(buffer);
        if (bytesRead <= 0) {
            return null;
        }
        return new String(buffer, 0, bytesRead, StandardCharsets.UTF_8);
    }

    /** Writes the response plus terminator in one write; failures are not retried. */
    private void writeResponse(String response) throws IOException {
        byte[] payload = (response + ServerConstants.RESPONSE_TERMINATOR).getBytes(StandardCharsets.UTF_8);
        OutputStream out = socket.getOutputStream();
        out.write(payload);
        out.flush();
    }

    private void closeSocket(String remoteDesc) {
        try {
            if (!socket.isClosed()) socket.close();
        } catch (IOException e) {
            listener.onStatus(Severity.DEBUG, "Error closing socket for " + remoteDesc + ": " + e.getMessage(), false);
        }
    }

    /** Remote address for logging, or a placeholder when the socket has none. */
    private String getClientDescription() {
        if (socket != null && socket.getRemoteSocketAddress() != null) {
            return socket.getRemoteSocketAddress().toString();
        }
        return "unknown client";
    }
}
