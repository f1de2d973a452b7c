package cmdserver;

import org.junit.*;
import java.io.ByteArrayInputStream;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;
import static org.junit.Assert.*;

public class ConnectionHandlerTest {
    private RecordingStatusListener status;
    private ServerConfig config;

    @Before
    public void setup() {
        status = new RecordingStatusListener();
        config = ServerConfig.defaults();
    }

    private MockSocket handle(MockSocket socket, CommandHandler handler) {
        new ConnectionHandler(socket, handler, status, config).run();
        return socket;
    }

    @Test
    public void testRequestAnsweredWithTrailingNewline() {
        MockSocket socket = handle(new MockSocket("power 100\n"), ExampleCommands.createDispatcher());
        assertEquals("Response should be the command result plus newline", "Power set to 100\n", socket.getWrittenText());
        assertEquals("Response should go out in a single write", 1, socket.getWriteCalls());
        assertTrue("Socket should be closed after the exchange", socket.isClosed());
        assertTrue("Response sent should be reported", status.contains(Severity.INFO, "Response sent"));
    }

    @Test
    public void testReadTimeoutApplied() {
        MockSocket socket = handle(new MockSocket("version"), ExampleCommands.createDispatcher());
        assertEquals("Configured read timeout should be applied", ServerConstants.CLIENT_READ_TIMEOUT_MS, socket.getSoTimeout());
        assertEquals("Version 1.0.0\n", socket.getWrittenText());
    }

    @Test
    public void testUnknownCommandIsNormalResponse() {
        MockSocket socket = handle(new MockSocket("bogus"), ExampleCommands.createDispatcher());
        assertEquals("ERROR: Unknown command 'bogus'. Type 'help' for a list of commands.\n", socket.getWrittenText());
        assertTrue(socket.isClosed());
    }

    @Test
    public void testEmptyReadSkipsDispatch() {
        AtomicInteger calls = new AtomicInteger();
        CommandHandler counting = countingHandler(calls);
        MockSocket socket = handle(new MockSocket(new ByteArrayInputStream(new byte[0])), counting);
        assertEquals("Dispatcher must not run when the client sent nothing", 0, calls.get());
        assertEquals("Nothing should be written", "", socket.getWrittenText());
        assertTrue("Socket should be closed", socket.isClosed());
    }

    @Test
    public void testSilentClientTimesOut() {
        AtomicInteger calls = new AtomicInteger();
        MockSocket socket = handle(MockSocket.silentClient(), countingHandler(calls));
        assertEquals("Dispatcher must not run after a read timeout", 0, calls.get());
        assertTrue("Socket should be closed after timeout", socket.isClosed());
        assertTrue("Timeout should be reported as a warning", status.contains(Severity.WARN, "sent nothing within"));
    }

    @Test
    public void testHandlerExceptionClosesWithoutResponse() {
        Map<String, Command> table = new HashMap<>();
        table.put("boom", argument -> { throw new IllegalStateException("kaboom"); });
        MockSocket socket = handle(new MockSocket("boom now"), new CommandDispatcher(table));
        assertEquals("No response should be written when the command fails", "", socket.getWrittenText());
        assertTrue("Socket should be closed", socket.isClosed());
        assertTrue("Failure should be reported at ERROR", status.contains(Severity.ERROR, "kaboom"));
    }

    @Test
    public void testWriteFailureClosesQuietly() {
        MockSocket socket = new MockSocket("power 5");
        socket.setFailWrites(true);
        handle(socket, ExampleCommands.createDispatcher());
        assertTrue("Socket should be closed after a failed write", socket.isClosed());
        assertFalse("No response sent event after a failed write", status.containsMessage("Response sent"));
        assertTrue("Write failure should be reported", status.contains(Severity.DEBUG, "Connection reset by peer"));
    }

    @Test
    public void testOnlyOneReadOfLimitedSize() {
        StringBuilder big = new StringBuilder("call ");
        for (int i = 0; i < 2000; i++) big.append('x');
        List<String> seen = new ArrayList<>();
        CommandHandler capturing = new CommandHandler() {
            @Override
            public String handleCommand(String name, String argument) {
                seen.add(argument);
                return "ok";
            }

            @Override
            public Set<String> getValidCommands() {
                return Collections.singleton("call");
            }
        };
        handle(new MockSocket(big.toString()), capturing);
        assertEquals("Handler should be called once", 1, seen.size());
        assertEquals("Request should be cut at the read limit", ServerConstants.MAX_REQUEST_BYTES - "call ".length(), seen.get(0).length());
    }

    @Test
    public void testParsedCommandReported() {
        handle(new MockSocket("  freq   14074000  \r\n"), ExampleCommands.createDispatcher());
        assertTrue("Parsed command should be reported", status.contains(Severity.DEBUG, "Processed command: 'freq', arg: '14074000'"));
    }

    private static CommandHandler countingHandler(AtomicInteger calls) {
        return new CommandHandler() {
            @Override
            public String handleCommand(String name, String argument) {
                calls.incrementAndGet();
                return "called";
            }

            @Override
            public Set<String> getValidCommands() {
                return Collections.emptySet();
            }
        };
    }
    @Test
    public void testThrowingListenerDoesNotEscape() throws Exception {
        StatusListener broken = (severity, message, success) -> { throw new IllegalStateException("sink down"); };
        MockSocket socket = new MockSocket("power 7");
        List<Throwable> handedOff = Collections.synchronizedList(new ArrayList<>());
        Thread t = new Thread(new ConnectionHandler(socket, ExampleCommands.createDispatcher(), broken, config));
        t.setUncaughtExceptionHandler((thread, e) -> handedOff.add(e));
        t.start();
        t.join(2000);

        assertEquals("Response should still be written", "Power set to 7\n", socket.getWrittenText());
        assertTrue("Socket should be closed", socket.isClosed());
        assertFalse("Listener failures go to the uncaught handler", handedOff.isEmpty());
        for (Throwable e : handedOff) {
            assertEquals("Only listener failures should be handed off", "sink down", e.getMessage());
        }
    }

    @Test
    public void testThrowingListenerInErrorPathDoesNotEscape() throws Exception {
        StatusListener broken = (severity, message, success) -> { throw new IllegalStateException("sink down"); };
        MockSocket socket = new MockSocket("power 7");
        socket.setFailWrites(true);
        AtomicInteger handedOff = new AtomicInteger();
        Thread t = new Thread(new ConnectionHandler(socket, ExampleCommands.createDispatcher(), broken, config));
        t.setUncaughtExceptionHandler((thread, e) -> handedOff.incrementAndGet());
        t.start();
        t.join(2000);

        assertFalse("Handler thread should finish", t.isAlive());
        assertTrue("Socket should be closed after a failed write", socket.isClosed());
        assertTrue(handedOff.get() > 0);
    }

    @Test
    public void testCommandErrorClosesWithoutResponse() {
        Map<String, Command> table = new HashMap<>();
        table.put("deep", argument -> { throw new StackOverflowError(); });
        table.put("check", argument -> { throw new AssertionError("invariant broken"); });
        CommandDispatcher dispatcher = new CommandDispatcher(table);

        MockSocket deep = handle(new MockSocket("deep"), dispatcher);
        assertEquals("No response after a StackOverflowError", "", deep.getWrittenText());
        assertTrue(deep.isClosed());
        assertTrue(status.contains(Severity.ERROR, "StackOverflowError"));

        MockSocket check = handle(new MockSocket("check"), dispatcher);
        assertTrue(check.isClosed());
        assertTrue(status.contains(Severity.ERROR, "invariant broken"));
    }
}
