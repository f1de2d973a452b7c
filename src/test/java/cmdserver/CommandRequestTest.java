package cmdserver;

import org.junit.*;
import static org.junit.Assert.*;

public class CommandRequestTest {

    @Test
    public void testCommandWithArgument() {
        CommandRequest request = CommandRequest.parse("power 100");
        assertEquals("power", request.getName());
        assertEquals("100", request.getArgument());
        assertTrue("Argument should be present", request.hasArgument());
    }

    @Test
    public void testCommandWithoutArgument() {
        CommandRequest request = CommandRequest.parse("power\r\n");
        assertEquals("power", request.getName());
        assertEquals("Missing argument should be empty", "", request.getArgument());
        assertFalse(request.hasArgument());
    }

    @Test
    public void testIrregularWhitespace() {
        CommandRequest request = CommandRequest.parse("  freq   14074000  ");
        assertEquals("Command name should be the first token", "freq", request.getName());
        assertEquals("Argument should lose its padding", "14074000", request.getArgument());
    }

    @Test
    public void testTabsAndLineEndingsStripped() {
        assertEquals(new CommandRequest("grid", "FN20"), CommandRequest.parse("\t grid FN20\r\n"));
    }

    @Test
    public void testInnerArgumentWhitespacePreserved() {
        CommandRequest request = CommandRequest.parse("call AB1CD   portable\n");
        assertEquals("call", request.getName());
        assertEquals("Whitespace inside the argument must be preserved", "AB1CD   portable", request.getArgument());
    }

    @Test
    public void testSplitOnlyOnSpace() {
        // A tab is not the separator; it stays part of the name
        CommandRequest request = CommandRequest.parse("led\ton");
        assertEquals("led\ton", request.getName());
        assertEquals("", request.getArgument());
    }

    @Test
    public void testBlankInput() {
        CommandRequest request = CommandRequest.parse(" \r\n\t ");
        assertEquals("Blank input should give an empty name", "", request.getName());
        assertEquals("", request.getArgument());
        assertEquals("Null input should parse like blank input", request, CommandRequest.parse(null));
    }

    @Test
    public void testOtherControlCharactersKept() {
        // Only space, tab, CR and LF are stripped
        assertEquals("\u0000power", CommandRequest.parse("\u0000power").getName());
    }
}
