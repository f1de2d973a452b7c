package cmdserver;

/**
 * One parsed request: a command name and its (possibly empty) argument.
 */
public final class CommandRequest {
    private final String name;
    private final String argument;

    public CommandRequest(String name, String argument) {
        this.name = name != null ? name : "";
        this.argument = argument != null ? argument : "";
    }

    /**
     * Parses raw request text of the form {@code <command>[ <argument>]}.
     * Spaces, tabs, CR and LF are stripped from both ends of the input and of the
     * argument; whitespace inside the argument is kept as sent.
     * @param raw The decoded request text.
     * @return The parsed request; an empty name when the input was blank.
     */
    public static CommandRequest parse(String raw) {
        String input = strip(raw);
        int pos = input.indexOf(ServerConstants.ARGUMENT_SEPARATOR);
        if (pos < 0) {
            return new CommandRequest(input, "");
        }
        return new CommandRequest(input.substring(0, pos), strip(input.substring(pos + 1)));
    }

    /** Removes request whitespace from both ends; String.trim() would also eat other control characters. */
    static String strip(String s) {
        if (s == null) return "";
        int start = 0;
        int end = s.length();
        while (start < end && isRequestWhitespace(s.charAt(start))) start++;
        while (end > start && isRequestWhitespace(s.charAt(end - 1))) end--;
        return s.substring(start, end);
    }

    private static boolean isRequestWhitespace(char c) {
        return ServerConstants.REQUEST_WHITESPACE.indexOf(c) >= 0;
    }

    public String getName() { return name; }
    public String getArgument() { return argument; }
    public boolean hasArgument() { return !argument.isEmpty(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CommandRequest that = (CommandRequest) o;
        return name.equals(that.name) && argument.equals(that.argument);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + argument.hashCode();
    }

    @Override
    public String toString() {
        return "CommandRequest{" + "name='" + name + '\'' + ", argument='" + argument + '\'' + '}';
    }
}
