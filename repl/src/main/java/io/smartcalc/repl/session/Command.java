package io.smartcalc.repl.session;

import java.util.Optional;

/** Reserved {@code /}-commands understood by the shell. */
public enum Command {
    /** Ends the session with the farewell message. */
    EXIT("/exit"),

    /** Prints the usage text. */
    HELP("/help");

    private final String text;

    Command(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    /**
     * Looks up a command by its exact (already trimmed) text.
     *
     * @return the command, or empty for unknown commands
     */
    public static Optional<Command> parse(String line) {
        for (Command command : values()) {
            if (command.text.equals(line)) {
                return Optional.of(command);
            }
        }
        return Optional.empty();
    }

    /** Returns {@code true} if {@code line} has the shape of a command (leading {@code /}). */
    public static boolean looksLikeCommand(String line) {
        return line.startsWith("/");
    }
}
