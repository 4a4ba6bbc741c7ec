package io.smartcalc.repl.config;

import java.util.Objects;

/**
 * Configuration of the interactive shell.
 *
 * @param prompt        text printed before each line is read; empty for none
 * @param exitMessage   farewell printed on {@code /exit}
 * @param helpText      text printed on {@code /help}
 * @param loggingFormat {@code text} or {@code json}
 * @param loggingLevel  root log level (TRACE, DEBUG, INFO, WARN, ERROR)
 */
public record ReplConfig(
        String prompt, String exitMessage, String helpText, String loggingFormat, String loggingLevel) {

    public static final String DEFAULT_HELP_TEXT = "The program supports +, -, *, /, ^ and parentheses ().\n"
            + "It also supports variables and unary minus.";

    public ReplConfig {
        Objects.requireNonNull(prompt, "prompt must not be null");
        Objects.requireNonNull(exitMessage, "exitMessage must not be null");
        Objects.requireNonNull(helpText, "helpText must not be null");
        Objects.requireNonNull(loggingFormat, "loggingFormat must not be null");
        Objects.requireNonNull(loggingLevel, "loggingLevel must not be null");
    }

    /** Creates a new builder with the defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Configuration with every field at its default. */
    public static ReplConfig defaults() {
        return builder().build();
    }

    /** Builder for {@link ReplConfig}. Every field has a default. */
    public static final class Builder {
        private String prompt = "";
        private String exitMessage = "Bye!";
        private String helpText = DEFAULT_HELP_TEXT;
        private String loggingFormat = "text";
        private String loggingLevel = "WARN";

        Builder() {}

        public Builder prompt(String prompt) {
            this.prompt = prompt;
            return this;
        }

        public Builder exitMessage(String exitMessage) {
            this.exitMessage = exitMessage;
            return this;
        }

        public Builder helpText(String helpText) {
            this.helpText = helpText;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public ReplConfig build() {
            return new ReplConfig(prompt, exitMessage, helpText, loggingFormat, loggingLevel);
        }
    }
}
