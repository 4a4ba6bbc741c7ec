package io.smartcalc.repl.config;

/**
 * The shell configuration could not be read: an explicit {@code --config} file is missing, the
 * YAML does not parse, or its root is not a mapping. Ends startup before the first prompt.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    /** @param cause the I/O or YAML parser failure */
    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
