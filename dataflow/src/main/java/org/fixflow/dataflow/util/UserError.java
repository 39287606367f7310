package org.fixflow.dataflow.util;

/**
 * Exception type indicating a mistake by a user of the framework: a malformed listing, a jump to
 * a label that does not exist, or an invalid command-line argument. The message should be
 * understandable without knowing the framework internals.
 */
@SuppressWarnings("serial")
public class UserError extends RuntimeException {

    /**
     * Constructs a new UserError with the specified detail message.
     *
     * @param message the detail message
     */
    public UserError(String message) {
        super(message);
    }

    /**
     * Constructs a new UserError with a detail message built from a format string.
     *
     * @param fmt the format string
     * @param args the arguments for the format string
     */
    public UserError(String fmt, Object... args) {
        this(String.format(fmt, args));
    }
}
