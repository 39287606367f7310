package org.fixflow.dataflow.util;

/**
 * Exception type indicating a bug in the dataflow framework, in an analysis built on it, or a
 * malformed instruction stream that violates a precondition of the framework (for example
 * different stack depths at a merge point).
 *
 * <p>This is never an expected outcome. Code that merely declines to handle an instruction
 * reports this through {@link org.fixflow.dataflow.dispatch.Dispatcher#dispatch} instead.
 */
@SuppressWarnings("serial")
public class BugInDataflow extends RuntimeException {

    /**
     * Constructs a new BugInDataflow with the specified detail message.
     *
     * @param message the detail message
     */
    public BugInDataflow(String message) {
        super(message);
    }

    /**
     * Constructs a new BugInDataflow with a detail message built from a format string.
     *
     * @param fmt the format string
     * @param args the arguments for the format string
     */
    public BugInDataflow(String fmt, Object... args) {
        this(String.format(fmt, args));
    }

    /**
     * Constructs a new BugInDataflow with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause
     */
    public BugInDataflow(String message, Throwable cause) {
        super(message, cause);
    }
}
