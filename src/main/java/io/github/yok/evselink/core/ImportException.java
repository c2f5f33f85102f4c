package io.github.yok.evselink.core;

/**
 * Unchecked exception raised when an import step fails and the enclosing phase must be aborted.
 *
 * @author Yasuharu.Okawauchi
 */
public class ImportException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message description of the failure
     */
    public ImportException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and root cause.
     *
     * @param message description of the failure
     * @param cause root cause
     */
    public ImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
