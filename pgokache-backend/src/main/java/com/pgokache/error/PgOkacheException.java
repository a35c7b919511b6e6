package com.pgokache.error;

/**
 * Base class for every classified failure raised by the core.
 *
 * <p>The message is meant to be shown to the operator as-is: one sentence, no driver internals
 * and never a credential.
 */
public class PgOkacheException extends RuntimeException {
    private final ErrorKind kind;

    /**
     * Create a new exception.
     *
     * @param kind error kind
     * @param message operator facing message
     */
    public PgOkacheException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Create a new exception with a cause.
     *
     * @param kind error kind
     * @param message operator facing message
     * @param cause underlying failure
     */
    public PgOkacheException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
