package com.pgokache.error;

/**
 * Thrown when an operator tries to move a recommendation out of a terminal status.
 */
public class InvalidTransitionException extends PgOkacheException {
    public InvalidTransitionException(String message) {
        super(ErrorKind.INVALID_TRANSITION, message);
    }
}
