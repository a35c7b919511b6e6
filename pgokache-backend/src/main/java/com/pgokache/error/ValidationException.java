package com.pgokache.error;

/**
 * Thrown for malformed or disallowed input that bean validation cannot express.
 */
public class ValidationException extends PgOkacheException {
    public ValidationException(String message) {
        super(ErrorKind.VALIDATION_ERROR, message);
    }
}
