package com.pgokache.error;

/**
 * Thrown when talking to a monitored instance fails.
 *
 * <p>The kind is one of {@link ErrorKind#CONNECTION_ERROR}, {@link ErrorKind#AUTH_ERROR},
 * {@link ErrorKind#PERMISSION_ERROR}, {@link ErrorKind#NOT_READY} or
 * {@link ErrorKind#INTERNAL_ERROR}, as decided by {@link com.pgokache.util.SqlErrorClassifier}.
 */
public class TargetAccessException extends PgOkacheException {
    public TargetAccessException(ErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }
}
