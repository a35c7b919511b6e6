package com.pgokache.error;

/**
 * Thrown when collection is attempted on an instance whose pg_stat_statements setup is incomplete.
 */
public class NotReadyException extends PgOkacheException {
    public NotReadyException(String message) {
        super(ErrorKind.NOT_READY, message);
    }
}
