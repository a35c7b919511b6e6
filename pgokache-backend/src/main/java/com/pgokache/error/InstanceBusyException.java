package com.pgokache.error;

/**
 * Thrown when a check or collection is already running against the same instance.
 */
public class InstanceBusyException extends PgOkacheException {
    public InstanceBusyException(long instanceId) {
        super(ErrorKind.INSTANCE_BUSY,
                "Another setup check or collection is already running for instance " + instanceId + ".");
    }
}
