package com.pgokache.error;

/**
 * Thrown when an instance id is not known to the registry.
 */
public class InstanceNotFoundException extends PgOkacheException {
    public InstanceNotFoundException(long instanceId) {
        super(ErrorKind.NOT_FOUND, "Instance not found: " + instanceId);
    }
}
