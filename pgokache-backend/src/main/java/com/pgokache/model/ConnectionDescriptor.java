package com.pgokache.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Everything needed to open one connection to a monitored instance.
 *
 * <p>Carries the decrypted password, so instances must not outlive a single connection attempt.
 */
@Value
@Builder
public class ConnectionDescriptor {
    long instanceId;
    String host;
    int port;
    String dbname;
    String user;
    @ToString.Exclude
    String password;
    String sslMode;
}
