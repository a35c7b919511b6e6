package com.pgokache.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.OffsetDateTime;

/**
 * A monitored Postgres database as saved in the registry.
 *
 * <p>Only {@code name} and the encrypted password may change after creation.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Instance {
    private long id;
    private String name;
    private String host;
    private int port;
    private String dbname;
    private String user;
    private String sslMode;
    private OffsetDateTime createdAt;

    @JsonIgnore
    @ToString.Exclude
    private byte[] passwordEnc;
}
