package com.pgokache.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class InstanceRequest {
    @NotBlank(message = "Name is required")
    private String name;

    @NotBlank(message = "Host is required")
    private String host;

    @Min(value = 1, message = "Port must be between 1 and 65535")
    @Max(value = 65535, message = "Port must be between 1 and 65535")
    @Builder.Default
    private int port = 5432;

    @NotBlank(message = "Database name is required")
    private String dbname;

    @NotBlank(message = "User is required")
    private String user;

    @NotBlank(message = "Password is required")
    @ToString.Exclude
    private String password;

    @Pattern(regexp = "disable|allow|prefer|require|verify-ca|verify-full",
            message = "SSL mode must be one of disable, allow, prefer, require, verify-ca, verify-full")
    @Builder.Default
    private String sslMode = "prefer";
}
