package com.pgokache.api;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.ToString;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Partial update of a saved instance. Only the display name and the password may change;
 * any other field present in the body is collected and rejected.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class InstancePatchRequest {
    @Size(min = 1, max = 128, message = "Name must be 1 to 128 characters")
    private String name;

    @Size(min = 1, message = "Password must not be empty")
    @ToString.Exclude
    private String password;

    @JsonIgnore
    private Set<String> immutableFields = new LinkedHashSet<>();

    @JsonAnySetter
    public void rejectField(String field, Object ignored) {
        immutableFields.add(field);
    }
}
