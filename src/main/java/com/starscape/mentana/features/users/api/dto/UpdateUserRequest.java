package com.starscape.mentana.features.users.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;

/**
 * Partial update; absent fields are left unchanged.
 */
public record UpdateUserRequest(
    @Size(min = 1, max = 100, message = "Name must be between 1 and 100 characters")
    String name,

    @JsonProperty("is_active")
    Boolean active
) {}
