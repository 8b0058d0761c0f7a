package com.flagship.ad_escrow.command.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ad_escrow.user.UserRole;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class RegisterUserRequest {

    @NotNull(message = "External id is required")
    @Positive(message = "External id must be positive")
    @JsonProperty("external_id")
    Long externalId;

    @Size(max = 255, message = "Username must be at most 255 characters")
    @JsonProperty("username")
    String username;

    @NotNull(message = "Role is required")
    @JsonProperty("role")
    UserRole role;
}
