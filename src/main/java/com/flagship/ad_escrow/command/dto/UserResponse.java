package com.flagship.ad_escrow.command.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ad_escrow.user.User;
import com.flagship.ad_escrow.user.UserRole;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class UserResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("external_id")
    long externalId;

    @JsonProperty("username")
    String username;

    @JsonProperty("role")
    UserRole role;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("balance")
    long balance;

    @JsonProperty("created_at")
    Instant createdAt;

    public static UserResponse from(User user) {
        return UserResponse.builder()
            .id(user.getId())
            .externalId(user.getExternalId())
            .username(user.getUsername())
            .role(user.getRole())
            .active(user.isActive())
            .balance(user.getBalance())
            .createdAt(user.getCreatedAt())
            .build();
    }
}
