package com.layeredapi.backend.modules.user.presentation.dto;

import java.time.OffsetDateTime;

import com.layeredapi.backend.modules.user.domain.User;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Public view of a user. The password hash is never part of it.
 */
public record UserResponse(
        Long id,
        String name,
        String email,
        String role,
        @JsonProperty("is_active") boolean active,
        @JsonProperty("created_at") OffsetDateTime createdAt,
        @JsonProperty("updated_at") OffsetDateTime updatedAt
) {

    public static UserResponse from(User user) {
        return new UserResponse(
                user.getId(),
                user.getName(),
                user.getEmail(),
                user.getRole(),
                user.isActive(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}
