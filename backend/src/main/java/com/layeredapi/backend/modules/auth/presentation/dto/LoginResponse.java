package com.layeredapi.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

import com.layeredapi.backend.modules.user.presentation.dto.UserResponse;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LoginResponse(
        String token,
        @JsonProperty("expires_at") OffsetDateTime expiresAt,
        UserResponse user
) {
}
