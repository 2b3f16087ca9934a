package com.layeredapi.backend.modules.auth.presentation.dto;

import com.layeredapi.backend.global.validation.MaxUtf8Bytes;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record LoginRequest(
        @NotBlank(message = "email is required")
        @Size(max = 255, message = "email must be at most 255 characters")
        @Email(message = "email must be a valid email address") String email,

        @NotBlank(message = "password is required")
        @MaxUtf8Bytes(value = 72, message = "password must be at most 72 bytes") String password
) {
}
