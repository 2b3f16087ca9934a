package com.layeredapi.backend.modules.user.presentation.dto;

import com.layeredapi.backend.global.validation.MaxUtf8Bytes;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Partial update. Absent, empty or blank fields are left unchanged.
 */
public record UpdateUserRequest(
        @Pattern(regexp = "^$|^.{2,100}$", message = "name must be between 2 and 100 characters") String name,

        @Size(max = 255, message = "email must be at most 255 characters")
        @Email(message = "email must be a valid email address") String email,

        @Pattern(regexp = "^$|^.{6,}$", message = "password must be at least 6 characters")
        @MaxUtf8Bytes(value = 72, message = "password must be at most 72 bytes") String password
) {
}
