package com.layeredapi.backend.modules.user.presentation.dto;

import jakarta.validation.constraints.NotNull;

public record UpdateUserStatusRequest(
        @NotNull(message = "active is required") Boolean active
) {
}
