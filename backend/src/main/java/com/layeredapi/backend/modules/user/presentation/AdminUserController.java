package com.layeredapi.backend.modules.user.presentation;

import com.layeredapi.backend.global.common.response.ApiEnvelope;
import com.layeredapi.backend.modules.user.application.UserService;
import com.layeredapi.backend.modules.user.presentation.dto.UpdateUserStatusRequest;
import com.layeredapi.backend.modules.user.presentation.dto.UserResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Admin-only user management. Access is restricted to the admin role by the security filter chain.
 */
@Tag(name = "Admin")
@RestController
@RequestMapping("/admin/users")
public class AdminUserController {

    private final UserService userService;

    public AdminUserController(UserService userService) {
        this.userService = userService;
    }

    @Operation(summary = "Activate or deactivate a user", description = "Inactive users cannot log in.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Status updated"),
            @ApiResponse(responseCode = "403", description = "Admin role required"),
            @ApiResponse(responseCode = "404", description = "User not found")
    })
    @PatchMapping("/{id}/status")
    public ResponseEntity<ApiEnvelope<UserResponse>> updateStatus(
            @PathVariable("id") Long id,
            @Valid @RequestBody UpdateUserStatusRequest request
    ) {
        UserResponse user = userService.setActive(id, request.active());
        return ResponseEntity.ok(ApiEnvelope.ok("User status updated successfully", user));
    }
}
