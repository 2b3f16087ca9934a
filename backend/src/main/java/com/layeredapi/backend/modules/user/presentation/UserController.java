package com.layeredapi.backend.modules.user.presentation;

import java.util.List;

import com.layeredapi.backend.global.common.response.ApiEnvelope;
import com.layeredapi.backend.global.security.JwtAuthenticationPrincipal;
import com.layeredapi.backend.modules.user.application.UserService;
import com.layeredapi.backend.modules.user.presentation.dto.UpdateUserRequest;
import com.layeredapi.backend.modules.user.presentation.dto.UserListResponse;
import com.layeredapi.backend.modules.user.presentation.dto.UserResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Users")
@RestController
@RequestMapping("/users")
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    @Operation(summary = "Current user", description = "Returns the account identified by the bearer token.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "User retrieved"),
            @ApiResponse(responseCode = "401", description = "Missing or invalid token")
    })
    @GetMapping("/me")
    public ResponseEntity<ApiEnvelope<UserResponse>> currentUser(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(ApiEnvelope.ok("User retrieved successfully", userService.getById(principal.userId())));
    }

    @Operation(summary = "List users", description = "Paginated list of live users, oldest first.")
    @GetMapping
    public ResponseEntity<ApiEnvelope<List<UserResponse>>> listUsers(
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "limit", required = false) Integer limit
    ) {
        UserListResponse result = userService.list(page, limit);
        return ResponseEntity.ok(ApiEnvelope.ok("Users retrieved successfully", result.items(), result.meta()));
    }

    @Operation(summary = "Get user by id")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "User retrieved"),
            @ApiResponse(responseCode = "404", description = "User not found")
    })
    @GetMapping("/{id}")
    public ResponseEntity<ApiEnvelope<UserResponse>> getUser(@PathVariable("id") Long id) {
        return ResponseEntity.ok(ApiEnvelope.ok("User retrieved successfully", userService.getById(id)));
    }

    @Operation(summary = "Update user", description = "Applies any supplied non-empty field of name, email, password.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "User updated"),
            @ApiResponse(responseCode = "404", description = "User not found"),
            @ApiResponse(responseCode = "409", description = "Email already taken"),
            @ApiResponse(responseCode = "422", description = "Validation failed")
    })
    @PutMapping("/{id}")
    public ResponseEntity<ApiEnvelope<UserResponse>> updateUser(
            @PathVariable("id") Long id,
            @Valid @RequestBody UpdateUserRequest request
    ) {
        return ResponseEntity.ok(ApiEnvelope.ok("User updated successfully", userService.update(id, request)));
    }

    @Operation(summary = "Delete user", description = "Soft-deletes the user; the row is kept with a deletion timestamp.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "User deleted"),
            @ApiResponse(responseCode = "404", description = "User not found")
    })
    @DeleteMapping("/{id}")
    public ResponseEntity<ApiEnvelope<Void>> deleteUser(@PathVariable("id") Long id) {
        userService.delete(id);
        return ResponseEntity.ok(ApiEnvelope.ok("User deleted successfully", null));
    }
}
