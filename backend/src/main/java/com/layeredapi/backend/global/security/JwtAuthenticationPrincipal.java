package com.layeredapi.backend.global.security;

/**
 * Identity decoded from a verified bearer token, available to handlers via {@code @AuthenticationPrincipal}.
 */
public record JwtAuthenticationPrincipal(Long userId, String email, String role) {
}
