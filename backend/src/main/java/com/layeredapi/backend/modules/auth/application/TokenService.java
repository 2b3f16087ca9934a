package com.layeredapi.backend.modules.auth.application;

import java.time.OffsetDateTime;

/**
 * Issues and verifies self-contained identity tokens. Implementations keep no per-token state.
 */
public interface TokenService {

    IssuedToken issue(Long userId, String email, String role);

    /**
     * @throws InvalidTokenException when the signature does not match, the token is malformed or
     *                               required claims are missing, or the token has expired
     */
    ParsedToken verify(String token);

    record IssuedToken(String token, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }

    record ParsedToken(Long userId, String email, String role, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }

    class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message) {
            super(message);
        }

        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
