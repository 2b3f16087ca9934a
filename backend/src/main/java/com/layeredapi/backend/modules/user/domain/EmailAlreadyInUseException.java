package com.layeredapi.backend.modules.user.domain;

/**
 * Raised by the store when the live-email unique index rejects a write.
 */
public class EmailAlreadyInUseException extends RuntimeException {

    private final String email;

    public EmailAlreadyInUseException(String email, Throwable cause) {
        super("Email already in use: " + email, cause);
        this.email = email;
    }

    public String getEmail() {
        return email;
    }
}
