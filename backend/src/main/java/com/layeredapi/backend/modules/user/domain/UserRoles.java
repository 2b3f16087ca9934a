package com.layeredapi.backend.modules.user.domain;

/**
 * Role labels with meaning to the application. The column itself is free text.
 */
public final class UserRoles {

    public static final String ADMIN = "admin";
    public static final String USER = "user";

    private UserRoles() {
    }
}
