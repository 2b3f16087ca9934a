package com.layeredapi.backend.modules.user.application;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Default account seeding ({@code app.seed.*}).
 *
 * @param enabled         run the seeder on startup
 * @param defaultPassword password given to every seeded account
 */
@ConfigurationProperties(prefix = "app.seed")
public record SeedProperties(
        @DefaultValue("false") boolean enabled,
        @DefaultValue("password123") String defaultPassword
) {
}
