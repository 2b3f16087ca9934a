package com.layeredapi.backend.modules.user.application;

import java.util.List;

import com.layeredapi.backend.modules.user.domain.User;
import com.layeredapi.backend.modules.user.domain.UserRoles;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates the default admin and regular accounts when {@code app.seed.enabled=true}.
 * Accounts whose email already exists are skipped, so repeated runs are harmless.
 */
@Component
public class UserSeeder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(UserSeeder.class);

    static final List<SeedAccount> DEFAULT_ACCOUNTS = List.of(
            new SeedAccount("Admin User", "admin@example.com", UserRoles.ADMIN),
            new SeedAccount("Regular User", "user@example.com", UserRoles.USER)
    );

    private final UserStore userStore;
    private final PasswordEncoder passwordEncoder;
    private final SeedProperties properties;

    public UserSeeder(UserStore userStore, PasswordEncoder passwordEncoder, SeedProperties properties) {
        this.userStore = userStore;
        this.passwordEncoder = passwordEncoder;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.enabled()) {
            return;
        }
        seed();
    }

    /**
     * @return number of accounts created
     */
    @Transactional
    public int seed() {
        log.info("Running database seeders...");
        int created = 0;
        for (SeedAccount account : DEFAULT_ACCOUNTS) {
            if (userStore.findByEmail(account.email()).isPresent()) {
                log.info("User {} already exists, skipping", account.email());
                continue;
            }
            User user = new User();
            user.setName(account.name());
            user.setEmail(account.email());
            user.setRole(account.role());
            user.setActive(true);
            user.setPasswordHash(passwordEncoder.encode(properties.defaultPassword()));
            userStore.create(user);
            created++;
            log.info("Created user: {}", account.email());
        }
        log.info("Database seeding completed, {} user(s) created", created);
        return created;
    }

    record SeedAccount(String name, String email, String role) {
    }
}
