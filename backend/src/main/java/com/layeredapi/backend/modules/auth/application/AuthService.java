package com.layeredapi.backend.modules.auth.application;

import com.layeredapi.backend.global.error.ProblemException;
import com.layeredapi.backend.modules.auth.application.TokenService.IssuedToken;
import com.layeredapi.backend.modules.auth.presentation.dto.LoginRequest;
import com.layeredapi.backend.modules.auth.presentation.dto.LoginResponse;
import com.layeredapi.backend.modules.auth.presentation.dto.RegisterRequest;
import com.layeredapi.backend.modules.user.application.UserStore;
import com.layeredapi.backend.modules.user.domain.EmailAlreadyInUseException;
import com.layeredapi.backend.modules.user.domain.User;
import com.layeredapi.backend.modules.user.domain.UserRoles;
import com.layeredapi.backend.modules.user.presentation.dto.UserResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final String INVALID_CREDENTIALS = "invalid email or password";

    private final UserStore userStore;
    private final PasswordEncoder passwordEncoder;
    private final TokenService tokenService;

    public AuthService(UserStore userStore, PasswordEncoder passwordEncoder, TokenService tokenService) {
        this.userStore = userStore;
        this.passwordEncoder = passwordEncoder;
        this.tokenService = tokenService;
    }

    public UserResponse register(RegisterRequest request) {
        // Fast path only; the unique index decides concurrent registrations
        if (userStore.findByEmail(request.email()).isPresent()) {
            throw emailAlreadyRegistered();
        }

        User user = new User();
        user.setName(request.name());
        user.setEmail(request.email());
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setRole(UserRoles.USER);
        user.setActive(true);

        User saved;
        try {
            saved = userStore.create(user);
        } catch (EmailAlreadyInUseException ex) {
            log.info("Registration lost a race on email {}", request.email());
            throw emailAlreadyRegistered();
        }

        log.info("Registered user id={} email={}", saved.getId(), saved.getEmail());
        return UserResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public LoginResponse login(LoginRequest request) {
        User user = userStore.findByEmail(request.email())
                .orElseThrow(() -> ProblemException.unauthorized("INVALID_CREDENTIALS", INVALID_CREDENTIALS));

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw ProblemException.unauthorized("INVALID_CREDENTIALS", INVALID_CREDENTIALS);
        }

        if (!user.isActive()) {
            throw ProblemException.forbidden("USER_INACTIVE", "account is not active");
        }

        IssuedToken token = tokenService.issue(user.getId(), user.getEmail(), user.getRole());
        return new LoginResponse(token.token(), token.expiresAt(), UserResponse.from(user));
    }

    private static ProblemException emailAlreadyRegistered() {
        return ProblemException.conflict("EMAIL_ALREADY_REGISTERED", "email already registered");
    }
}
