package com.layeredapi.backend.modules.user.application;

import java.util.List;

import com.layeredapi.backend.global.common.response.PageQuery;
import com.layeredapi.backend.global.error.ProblemException;
import com.layeredapi.backend.modules.user.domain.EmailAlreadyInUseException;
import com.layeredapi.backend.modules.user.domain.User;
import com.layeredapi.backend.modules.user.presentation.dto.UpdateUserRequest;
import com.layeredapi.backend.modules.user.presentation.dto.UserListResponse;
import com.layeredapi.backend.modules.user.presentation.dto.UserResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserStore userStore;
    private final PasswordEncoder passwordEncoder;

    public UserService(UserStore userStore, PasswordEncoder passwordEncoder) {
        this.userStore = userStore;
        this.passwordEncoder = passwordEncoder;
    }

    @Transactional(readOnly = true)
    public UserResponse getById(Long id) {
        return UserResponse.from(loadUser(id));
    }

    @Transactional(readOnly = true)
    public UserListResponse list(Integer page, Integer limit) {
        PageQuery query = PageQuery.of(page, limit);
        Page<User> result = userStore.list(query);
        List<UserResponse> items = result.getContent().stream()
                .map(UserResponse::from)
                .toList();
        return new UserListResponse(items, query.toMeta(result.getTotalElements()));
    }

    public UserResponse update(Long id, UpdateUserRequest request) {
        User user = loadUser(id);

        boolean emailChanges = StringUtils.hasText(request.email()) && !request.email().equals(user.getEmail());
        if (emailChanges) {
            userStore.findByEmail(request.email())
                    .filter(other -> !other.getId().equals(id))
                    .ifPresent(other -> {
                        throw emailAlreadyTaken();
                    });
        }

        if (StringUtils.hasText(request.name())) {
            user.setName(request.name());
        }
        if (emailChanges) {
            user.setEmail(request.email());
        }
        if (StringUtils.hasText(request.password())) {
            user.setPasswordHash(passwordEncoder.encode(request.password()));
        }

        try {
            return UserResponse.from(userStore.update(user));
        } catch (EmailAlreadyInUseException ex) {
            throw emailAlreadyTaken();
        }
    }

    public void delete(Long id) {
        loadUser(id);
        if (!userStore.softDelete(id)) {
            // deleted concurrently between the lookup and the update
            throw userNotFound();
        }
        log.info("Soft-deleted user id={}", id);
    }

    /**
     * Toggles the active flag. Inactive accounts keep their data but cannot log in;
     * tokens issued before deactivation stay valid until they expire.
     */
    public UserResponse setActive(Long id, boolean active) {
        User user = loadUser(id);
        if (user.isActive() != active) {
            user.setActive(active);
            user = userStore.update(user);
            log.info("User id={} active={}", id, active);
        }
        return UserResponse.from(user);
    }

    private User loadUser(Long id) {
        return userStore.findById(id).orElseThrow(UserService::userNotFound);
    }

    private static ProblemException userNotFound() {
        return ProblemException.notFound("USER_NOT_FOUND", "user not found");
    }

    private static ProblemException emailAlreadyTaken() {
        return ProblemException.conflict("EMAIL_ALREADY_TAKEN", "email already taken");
    }
}
