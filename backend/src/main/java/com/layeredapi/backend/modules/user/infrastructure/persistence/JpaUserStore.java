package com.layeredapi.backend.modules.user.infrastructure.persistence;

import java.sql.SQLException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;

import com.layeredapi.backend.global.common.response.PageQuery;
import com.layeredapi.backend.modules.user.application.UserStore;
import com.layeredapi.backend.modules.user.domain.EmailAlreadyInUseException;
import com.layeredapi.backend.modules.user.domain.User;

import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@Transactional
public class JpaUserStore implements UserStore {

    static final String LIVE_EMAIL_INDEX = "ux_users_email_live";
    private static final String UNIQUE_VIOLATION_SQL_STATE = "23505";

    private final UserRepository userRepository;
    private final Clock clock;

    public JpaUserStore(UserRepository userRepository, Clock clock) {
        this.userRepository = userRepository;
        this.clock = clock;
    }

    @Override
    public User create(User user) {
        return saveChecked(user);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<User> findById(Long id) {
        return userRepository.findLiveById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<User> findByEmail(String email) {
        return userRepository.findLiveByEmail(email);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<User> list(PageQuery query) {
        return userRepository.findAllLive(PageRequest.of(query.page() - 1, query.limit()));
    }

    @Override
    public User update(User user) {
        return saveChecked(user);
    }

    @Override
    public boolean softDelete(Long id) {
        return userRepository.softDeleteById(id, OffsetDateTime.now(clock)) > 0;
    }

    private User saveChecked(User user) {
        try {
            // flush so the unique index is checked here rather than at commit
            return userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            if (isUniqueViolation(ex)) {
                throw new EmailAlreadyInUseException(user.getEmail(), ex);
            }
            throw ex;
        }
    }

    private static boolean isUniqueViolation(DataIntegrityViolationException ex) {
        for (Throwable cause = ex; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException violation
                    && LIVE_EMAIL_INDEX.equalsIgnoreCase(violation.getConstraintName())) {
                return true;
            }
            if (cause instanceof SQLException sql && UNIQUE_VIOLATION_SQL_STATE.equals(sql.getSQLState())) {
                return true;
            }
        }
        return false;
    }
}
