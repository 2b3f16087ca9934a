package com.layeredapi.backend.modules.user;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import java.sql.SQLException;
import java.time.Clock;

import com.layeredapi.backend.modules.user.domain.EmailAlreadyInUseException;
import com.layeredapi.backend.modules.user.domain.User;
import com.layeredapi.backend.modules.user.infrastructure.persistence.JpaUserStore;
import com.layeredapi.backend.modules.user.infrastructure.persistence.UserRepository;

import org.hibernate.exception.ConstraintViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
class JpaUserStoreTest {

    @Mock
    private UserRepository userRepository;

    private JpaUserStore userStore;

    @BeforeEach
    void setUp() {
        userStore = new JpaUserStore(userRepository, Clock.systemUTC());
    }

    @Test
    void uniqueViolationBecomesEmailAlreadyInUse() {
        SQLException duplicate = new SQLException("duplicate key value violates unique constraint", "23505");
        when(userRepository.saveAndFlush(any(User.class)))
                .thenThrow(new DataIntegrityViolationException("could not execute statement", duplicate));

        assertThatThrownBy(() -> userStore.create(user("alice@example.com")))
                .isInstanceOf(EmailAlreadyInUseException.class);
    }

    @Test
    void namedLiveEmailIndexViolationBecomesEmailAlreadyInUse() {
        ConstraintViolationException violation = new ConstraintViolationException(
                "could not execute statement", new SQLException("duplicate key"), "ux_users_email_live");
        when(userRepository.saveAndFlush(any(User.class)))
                .thenThrow(new DataIntegrityViolationException("could not execute statement", violation));

        assertThatThrownBy(() -> userStore.update(user("alice@example.com")))
                .isInstanceOf(EmailAlreadyInUseException.class);
    }

    @Test
    void otherIntegrityErrorsPropagateUnchanged() {
        SQLException tooLong = new SQLException("value too long for type character varying(255)", "22001");
        DataIntegrityViolationException failure = new DataIntegrityViolationException("could not execute statement", tooLong);
        when(userRepository.saveAndFlush(any(User.class))).thenThrow(failure);

        assertThatThrownBy(() -> userStore.create(user("alice@example.com")))
                .isSameAs(failure);
    }

    private static User user(String email) {
        User user = new User();
        user.setName("Alice");
        user.setEmail(email);
        user.setPasswordHash("hash");
        return user;
    }
}
