package com.layeredapi.backend.modules.user;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Optional;

import com.layeredapi.backend.global.error.ProblemException;
import com.layeredapi.backend.modules.user.application.UserService;
import com.layeredapi.backend.modules.user.application.UserStore;
import com.layeredapi.backend.modules.user.domain.EmailAlreadyInUseException;
import com.layeredapi.backend.modules.user.domain.User;
import com.layeredapi.backend.modules.user.presentation.dto.UpdateUserRequest;
import com.layeredapi.backend.modules.user.presentation.dto.UserListResponse;
import com.layeredapi.backend.modules.user.presentation.dto.UserResponse;
import com.layeredapi.backend.support.InMemoryUserStore;
import com.layeredapi.backend.support.TestUsers;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

class UserServiceTest {

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);
    private InMemoryUserStore userStore;
    private UserService userService;

    @BeforeEach
    void setUp() {
        userStore = new InMemoryUserStore();
        userService = new UserService(userStore, passwordEncoder);
    }

    @Test
    void getByIdOfMissingUserIsNotFound() {
        assertThatThrownBy(() -> userService.getById(99L))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
                    assertThat(ex.getDetailMessage()).isEqualTo("user not found");
                });
    }

    @Test
    void listPagesThroughLiveUsersInInsertionOrder() {
        for (int i = 1; i <= 25; i++) {
            store("User " + i, "user" + i + "@example.com");
        }

        UserListResponse first = userService.list(1, 10);
        assertThat(first.items()).hasSize(10);
        assertThat(first.items().get(0).email()).isEqualTo("user1@example.com");
        assertThat(first.meta().currentPage()).isEqualTo(1);
        assertThat(first.meta().perPage()).isEqualTo(10);
        assertThat(first.meta().total()).isEqualTo(25);
        assertThat(first.meta().totalPages()).isEqualTo(3);

        UserListResponse last = userService.list(3, 10);
        assertThat(last.items()).hasSize(5);
        assertThat(last.items().get(0).email()).isEqualTo("user21@example.com");
    }

    @Test
    void listNormalizesMissingAndOutOfRangeParameters() {
        store("Alice", "alice@example.com");

        UserListResponse defaults = userService.list(null, null);
        assertThat(defaults.meta().currentPage()).isEqualTo(1);
        assertThat(defaults.meta().perPage()).isEqualTo(10);

        UserListResponse clamped = userService.list(0, 500);
        assertThat(clamped.meta().currentPage()).isEqualTo(1);
        assertThat(clamped.meta().perPage()).isEqualTo(100);
        assertThat(clamped.items()).hasSize(1);
    }

    @Test
    void updateAppliesOnlySuppliedFields() {
        User alice = store("Alice", "alice@example.com");
        String originalHash = alice.getPasswordHash();

        UserResponse updated = userService.update(alice.getId(), new UpdateUserRequest("", "alice@new.example.com", null));

        assertThat(updated.name()).isEqualTo("Alice");
        assertThat(updated.email()).isEqualTo("alice@new.example.com");
        assertThat(userStore.findById(alice.getId())).get()
                .extracting(User::getPasswordHash)
                .isEqualTo(originalHash);
    }

    @Test
    void blankFieldsAreTreatedAsAbsent() {
        User alice = store("Alice", "alice@example.com");
        String originalHash = alice.getPasswordHash();

        UserResponse updated = userService.update(alice.getId(), new UpdateUserRequest("   ", "  ", "       "));

        assertThat(updated.name()).isEqualTo("Alice");
        assertThat(updated.email()).isEqualTo("alice@example.com");
        assertThat(userStore.findById(alice.getId()).orElseThrow().getPasswordHash()).isEqualTo(originalHash);
    }

    @Test
    void updatePasswordStoresNewHash() {
        User alice = store("Alice", "alice@example.com");

        userService.update(alice.getId(), new UpdateUserRequest(null, null, "brand-new-pass"));

        String hash = userStore.findById(alice.getId()).orElseThrow().getPasswordHash();
        assertThat(hash).isNotEqualTo("brand-new-pass");
        assertThat(passwordEncoder.matches("brand-new-pass", hash)).isTrue();
    }

    @Test
    void updateToEmailOwnedByAnotherUserConflictsAndLeavesRowUntouched() {
        User alice = store("Alice", "alice@example.com");
        store("Bob", "bob@example.com");

        assertThatThrownBy(() -> userService.update(alice.getId(), new UpdateUserRequest("Alicia", "bob@example.com", null)))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getDetailMessage()).isEqualTo("email already taken");
                });

        User reloaded = userStore.findById(alice.getId()).orElseThrow();
        assertThat(reloaded.getName()).isEqualTo("Alice");
        assertThat(reloaded.getEmail()).isEqualTo("alice@example.com");
    }

    @Test
    void updateKeepingOwnEmailIsNotAConflict() {
        User alice = store("Alice", "alice@example.com");

        UserResponse updated = userService.update(alice.getId(), new UpdateUserRequest("Alicia", "alice@example.com", null));

        assertThat(updated.name()).isEqualTo("Alicia");
    }

    @Test
    void storeConflictDuringUpdateIsReportedAsTaken() {
        UserStore racingStore = mock(UserStore.class);
        User alice = TestUsers.user(1L, "Alice", "alice@example.com", "hash");
        when(racingStore.findById(1L)).thenReturn(Optional.of(alice));
        when(racingStore.findByEmail("carol@example.com")).thenReturn(Optional.empty());
        when(racingStore.update(any(User.class))).thenThrow(new EmailAlreadyInUseException("carol@example.com", null));

        UserService service = new UserService(racingStore, passwordEncoder);

        assertThatThrownBy(() -> service.update(1L, new UpdateUserRequest(null, "carol@example.com", null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("EMAIL_ALREADY_TAKEN"));
    }

    @Test
    void deletedUserDisappearsButRowIsKept() {
        User alice = store("Alice", "alice@example.com");

        userService.delete(alice.getId());

        assertThatThrownBy(() -> userService.getById(alice.getId())).isInstanceOf(ProblemException.class);
        assertThat(userService.list(1, 10).items()).isEmpty();
        assertThat(userStore.allRows())
                .singleElement()
                .satisfies(row -> assertThat(row.getDeletedAt()).isNotNull());
    }

    @Test
    void deletingTwiceIsNotFound() {
        User alice = store("Alice", "alice@example.com");
        userService.delete(alice.getId());

        assertThatThrownBy(() -> userService.delete(alice.getId()))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND));
    }

    @Test
    void setActiveTogglesFlag() {
        User alice = store("Alice", "alice@example.com");

        UserResponse deactivated = userService.setActive(alice.getId(), false);
        assertThat(deactivated.active()).isFalse();

        UserResponse reactivated = userService.setActive(alice.getId(), true);
        assertThat(reactivated.active()).isTrue();
    }

    private User store(String name, String email) {
        User user = new User();
        user.setName(name);
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode("secret1"));
        return userStore.create(user);
    }
}
