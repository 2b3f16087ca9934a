package com.layeredapi.backend.modules.user.application;

import java.util.Optional;

import com.layeredapi.backend.global.common.response.PageQuery;
import com.layeredapi.backend.modules.user.domain.EmailAlreadyInUseException;
import com.layeredapi.backend.modules.user.domain.User;

import org.springframework.data.domain.Page;

/**
 * Persistence operations for {@link User}. Reads never return soft-deleted rows.
 */
public interface UserStore {

    /**
     * @throws EmailAlreadyInUseException if a live user already owns the email
     */
    User create(User user);

    Optional<User> findById(Long id);

    Optional<User> findByEmail(String email);

    /**
     * Live users in insertion order, with the total live count.
     */
    Page<User> list(PageQuery query);

    /**
     * @throws EmailAlreadyInUseException if the new email is owned by another live user
     */
    User update(User user);

    /**
     * @return false when no live row had this id
     */
    boolean softDelete(Long id);
}
