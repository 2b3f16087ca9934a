package com.layeredapi.backend.modules.user.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;

import com.layeredapi.backend.modules.user.domain.User;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserRepository extends JpaRepository<User, Long> {

    @Query("select u from User u where u.id = :id and u.deletedAt is null")
    Optional<User> findLiveById(@Param("id") Long id);

    @Query("select u from User u where u.email = :email and u.deletedAt is null")
    Optional<User> findLiveByEmail(@Param("email") String email);

    @Query(
            value = "select u from User u where u.deletedAt is null order by u.id",
            countQuery = "select count(u) from User u where u.deletedAt is null"
    )
    Page<User> findAllLive(Pageable pageable);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update User u
               set u.deletedAt = :deletedAt,
                   u.updatedAt = :deletedAt
             where u.id = :id
               and u.deletedAt is null
            """)
    int softDeleteById(@Param("id") Long id, @Param("deletedAt") OffsetDateTime deletedAt);
}
