package com.linkfolio.auth.infrastructure.repository;

import com.linkfolio.auth.infrastructure.entity.UserEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface UserRepository extends JpaRepository<UserEntity, UUID> {

    /* ================= HOT PATHS ================= */

    Optional<UserEntity> findByEmail(String email);

    boolean existsByEmail(String email);

    boolean existsByUsername(String username);

    /* ================= ACCOUNT STATE ================= */

    @Modifying
    @Query("""
        update UserEntity u
        set u.lastLoginAt = :now, u.updatedAt = :now
        where u.id = :userId
    """)
    int touchLastLogin(@Param("userId") UUID userId, @Param("now") Instant now);
}
