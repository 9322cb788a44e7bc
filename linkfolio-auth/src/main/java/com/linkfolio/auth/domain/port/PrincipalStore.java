package com.linkfolio.auth.domain.port;

import com.linkfolio.auth.infrastructure.entity.UserEntity;

import java.util.Optional;
import java.util.UUID;

/**
 * Store of principals (users).
 */
public interface PrincipalStore {

    Optional<UserEntity> findById(UUID id);

    Optional<UserEntity> findByEmail(String email);

    boolean existsByEmail(String email);

    boolean existsByUsername(String username);

    UserEntity create(UserEntity user);

    void delete(UUID id);

    void touchLastLogin(UUID id);
}
