package com.linkfolio.auth.infrastructure.store;

import com.linkfolio.auth.domain.exception.CredentialStoreException;
import com.linkfolio.auth.domain.port.PrincipalStore;
import com.linkfolio.auth.infrastructure.entity.UserEntity;
import com.linkfolio.auth.infrastructure.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * {@link PrincipalStore} over Spring Data JPA.
 */
@Component
@Slf4j
public class JpaPrincipalStore implements PrincipalStore {

    private final UserRepository userRepository;
    private final Clock clock;

    public JpaPrincipalStore(UserRepository userRepository, Clock clock) {
        this.userRepository = userRepository;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UserEntity> findById(UUID id) {
        return run("findById", () -> userRepository.findById(id));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UserEntity> findByEmail(String email) {
        return run("findByEmail", () -> userRepository.findByEmail(email));
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByEmail(String email) {
        return run("existsByEmail", () -> userRepository.existsByEmail(email));
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByUsername(String username) {
        return run("existsByUsername", () -> userRepository.existsByUsername(username));
    }

    @Override
    @Transactional
    public UserEntity create(UserEntity user) {
        Instant now = clock.instant();
        if (user.getId() == null) {
            user.setId(UUID.randomUUID());
        }
        user.setCreatedAt(now);
        user.setUpdatedAt(now);
        return run("create", () -> userRepository.save(user));
    }

    @Override
    @Transactional
    public void delete(UUID id) {
        run("delete", () -> {
            userRepository.deleteById(id);
            return null;
        });
    }

    @Override
    @Transactional
    public void touchLastLogin(UUID id) {
        run("touchLastLogin", () -> userRepository.touchLastLogin(id, clock.instant()));
    }

    private <T> T run(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("[PRINCIPAL_STORE_ERROR] Principal store operation failed | operation={} | error={}",
                    operation, e.getMessage());
            throw new CredentialStoreException("Principal store operation failed: " + operation, e);
        }
    }
}
