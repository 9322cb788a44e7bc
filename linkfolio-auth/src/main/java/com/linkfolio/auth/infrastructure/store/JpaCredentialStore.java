package com.linkfolio.auth.infrastructure.store;

import com.linkfolio.auth.domain.exception.CredentialStoreException;
import com.linkfolio.auth.domain.port.CredentialStore;
import com.linkfolio.auth.infrastructure.entity.CredentialEntity;
import com.linkfolio.auth.infrastructure.repository.CredentialRepository;
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
 * {@link CredentialStore} over Spring Data JPA.
 */
@Component
@Slf4j
public class JpaCredentialStore implements CredentialStore {

    private final CredentialRepository credentialRepository;
    private final Clock clock;

    public JpaCredentialStore(CredentialRepository credentialRepository, Clock clock) {
        this.credentialRepository = credentialRepository;
        this.clock = clock;
    }

    @Override
    @Transactional
    public void createCredential(CredentialEntity credential) {
        Instant now = clock.instant();
        credential.setCreatedAt(now);
        credential.setUpdatedAt(now);
        run("createCredential", () -> credentialRepository.save(credential));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CredentialEntity> getCredentialByPrincipalId(UUID principalId) {
        return run("getCredentialByPrincipalId", () -> credentialRepository.findById(principalId));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CredentialEntity> getByVerificationToken(String token) {
        return run("getByVerificationToken", () -> credentialRepository.findByEmailVerificationToken(token));
    }

    @Override
    @Transactional
    public void updatePasswordHash(UUID principalId, String hash, String salt) {
        run("updatePasswordHash", () -> credentialRepository.updatePasswordHash(principalId, hash, salt, clock.instant()));
    }

    @Override
    @Transactional
    public void setResetToken(UUID principalId, String token, Instant expiresAt) {
        run("setResetToken", () -> credentialRepository.setResetToken(principalId, token, expiresAt, clock.instant()));
    }

    @Override
    @Transactional
    public void clearResetToken(UUID principalId) {
        run("clearResetToken", () -> credentialRepository.clearResetToken(principalId, clock.instant()));
    }

    @Override
    @Transactional
    public void verifyEmail(UUID principalId) {
        run("verifyEmail", () -> credentialRepository.verifyEmail(principalId, clock.instant()));
    }

    @Override
    @Transactional
    public void updateLastLogin(UUID principalId) {
        run("updateLastLogin", () -> credentialRepository.resetLoginState(principalId, clock.instant()));
    }

    @Override
    @Transactional
    public int incrementFailedAttempts(UUID principalId) {
        return run("incrementFailedAttempts", () -> {
            credentialRepository.incrementFailedAttempts(principalId, clock.instant());
            return credentialRepository.findFailedAttempts(principalId).orElse(0);
        });
    }

    @Override
    @Transactional
    public void setLockout(UUID principalId, Instant lockedUntil) {
        run("setLockout", () -> credentialRepository.setLockout(principalId, lockedUntil, clock.instant()));
    }

    @Override
    @Transactional
    public void clearLockout(UUID principalId) {
        run("clearLockout", () -> credentialRepository.resetLoginState(principalId, clock.instant()));
    }

    @Override
    @Transactional
    public void storeRefreshToken(UUID principalId, String refreshToken) {
        run("storeRefreshToken", () -> credentialRepository.storeRefreshToken(principalId, refreshToken, clock.instant()));
    }

    @Override
    @Transactional
    public void invalidateRefreshToken(UUID principalId) {
        run("invalidateRefreshToken", () -> credentialRepository.invalidateRefreshToken(principalId, clock.instant()));
    }

    private <T> T run(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("[CREDENTIAL_STORE_ERROR] Credential store operation failed | operation={} | error={}",
                    operation, e.getMessage());
            throw new CredentialStoreException("Credential store operation failed: " + operation, e);
        }
    }
}
