package com.linkfolio.auth.domain.port;

import com.linkfolio.auth.infrastructure.entity.CredentialEntity;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Relational store for credential records.
 *
 * <p>Implementations raise {@link com.linkfolio.auth.domain.exception.CredentialStoreException}
 * for any storage failure. An absent record is an empty {@link Optional}, never an exception.
 */
public interface CredentialStore {

    void createCredential(CredentialEntity credential);

    Optional<CredentialEntity> getCredentialByPrincipalId(UUID principalId);

    Optional<CredentialEntity> getByVerificationToken(String token);

    void updatePasswordHash(UUID principalId, String hash, String salt);

    /**
     * Writes the token and its expiry in one statement.
     */
    void setResetToken(UUID principalId, String token, Instant expiresAt);

    void clearResetToken(UUID principalId);

    /**
     * Marks the email as verified and clears the verification token.
     */
    void verifyEmail(UUID principalId);

    /**
     * Records a successful login. Also resets the failed-attempt counter and any lock.
     */
    void updateLastLogin(UUID principalId);

    /**
     * @return the counter value after the increment
     */
    int incrementFailedAttempts(UUID principalId);

    void setLockout(UUID principalId, Instant lockedUntil);

    /**
     * Clears the lock and the failed-attempt counter.
     */
    void clearLockout(UUID principalId);

    /**
     * Replaces the single stored refresh token value.
     */
    void storeRefreshToken(UUID principalId, String refreshToken);

    void invalidateRefreshToken(UUID principalId);
}
