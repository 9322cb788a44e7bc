package com.linkfolio.auth.infrastructure.repository;

import com.linkfolio.auth.infrastructure.entity.CredentialEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for credential records. Every mutation is a single UPDATE statement.
 */
public interface CredentialRepository extends JpaRepository<CredentialEntity, UUID> {

    Optional<CredentialEntity> findByEmailVerificationToken(String token);

    /* ================= PASSWORD ================= */

    @Modifying(clearAutomatically = true)
    @Query("""
        update CredentialEntity c
        set c.passwordHash = :hash, c.passwordSalt = :salt, c.updatedAt = :now
        where c.userId = :userId
    """)
    int updatePasswordHash(@Param("userId") UUID userId, @Param("hash") String hash,
                           @Param("salt") String salt, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("""
        update CredentialEntity c
        set c.resetToken = :token, c.resetTokenExpiresAt = :expiresAt, c.updatedAt = :now
        where c.userId = :userId
    """)
    int setResetToken(@Param("userId") UUID userId, @Param("token") String token,
                      @Param("expiresAt") Instant expiresAt, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("""
        update CredentialEntity c
        set c.resetToken = null, c.resetTokenExpiresAt = null, c.updatedAt = :now
        where c.userId = :userId
    """)
    int clearResetToken(@Param("userId") UUID userId, @Param("now") Instant now);

    /* ================= EMAIL ================= */

    @Modifying(clearAutomatically = true)
    @Query("""
        update CredentialEntity c
        set c.emailVerified = true, c.emailVerificationToken = null, c.updatedAt = :now
        where c.userId = :userId
    """)
    int verifyEmail(@Param("userId") UUID userId, @Param("now") Instant now);

    /* ================= LOGIN STATE ================= */

    @Modifying(clearAutomatically = true)
    @Query("""
        update CredentialEntity c
        set c.failedLoginAttempts = 0, c.lockedUntil = null, c.updatedAt = :now
        where c.userId = :userId
    """)
    int resetLoginState(@Param("userId") UUID userId, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("""
        update CredentialEntity c
        set c.failedLoginAttempts = c.failedLoginAttempts + 1, c.updatedAt = :now
        where c.userId = :userId
    """)
    int incrementFailedAttempts(@Param("userId") UUID userId, @Param("now") Instant now);

    @Query("""
        select c.failedLoginAttempts
        from CredentialEntity c
        where c.userId = :userId
    """)
    Optional<Integer> findFailedAttempts(@Param("userId") UUID userId);

    @Modifying(clearAutomatically = true)
    @Query("""
        update CredentialEntity c
        set c.lockedUntil = :lockedUntil, c.updatedAt = :now
        where c.userId = :userId
    """)
    int setLockout(@Param("userId") UUID userId, @Param("lockedUntil") Instant lockedUntil,
                   @Param("now") Instant now);

    /* ================= REFRESH TOKEN ================= */

    @Modifying(clearAutomatically = true)
    @Query("""
        update CredentialEntity c
        set c.refreshToken = :token, c.updatedAt = :now
        where c.userId = :userId
    """)
    int storeRefreshToken(@Param("userId") UUID userId, @Param("token") String token,
                          @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("""
        update CredentialEntity c
        set c.refreshToken = null, c.updatedAt = :now
        where c.userId = :userId
    """)
    int invalidateRefreshToken(@Param("userId") UUID userId, @Param("now") Instant now);
}
