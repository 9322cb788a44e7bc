package com.linkfolio.auth.infrastructure.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Credential record, one per user.
 * Reset token and its expiry are always written together.
 */
@Entity
@Table(name = "auth_credentials")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CredentialEntity {

    @Id
    @Column(name = "user_id")
    private UUID userId;

    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @Column(name = "password_salt", nullable = false)
    private String passwordSalt;

    @Column(name = "email_verified", nullable = false)
    private boolean emailVerified;

    @Column(name = "email_verification_token", unique = true, length = 64)
    private String emailVerificationToken;

    @Column(name = "reset_token", length = 128)
    private String resetToken;

    @Column(name = "reset_token_expires_at")
    private Instant resetTokenExpiresAt;

    @Column(name = "failed_login_attempts", nullable = false)
    private int failedLoginAttempts;

    /**
     * Null when the account is not locked.
     */
    @Column(name = "locked_until")
    private Instant lockedUntil;

    @Column(name = "refresh_token", length = 2048)
    private String refreshToken;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * A stored reset token past its expiry counts as absent.
     */
    public boolean hasLiveResetToken(Instant now) {
        return resetToken != null && resetTokenExpiresAt != null && now.isBefore(resetTokenExpiresAt);
    }
}
