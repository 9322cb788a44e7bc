package com.linkfolio.auth.domain.service;

import com.linkfolio.auth.domain.exception.AccountLockedException;
import com.linkfolio.auth.domain.model.AccountStatus;
import com.linkfolio.auth.domain.port.CredentialStore;
import com.linkfolio.auth.infrastructure.entity.CredentialEntity;
import com.linkfolio.auth.infrastructure.entity.UserEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Account Guard - failed login counting and lockout
 * OPEN -> LOCKED after maxAttempts consecutive failures, back to OPEN when the lock expires
 * or the account is unlocked.
 */
@Service
@Slf4j
public class AccountGuard {

    private final CredentialStore credentialStore;
    private final NotificationService notificationService;
    private final Clock clock;
    private final int maxAttempts;
    private final Duration lockDuration;

    public AccountGuard(CredentialStore credentialStore,
                        NotificationService notificationService,
                        Clock clock,
                        @Value("${linkfolio.auth.lockout.max-attempts:5}") int maxAttempts,
                        @Value("${linkfolio.auth.lockout.duration:15m}") Duration lockDuration) {
        this.credentialStore = credentialStore;
        this.notificationService = notificationService;
        this.clock = clock;
        this.maxAttempts = maxAttempts;
        this.lockDuration = lockDuration;
    }

    public AccountStatus status(CredentialEntity credential) {
        Instant lockedUntil = credential.getLockedUntil();
        return lockedUntil != null && clock.instant().isBefore(lockedUntil) ? AccountStatus.LOCKED : AccountStatus.OPEN;
    }

    /**
     * @throws AccountLockedException while the lock is active
     */
    public void checkNotLocked(CredentialEntity credential) {
        if (status(credential) == AccountStatus.LOCKED) {
            Duration remaining = Duration.between(clock.instant(), credential.getLockedUntil());
            long retryAfter = Math.max(1, (remaining.toMillis() + 999) / 1000);
            log.warn("[ACCOUNT_LOCKED] Login blocked by lockout | userId={} | retryAfter={}s",
                    credential.getUserId(), retryAfter);
            throw new AccountLockedException("Account is temporarily locked. Try again later.", retryAfter);
        }
    }

    /**
     * True when a lock was set and has run out. The caller clears it.
     */
    public boolean lockExpired(CredentialEntity credential) {
        Instant lockedUntil = credential.getLockedUntil();
        return lockedUntil != null && !clock.instant().isBefore(lockedUntil);
    }

    /**
     * Counts a failed password check and locks the account once the threshold is reached.
     *
     * @return the resulting status
     */
    public AccountStatus recordFailure(UserEntity user, CredentialEntity credential) {
        int attempts = credentialStore.incrementFailedAttempts(credential.getUserId());
        log.warn("[LOGIN_FAILED] Failed attempt recorded | userId={} | attempts={}/{}",
                credential.getUserId(), attempts, maxAttempts);

        if (attempts < maxAttempts) {
            return AccountStatus.OPEN;
        }

        Instant lockedUntil = clock.instant().plus(lockDuration);
        credentialStore.setLockout(credential.getUserId(), lockedUntil);
        credential.setLockedUntil(lockedUntil);
        log.warn("[ACCOUNT_LOCKED] Account locked after repeated failures | userId={} | lockedUntil={}",
                credential.getUserId(), lockedUntil);
        notificationService.sendAccountLocked(user, lockedUntil);
        return AccountStatus.LOCKED;
    }

    public void unlock(UUID principalId) {
        credentialStore.clearLockout(principalId);
        log.info("[ACCOUNT_UNLOCKED] Lock and failure counter cleared | userId={}", principalId);
    }
}
