package com.linkfolio.auth.domain.service;

import com.linkfolio.auth.domain.exception.InvalidCredentialsException;
import com.linkfolio.auth.domain.exception.InvalidInputException;
import com.linkfolio.auth.domain.model.HashedPassword;
import com.linkfolio.auth.domain.port.CredentialStore;
import com.linkfolio.auth.domain.port.PrincipalStore;
import com.linkfolio.auth.domain.security.PasswordHasher;
import com.linkfolio.auth.domain.security.PasswordPolicy;
import com.linkfolio.auth.domain.utils.CryptoUtils;
import com.linkfolio.auth.infrastructure.entity.CredentialEntity;
import com.linkfolio.auth.infrastructure.entity.UserEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import static com.linkfolio.auth.domain.constants.AuthConstants.RESET_TOKEN_TTL;
import static com.linkfolio.auth.domain.utils.CryptoUtils.maskEmail;

/**
 * Forgotten-password flow. Neither step reveals whether an email is registered.
 */
@Service
@Slf4j
public class PasswordResetService {

    private final PrincipalStore principalStore;
    private final CredentialStore credentialStore;
    private final PasswordHasher passwordHasher;
    private final PasswordPolicy passwordPolicy;
    private final CryptoUtils cryptoUtils;
    private final NotificationService notificationService;
    private final Clock clock;

    public PasswordResetService(PrincipalStore principalStore,
                                CredentialStore credentialStore,
                                PasswordHasher passwordHasher,
                                PasswordPolicy passwordPolicy,
                                CryptoUtils cryptoUtils,
                                NotificationService notificationService,
                                Clock clock) {
        this.principalStore = principalStore;
        this.credentialStore = credentialStore;
        this.passwordHasher = passwordHasher;
        this.passwordPolicy = passwordPolicy;
        this.cryptoUtils = cryptoUtils;
        this.notificationService = notificationService;
        this.clock = clock;
    }

    /**
     * Issues a one-hour reset token. Unknown emails are ignored silently.
     */
    public void generateResetToken(String email) {
        Optional<UserEntity> user = principalStore.findByEmail(email);
        if (user.isEmpty()) {
            log.info("[RESET_REQUEST_IGNORED] Reset requested for unknown email | email={}", maskEmail(email));
            return;
        }

        String token = cryptoUtils.generateResetToken();
        Instant expiresAt = clock.instant().plus(RESET_TOKEN_TTL);
        credentialStore.setResetToken(user.get().getId(), token, expiresAt);
        log.info("[RESET_TOKEN_ISSUED] Password reset token stored | userId={} | expiresAt={}",
                user.get().getId(), expiresAt);

        notificationService.sendPasswordReset(user.get(), token, expiresAt);
    }

    public void resetPassword(String token, String email, String newPassword, String confirmPassword) {
        if (newPassword == null || !newPassword.equals(confirmPassword)) {
            throw new InvalidInputException("Password and confirm password do not match");
        }
        passwordPolicy.validate(newPassword);

        UserEntity user = principalStore.findByEmail(email).orElse(null);
        if (user == null) {
            log.warn("[RESET_FAILED] Unknown email | email={}", maskEmail(email));
            throw new InvalidCredentialsException();
        }

        CredentialEntity credential = credentialStore.getCredentialByPrincipalId(user.getId())
                .orElseThrow(InvalidCredentialsException::new);

        if (!credential.hasLiveResetToken(clock.instant())
                || !cryptoUtils.slowEquals(token, credential.getResetToken())) {
            log.warn("[RESET_FAILED] Reset token missing, expired or wrong | userId={}", user.getId());
            throw new InvalidCredentialsException();
        }

        HashedPassword hashed = passwordHasher.hash(newPassword);
        credentialStore.updatePasswordHash(user.getId(), hashed.getHash(), hashed.getSalt());
        credentialStore.clearResetToken(user.getId());
        log.info("[PASSWORD_RESET] Password changed via reset token | userId={}", user.getId());

        notificationService.sendPasswordChanged(user);
    }
}
