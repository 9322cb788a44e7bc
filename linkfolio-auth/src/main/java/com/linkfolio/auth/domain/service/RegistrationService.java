package com.linkfolio.auth.domain.service;

import com.linkfolio.auth.domain.exception.CredentialStoreException;
import com.linkfolio.auth.domain.exception.DuplicateAccountException;
import com.linkfolio.auth.domain.exception.InternalAuthException;
import com.linkfolio.auth.domain.model.HashedPassword;
import com.linkfolio.auth.domain.model.RegisterCommand;
import com.linkfolio.auth.domain.port.CredentialStore;
import com.linkfolio.auth.domain.port.PrincipalStore;
import com.linkfolio.auth.domain.security.PasswordHasher;
import com.linkfolio.auth.domain.security.PasswordPolicy;
import com.linkfolio.auth.domain.utils.CryptoUtils;
import com.linkfolio.auth.infrastructure.entity.CredentialEntity;
import com.linkfolio.auth.infrastructure.entity.UserEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import static com.linkfolio.auth.domain.utils.CryptoUtils.maskEmail;

/**
 * Registration Service - Orchestrates user registration flow
 *
 * Flow:
 * 1. Validate password against policy
 * 2. Check email and username are free
 * 3. Create user
 * 4. Hash password, generate verification token, store credential record
 * 5. Send verification notification (best-effort)
 *
 * Steps 3 and 4 are not one transaction. If step 4 fails the user is deleted again.
 */
@Service
@Slf4j
public class RegistrationService {

    private final PrincipalStore principalStore;
    private final CredentialStore credentialStore;
    private final PasswordHasher passwordHasher;
    private final PasswordPolicy passwordPolicy;
    private final CryptoUtils cryptoUtils;
    private final NotificationService notificationService;

    public RegistrationService(
            PrincipalStore principalStore,
            CredentialStore credentialStore,
            PasswordHasher passwordHasher,
            PasswordPolicy passwordPolicy,
            CryptoUtils cryptoUtils,
            NotificationService notificationService) {
        this.principalStore = principalStore;
        this.credentialStore = credentialStore;
        this.passwordHasher = passwordHasher;
        this.passwordPolicy = passwordPolicy;
        this.cryptoUtils = cryptoUtils;
        this.notificationService = notificationService;
    }

    /**
     * Register new user
     *
     * @return the created user
     * @throws com.linkfolio.auth.domain.exception.InvalidInputException if the password violates the policy
     * @throws DuplicateAccountException if email or username is taken
     * @throws InternalAuthException if the credential record could not be created
     */
    public UserEntity register(RegisterCommand command) {
        log.info("[REGISTER_START] User registration initiated | username={}", command.getUsername());

        // 1. Policy
        passwordPolicy.validate(command.getPassword());

        // 2. Uniqueness
        if (principalStore.existsByEmail(command.getEmail())) {
            log.warn("[EMAIL_EXISTS] Registration failed - email already exists | email={}", maskEmail(command.getEmail()));
            throw new DuplicateAccountException("User already registered with this email");
        }
        if (principalStore.existsByUsername(command.getUsername())) {
            log.warn("[USERNAME_EXISTS] Registration failed - username already exists | username={}", command.getUsername());
            throw new DuplicateAccountException("Username is already taken");
        }

        // 3. User
        UserEntity user = new UserEntity();
        user.setUsername(command.getUsername());
        user.setHandle(command.getHandle());
        user.setEmail(command.getEmail());
        user.setFirstName(command.getFirstName());
        user.setLastName(command.getLastName());
        user = principalStore.create(user);
        log.info("[USER_CREATED] User created successfully | userId={}", user.getId());

        // 4. Credential record
        String verificationToken;
        try {
            HashedPassword hashed = passwordHasher.hash(command.getPassword());
            verificationToken = cryptoUtils.generateVerificationToken();

            CredentialEntity credential = new CredentialEntity();
            credential.setUserId(user.getId());
            credential.setPasswordHash(hashed.getHash());
            credential.setPasswordSalt(hashed.getSalt());
            credential.setEmailVerified(false);
            credential.setEmailVerificationToken(verificationToken);
            credentialStore.createCredential(credential);
        } catch (RuntimeException e) {
            log.error("[CREDENTIAL_CREATE_FAILED] Rolling back user | userId={} | error={}",
                    user.getId(), e.getMessage(), e);
            deleteQuietly(user);
            throw new InternalAuthException("Registration could not be completed", e);
        }

        // 5. Verification email
        notificationService.sendEmailVerification(user, verificationToken);

        log.info("[REGISTER_SUCCESS] Registration completed successfully | userId={}", user.getId());
        return user;
    }

    private void deleteQuietly(UserEntity user) {
        try {
            principalStore.delete(user.getId());
        } catch (CredentialStoreException e) {
            log.error("[REGISTER_ROLLBACK_FAILED] Orphaned user left behind | userId={} | error={}",
                    user.getId(), e.getMessage(), e);
        }
    }
}
