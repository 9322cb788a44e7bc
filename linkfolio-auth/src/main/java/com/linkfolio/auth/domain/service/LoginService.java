package com.linkfolio.auth.domain.service;

import com.linkfolio.auth.domain.exception.InvalidCredentialsException;
import com.linkfolio.auth.domain.exception.PasswordMismatchException;
import com.linkfolio.auth.domain.model.ClientInfo;
import com.linkfolio.auth.domain.model.LoginResult;
import com.linkfolio.auth.domain.model.PrincipalIdentity;
import com.linkfolio.auth.domain.model.SessionData;
import com.linkfolio.auth.domain.model.TokenPair;
import com.linkfolio.auth.domain.port.CredentialStore;
import com.linkfolio.auth.domain.port.PrincipalStore;
import com.linkfolio.auth.domain.security.PasswordHasher;
import com.linkfolio.auth.infrastructure.entity.CredentialEntity;
import com.linkfolio.auth.infrastructure.entity.UserEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import static com.linkfolio.auth.domain.utils.CryptoUtils.maskEmail;

/**
 * Login Service - password authentication
 * Every rejection other than a lockout produces the same InvalidCredentialsException.
 */
@Service
@Slf4j
public class LoginService {

    private final PrincipalStore principalStore;
    private final CredentialStore credentialStore;
    private final PasswordHasher passwordHasher;
    private final AccountGuard accountGuard;
    private final JwtService jwtService;
    private final SessionService sessionService;

    public LoginService(PrincipalStore principalStore,
                        CredentialStore credentialStore,
                        PasswordHasher passwordHasher,
                        AccountGuard accountGuard,
                        JwtService jwtService,
                        SessionService sessionService) {
        this.principalStore = principalStore;
        this.credentialStore = credentialStore;
        this.passwordHasher = passwordHasher;
        this.accountGuard = accountGuard;
        this.jwtService = jwtService;
        this.sessionService = sessionService;
    }

    public LoginResult login(String email, String password, ClientInfo client) {
        log.info("[LOGIN_START] Login attempt | email={}", maskEmail(email));

        // 1. Find user
        UserEntity user = principalStore.findByEmail(email).orElse(null);
        if (user == null) {
            log.warn("[LOGIN_FAILED] Unknown email | email={}", maskEmail(email));
            throw new InvalidCredentialsException();
        }

        CredentialEntity credential = credentialStore.getCredentialByPrincipalId(user.getId()).orElse(null);
        if (credential == null) {
            log.error("[LOGIN_FAILED] User has no credential record | userId={}", user.getId());
            throw new InvalidCredentialsException();
        }

        // 2. Lockout, before any password check
        if (accountGuard.lockExpired(credential)) {
            credentialStore.clearLockout(user.getId());
            credential.setLockedUntil(null);
            credential.setFailedLoginAttempts(0);
            log.info("[LOCK_EXPIRED] Stale lock cleared | userId={}", user.getId());
        }
        accountGuard.checkNotLocked(credential);

        // 3. Password
        try {
            passwordHasher.verify(password, credential.getPasswordHash(), credential.getPasswordSalt());
        } catch (PasswordMismatchException e) {
            accountGuard.recordFailure(user, credential);
            log.warn("[LOGIN_FAILED] Invalid credentials | userId={}", user.getId());
            throw new InvalidCredentialsException();
        }

        // 4. Success bookkeeping (also resets the failure counter)
        credentialStore.updateLastLogin(user.getId());
        principalStore.touchLastLogin(user.getId());

        // 5. Tokens; the new refresh token replaces any previous one
        TokenPair tokens = jwtService.issuePair(PrincipalIdentity.of(user));
        credentialStore.storeRefreshToken(user.getId(), tokens.getRefreshToken());

        // 6. Server-side session
        String sessionId = createSession(user, client);

        log.info("[LOGIN_SUCCESS] User authenticated | userId={} | sessionId={}", user.getId(), sessionId);
        return new LoginResult(tokens, user, sessionId);
    }

    private String createSession(UserEntity user, ClientInfo client) {
        ClientInfo info = client != null ? client : ClientInfo.unknown();
        try {
            SessionData session = sessionService.create(user.getId().toString(), info.getUserAgent(), info.getIp(), null);
            return session.getId();
        } catch (RuntimeException e) {
            // Continue - tokens are already issued
            log.error("[SESSION_CREATE_FAILED] Login succeeded without a server-side session | userId={} | error={}",
                    user.getId(), e.getMessage(), e);
            return null;
        }
    }
}
