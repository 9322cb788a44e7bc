package com.linkfolio.auth.domain.service;

import com.linkfolio.auth.domain.port.CredentialStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

@Service
@Slf4j
public class LogoutService {

    private final CredentialStore credentialStore;
    private final SessionService sessionService;

    public LogoutService(CredentialStore credentialStore, SessionService sessionService) {
        this.credentialStore = credentialStore;
        this.sessionService = sessionService;
    }

    /**
     * Invalidates the stored refresh token, then drops the user's server-side sessions.
     * Access tokens already issued stay valid until they expire.
     */
    public void logout(UUID userId) {
        log.info("[LOGOUT_START] Logout initiated | userId={}", userId);

        credentialStore.invalidateRefreshToken(userId);
        log.info("[TOKEN_REVOKED] Refresh token invalidated | userId={}", userId);

        try {
            sessionService.deleteAllForPrincipal(userId.toString());
        } catch (RuntimeException e) {
            log.warn("[SESSION_CLEANUP_FAILED] Sessions not removed on logout | userId={} | error={}",
                    userId, e.getMessage());
        }
        log.info("[LOGOUT_SUCCESS] Logout completed successfully | userId={}", userId);
    }
}
