package com.linkfolio.auth.domain.service;

import com.linkfolio.auth.domain.exception.InvalidCredentialsException;
import com.linkfolio.auth.domain.exception.InvalidTokenException;
import com.linkfolio.auth.domain.port.CredentialStore;
import com.linkfolio.auth.infrastructure.entity.CredentialEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

@Service
@Slf4j
public class EmailVerificationService {

    private final CredentialStore credentialStore;

    public EmailVerificationService(CredentialStore credentialStore) {
        this.credentialStore = credentialStore;
    }

    /**
     * Marks the owner's email as verified. The token is single use.
     *
     * @return id of the verified user
     */
    public UUID verifyEmail(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("empty verification token");
        }
        CredentialEntity credential = credentialStore.getByVerificationToken(token)
                .orElseThrow(() -> new InvalidTokenException("unknown verification token"));

        credentialStore.verifyEmail(credential.getUserId());
        log.info("[EMAIL_VERIFIED] Email verified | userId={}", credential.getUserId());
        return credential.getUserId();
    }

    public boolean isEmailVerified(UUID userId) {
        return credentialStore.getCredentialByPrincipalId(userId)
                .map(CredentialEntity::isEmailVerified)
                .orElseThrow(InvalidCredentialsException::new);
    }
}
