package com.linkfolio.auth.domain.service;

import com.linkfolio.auth.domain.exception.InvalidCredentialsException;
import com.linkfolio.auth.domain.exception.InvalidTokenException;
import com.linkfolio.auth.domain.model.LoginResult;
import com.linkfolio.auth.domain.model.PrincipalIdentity;
import com.linkfolio.auth.domain.model.TokenClaims;
import com.linkfolio.auth.domain.model.TokenPair;
import com.linkfolio.auth.domain.model.TokenType;
import com.linkfolio.auth.domain.port.CredentialStore;
import com.linkfolio.auth.domain.port.PrincipalStore;
import com.linkfolio.auth.domain.utils.CryptoUtils;
import com.linkfolio.auth.infrastructure.entity.CredentialEntity;
import com.linkfolio.auth.infrastructure.entity.UserEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Token lifecycle after login: refresh rotation and access token validation.
 */
@Service
@Slf4j
public class JwtTokenService {

    private final JwtService jwtService;
    private final PrincipalStore principalStore;
    private final CredentialStore credentialStore;
    private final CryptoUtils cryptoUtils;

    public JwtTokenService(JwtService jwtService,
                           PrincipalStore principalStore,
                           CredentialStore credentialStore,
                           CryptoUtils cryptoUtils) {
        this.jwtService = jwtService;
        this.principalStore = principalStore;
        this.credentialStore = credentialStore;
        this.cryptoUtils = cryptoUtils;
    }

    /**
     * Exchanges the current refresh token for a new pair. The presented token stops working.
     */
    public LoginResult refresh(String refreshToken) {
        TokenClaims claims = jwtService.verify(refreshToken);
        if (claims.getTokenType() != TokenType.REFRESH) {
            throw new InvalidTokenException("expected refresh token, got " + claims.getTokenType());
        }

        UUID userId = parseUserId(claims);
        UserEntity user = principalStore.findById(userId).orElseThrow(InvalidCredentialsException::new);
        CredentialEntity credential = credentialStore.getCredentialByPrincipalId(userId)
                .orElseThrow(InvalidCredentialsException::new);

        if (!cryptoUtils.slowEquals(refreshToken, credential.getRefreshToken())) {
            log.warn("[REFRESH_REJECTED] Refresh token is not the current one | userId={} | jti={}",
                    userId, claims.getTokenId());
            throw new InvalidTokenException("refresh token superseded or revoked");
        }

        TokenPair tokens = jwtService.issuePair(PrincipalIdentity.of(user));
        credentialStore.storeRefreshToken(userId, tokens.getRefreshToken());

        log.info("[TOKEN_REFRESHED] Token pair rotated | userId={}", userId);
        return new LoginResult(tokens, user, null);
    }

    public TokenClaims validateAccessToken(String accessToken) {
        TokenClaims claims = jwtService.verify(accessToken);
        if (claims.getTokenType() != TokenType.ACCESS) {
            throw new InvalidTokenException("expected access token, got " + claims.getTokenType());
        }
        if (principalStore.findById(parseUserId(claims)).isEmpty()) {
            throw new InvalidTokenException("user no longer exists");
        }
        return claims;
    }

    private UUID parseUserId(TokenClaims claims) {
        try {
            return UUID.fromString(claims.getUserId());
        } catch (IllegalArgumentException e) {
            throw new InvalidTokenException("subject is not a user id", e);
        }
    }
}
