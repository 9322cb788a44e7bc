package com.linkfolio.auth.domain.service;

import com.linkfolio.auth.domain.exception.InvalidTokenException;
import com.linkfolio.auth.domain.exception.TokenSigningException;
import com.linkfolio.auth.domain.model.IssuedToken;
import com.linkfolio.auth.domain.model.PrincipalIdentity;
import com.linkfolio.auth.domain.model.TokenClaims;
import com.linkfolio.auth.domain.model.TokenPair;
import com.linkfolio.auth.domain.model.TokenType;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

import static com.linkfolio.auth.domain.constants.AuthConstants.CLAIM_EMAIL;
import static com.linkfolio.auth.domain.constants.AuthConstants.CLAIM_IS_ADMIN;
import static com.linkfolio.auth.domain.constants.AuthConstants.CLAIM_IS_PREMIUM;
import static com.linkfolio.auth.domain.constants.AuthConstants.CLAIM_TOKEN_TYPE;
import static com.linkfolio.auth.domain.constants.AuthConstants.CLAIM_USERNAME;

/**
 * JWT Service - signs and verifies access and refresh tokens
 * Uses Nimbus JOSE + JWT library with HS256 (HMAC-SHA256) over a shared secret
 *
 * <p>The service never checks the token kind. Callers compare {@link TokenClaims#getTokenType()}
 * with what they expect.
 */
@Service
@Slf4j
public class JwtService {

    private final JWSSigner signer;
    private final JWSVerifier verifier;
    private final String issuer;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;
    private final Clock clock;

    public JwtService(@Value("${linkfolio.auth.token.secret}") String secret,
                      @Value("${linkfolio.auth.token.issuer:linkfolio-auth}") String issuer,
                      @Value("${linkfolio.auth.token.access-ttl:24h}") Duration accessTokenTtl,
                      @Value("${linkfolio.auth.token.refresh-ttl:7d}") Duration refreshTokenTtl,
                      Clock clock) {
        this.issuer = issuer;
        this.accessTokenTtl = accessTokenTtl;
        this.refreshTokenTtl = refreshTokenTtl;
        this.clock = clock;

        try {
            byte[] key = secret.getBytes(StandardCharsets.UTF_8);
            this.signer = new MACSigner(key);
            this.verifier = new MACVerifier(key);
            log.info("[JWT_SERVICE_INIT] JWT Service initialized | algorithm=HS256 | issuer={}", issuer);
        } catch (JOSEException e) {
            log.error("[JWT_SERVICE_ERROR] Failed to initialize JWT service", e);
            throw new TokenSigningException("Token secret must be at least 256 bits", e);
        }
    }

    /**
     * Sign a token of the given kind for the principal.
     */
    public IssuedToken issue(PrincipalIdentity principal, TokenType tokenType, Duration ttl) {
        Instant now = clock.instant();
        Instant expiry = now.plus(ttl);
        String jti = UUID.randomUUID().toString();

        JWTClaimsSet claimsSet = new JWTClaimsSet.Builder()
                .jwtID(jti)
                .issuer(issuer)
                .subject(principal.getUserId())
                .claim(CLAIM_USERNAME, principal.getUsername())
                .claim(CLAIM_EMAIL, principal.getEmail())
                .claim(CLAIM_IS_ADMIN, principal.isAdmin())
                .claim(CLAIM_IS_PREMIUM, principal.isPremium())
                .claim(CLAIM_TOKEN_TYPE, tokenType.toString())
                .issueTime(Date.from(now))
                .notBeforeTime(Date.from(now))
                .expirationTime(Date.from(expiry))
                .build();

        String token = signToken(claimsSet);
        log.debug("[TOKEN_ISSUED] {} token issued | userId={} | jti={} | expiresAt={}",
                tokenType, principal.getUserId(), jti, expiry);
        return new IssuedToken(token, expiry);
    }

    public TokenPair issuePair(PrincipalIdentity principal, Duration accessTtl, Duration refreshTtl) {
        IssuedToken access = issue(principal, TokenType.ACCESS, accessTtl);
        IssuedToken refresh = issue(principal, TokenType.REFRESH, refreshTtl);
        return new TokenPair(access.getToken(), refresh.getToken(), access.getExpiresAt());
    }

    /**
     * Pair with the configured lifetimes.
     */
    public TokenPair issuePair(PrincipalIdentity principal) {
        return issuePair(principal, accessTokenTtl, refreshTokenTtl);
    }

    /**
     * Sign JWT claims and return serialized token string
     */
    private String signToken(JWTClaimsSet claimsSet) {
        JWSHeader header = new JWSHeader.Builder(JWSAlgorithm.HS256)
                .type(JOSEObjectType.JWT)
                .build();

        try {
            SignedJWT signedJWT = new SignedJWT(header, claimsSet);
            signedJWT.sign(signer);
            return signedJWT.serialize();
        } catch (JOSEException e) {
            log.error("[TOKEN_SIGN_ERROR] Failed to sign token", e);
            throw new TokenSigningException("Failed to sign token", e);
        }
    }

    /**
     * Verify and parse JWT token
     * Returns claims if valid, throws InvalidTokenException otherwise
     */
    public TokenClaims verify(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("empty token");
        }

        SignedJWT signedJWT;
        try {
            signedJWT = SignedJWT.parse(token);
        } catch (ParseException e) {
            throw new InvalidTokenException("malformed token", e);
        }

        // Reject anything outside the HMAC family before touching the signature
        JWSAlgorithm alg = signedJWT.getHeader().getAlgorithm();
        if (!JWSAlgorithm.Family.HMAC_SHA.contains(alg)) {
            log.warn("[JWT_UNEXPECTED_ALG] Token signed with unexpected algorithm | alg={}", alg);
            throw new InvalidTokenException("unexpected signing algorithm: " + alg);
        }

        try {
            if (!signedJWT.verify(verifier)) {
                log.warn("[JWT_INVALID_SIGNATURE] Token signature verification failed");
                throw new InvalidTokenException("invalid signature");
            }
        } catch (JOSEException e) {
            throw new InvalidTokenException("signature could not be verified", e);
        }

        try {
            JWTClaimsSet claims = signedJWT.getJWTClaimsSet();
            Instant now = clock.instant();

            Date expiration = claims.getExpirationTime();
            if (expiration == null || !now.isBefore(expiration.toInstant())) {
                throw new InvalidTokenException("token expired");
            }
            Date notBefore = claims.getNotBeforeTime();
            if (notBefore != null && now.isBefore(notBefore.toInstant())) {
                throw new InvalidTokenException("token not yet valid");
            }
            if (issuer != null && claims.getIssuer() != null && !issuer.equals(claims.getIssuer())) {
                throw new InvalidTokenException("unexpected issuer");
            }

            TokenType tokenType = TokenType.fromValue(claims.getStringClaim(CLAIM_TOKEN_TYPE));
            if (tokenType == null || claims.getSubject() == null) {
                throw new InvalidTokenException("missing required claims");
            }

            return new TokenClaims(
                    claims.getSubject(),
                    claims.getStringClaim(CLAIM_USERNAME),
                    claims.getStringClaim(CLAIM_EMAIL),
                    Boolean.TRUE.equals(claims.getBooleanClaim(CLAIM_IS_ADMIN)),
                    Boolean.TRUE.equals(claims.getBooleanClaim(CLAIM_IS_PREMIUM)),
                    tokenType,
                    claims.getIssueTime() != null ? claims.getIssueTime().toInstant() : null,
                    expiration.toInstant(),
                    notBefore != null ? notBefore.toInstant() : null,
                    claims.getJWTID()
            );
        } catch (ParseException e) {
            throw new InvalidTokenException("malformed claims", e);
        }
    }

    public Duration getAccessTokenTtl() {
        return accessTokenTtl;
    }

    public Duration getRefreshTokenTtl() {
        return refreshTokenTtl;
    }
}
