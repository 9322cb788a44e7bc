package com.linkfolio.auth.domain.model;

import lombok.Value;

import java.time.Instant;

/**
 * Verified content of a signed token.
 */
@Value
public class TokenClaims {
    String userId;
    String username;
    String email;
    boolean admin;
    boolean premium;
    TokenType tokenType;
    Instant issuedAt;
    Instant expiresAt;
    Instant notBefore;
    String tokenId;
}
