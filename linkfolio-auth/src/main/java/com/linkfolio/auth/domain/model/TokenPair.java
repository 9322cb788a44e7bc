package com.linkfolio.auth.domain.model;

import lombok.Value;

import java.time.Instant;

/**
 * Access and refresh token minted from one identity snapshot.
 * {@code expiresAt} is the expiry of the access token.
 */
@Value
public class TokenPair {
    String accessToken;
    String refreshToken;
    Instant expiresAt;
}
