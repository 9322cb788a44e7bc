package com.linkfolio.auth.api.dto;

import java.time.Instant;

public class TokenRefreshResponseDto {

    private String accessToken;
    private String refreshToken;   // rotated, the old one is no longer accepted
    private String tokenType;
    private Instant expiresAt;

    public TokenRefreshResponseDto(String accessToken, String refreshToken, String tokenType, Instant expiresAt) {
        this.accessToken = accessToken;
        this.refreshToken = refreshToken;
        this.tokenType = tokenType;
        this.expiresAt = expiresAt;
    }

    // Getters
    public String getAccessToken() {
        return accessToken;
    }

    public String getRefreshToken() {
        return refreshToken;
    }

    public String getTokenType() {
        return tokenType;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }
}
