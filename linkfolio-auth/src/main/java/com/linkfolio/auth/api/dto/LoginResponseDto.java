package com.linkfolio.auth.api.dto;

import java.time.Instant;

public class LoginResponseDto {

    private String accessToken;
    private String refreshToken;
    private String tokenType;     // Bearer
    private Instant expiresAt;    // access token expiry
    private String sessionId;     // null when no server-side session was created
    private UserDto user;

    public LoginResponseDto(String accessToken, String refreshToken, String tokenType,
                            Instant expiresAt, String sessionId, UserDto user) {
        this.accessToken = accessToken;
        this.refreshToken = refreshToken;
        this.tokenType = tokenType;
        this.expiresAt = expiresAt;
        this.sessionId = sessionId;
        this.user = user;
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

    public String getSessionId() {
        return sessionId;
    }

    public UserDto getUser() {
        return user;
    }
}
