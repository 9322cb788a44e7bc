package com.linkfolio.auth.api.dto;

import com.linkfolio.auth.domain.model.TokenClaims;

import java.time.Instant;

/**
 * Identity carried by the caller's access token.
 */
public class CurrentUserResponseDto {

    private String userId;
    private String username;
    private String email;
    private boolean admin;
    private boolean premium;
    private Instant expiresAt;

    public CurrentUserResponseDto(String userId, String username, String email,
                                  boolean admin, boolean premium, Instant expiresAt) {
        this.userId = userId;
        this.username = username;
        this.email = email;
        this.admin = admin;
        this.premium = premium;
        this.expiresAt = expiresAt;
    }

    public static CurrentUserResponseDto from(TokenClaims claims) {
        return new CurrentUserResponseDto(claims.getUserId(), claims.getUsername(), claims.getEmail(),
                claims.isAdmin(), claims.isPremium(), claims.getExpiresAt());
    }

    // Getters
    public String getUserId() {
        return userId;
    }

    public String getUsername() {
        return username;
    }

    public String getEmail() {
        return email;
    }

    public boolean isAdmin() {
        return admin;
    }

    public boolean isPremium() {
        return premium;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }
}
