package com.linkfolio.auth.api.dto;

public class VerifyEmailResponseDto {

    private String userId;
    private boolean emailVerified;

    public VerifyEmailResponseDto(String userId, boolean emailVerified) {
        this.userId = userId;
        this.emailVerified = emailVerified;
    }

    // Getters
    public String getUserId() {
        return userId;
    }

    public boolean isEmailVerified() {
        return emailVerified;
    }
}
