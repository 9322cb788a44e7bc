package com.linkfolio.auth.api.dto;

public class EmailVerifiedResponseDto {

    private boolean emailVerified;

    public EmailVerifiedResponseDto(boolean emailVerified) {
        this.emailVerified = emailVerified;
    }

    public boolean isEmailVerified() {
        return emailVerified;
    }
}
