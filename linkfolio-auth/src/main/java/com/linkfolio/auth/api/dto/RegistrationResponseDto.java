package com.linkfolio.auth.api.dto;

public class RegistrationResponseDto {

    private UserDto user;
    private boolean emailVerified;   // always false right after registration
    private String message;

    public RegistrationResponseDto(UserDto user, boolean emailVerified, String message) {
        this.user = user;
        this.emailVerified = emailVerified;
        this.message = message;
    }

    // Getters
    public UserDto getUser() {
        return user;
    }

    public boolean isEmailVerified() {
        return emailVerified;
    }

    public String getMessage() {
        return message;
    }
}
