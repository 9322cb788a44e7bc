package com.linkfolio.auth.api.dto;

import com.linkfolio.auth.infrastructure.entity.UserEntity;

public class UserDto {

    private String id;
    private String username;
    private String handle;
    private String email;
    private String firstName;
    private String lastName;
    private boolean admin;
    private boolean premium;

    public UserDto(String id, String username, String handle, String email,
                   String firstName, String lastName, boolean admin, boolean premium) {
        this.id = id;
        this.username = username;
        this.handle = handle;
        this.email = email;
        this.firstName = firstName;
        this.lastName = lastName;
        this.admin = admin;
        this.premium = premium;
    }

    public static UserDto from(UserEntity user) {
        return new UserDto(
                user.getId().toString(),
                user.getUsername(),
                user.getHandle(),
                user.getEmail(),
                user.getFirstName(),
                user.getLastName(),
                user.isAdmin(),
                user.isPremium()
        );
    }

    // Getters
    public String getId() {
        return id;
    }

    public String getUsername() {
        return username;
    }

    public String getHandle() {
        return handle;
    }

    public String getEmail() {
        return email;
    }

    public String getFirstName() {
        return firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public boolean isAdmin() {
        return admin;
    }

    public boolean isPremium() {
        return premium;
    }
}
