package com.linkfolio.auth.domain.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RegisterCommand {
    String username;
    String handle;
    String email;
    String password;
    String firstName;
    String lastName;
}
