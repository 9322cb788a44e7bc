package com.linkfolio.auth.domain.model;

import lombok.Value;

import java.time.Instant;

@Value
public class IssuedToken {
    String token;
    Instant expiresAt;
}
