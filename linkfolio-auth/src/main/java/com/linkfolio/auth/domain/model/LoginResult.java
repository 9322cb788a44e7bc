package com.linkfolio.auth.domain.model;

import com.linkfolio.auth.infrastructure.entity.UserEntity;
import lombok.Value;

/**
 * Outcome of a login or refresh. {@code sessionId} is null when no server-side session was created.
 */
@Value
public class LoginResult {
    TokenPair tokens;
    UserEntity user;
    String sessionId;
}
