package com.linkfolio.auth.domain.model;

import com.linkfolio.auth.infrastructure.entity.UserEntity;
import lombok.Value;

/**
 * Identity snapshot copied into token claims.
 */
@Value
public class PrincipalIdentity {
    String userId;
    String username;
    String email;
    boolean admin;
    boolean premium;

    public static PrincipalIdentity of(UserEntity user) {
        return new PrincipalIdentity(
                user.getId().toString(),
                user.getUsername(),
                user.getEmail(),
                user.isAdmin(),
                user.isPremium()
        );
    }
}
