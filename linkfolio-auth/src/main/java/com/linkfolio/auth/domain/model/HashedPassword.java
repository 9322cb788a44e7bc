package com.linkfolio.auth.domain.model;

import lombok.Value;

/**
 * BCrypt hash and the salt mixed into it. Both must be persisted.
 */
@Value
public class HashedPassword {
    String hash;
    String salt;
}
