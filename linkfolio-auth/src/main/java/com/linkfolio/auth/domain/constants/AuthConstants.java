package com.linkfolio.auth.domain.constants;

import java.time.Duration;

public final class AuthConstants {

    // Private constructor prevents instantiation
    private AuthConstants() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    public static final String HASH_ALGORITHM = "SHA-256";
    public static final int BCRYPT_COST_FACTOR = 12;
    public static final int SALT_BYTE_LENGTH = 16;
    public static final int SESSION_ID_BYTE_LENGTH = 32;
    public static final int VERIFICATION_TOKEN_LENGTH = 32;
    public static final int RESET_TOKEN_LENGTH = 64;

    public static final int DEFAULT_MAX_LOGIN_ATTEMPTS = 5;
    public static final Duration DEFAULT_LOCKOUT_DURATION = Duration.ofMinutes(15);
    public static final Duration DEFAULT_ACCESS_TOKEN_TTL = Duration.ofHours(24);
    public static final Duration DEFAULT_REFRESH_TOKEN_TTL = Duration.ofDays(7);
    public static final Duration RESET_TOKEN_TTL = Duration.ofHours(1);
    public static final Duration DEFAULT_SESSION_TTL = Duration.ofHours(24);
    public static final Duration BURST_WINDOW = Duration.ofSeconds(10);

    public static final String UNIFORM_AUTH_FAILURE_MESSAGE = "Invalid credentials";

    // Key-value store prefixes
    public static final String SESSION_KEY_PREFIX = "session:";
    public static final String USER_SESSIONS_KEY_FORMAT = "user:%s:sessions:";
    public static final String BURST_KEY_SUFFIX = ":burst";
    public static final String DEFAULT_RATE_LIMIT_NAMESPACE = "rate_limit";

    // Claim names
    public static final String CLAIM_USERNAME = "username";
    public static final String CLAIM_EMAIL = "email";
    public static final String CLAIM_IS_ADMIN = "is_admin";
    public static final String CLAIM_IS_PREMIUM = "is_premium";
    public static final String CLAIM_TOKEN_TYPE = "token_type";

}
