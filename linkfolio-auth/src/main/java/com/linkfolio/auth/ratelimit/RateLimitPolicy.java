package com.linkfolio.auth.ratelimit;

import lombok.Value;
import lombok.With;

import java.time.Duration;

/**
 * Quota for one class of requests: {@code requestsPerWindow} per {@code windowSize},
 * and at most {@code burstSize} within any 10-second burst window.
 */
@Value
public class RateLimitPolicy {
    String name;
    int requestsPerWindow;
    int burstSize;
    Duration windowSize;
    /**
     * When set, 2xx responses are not counted.
     */
    boolean skipSuccessful;
    @With
    RateLimitKeyResolver keyResolver;

    public static RateLimitPolicy defaultPolicy() {
        return new RateLimitPolicy("default", 60, 10, Duration.ofMinutes(1), false, RateLimitKeyResolver.byIp());
    }

    public static RateLimitPolicy strict() {
        return new RateLimitPolicy("strict", 30, 5, Duration.ofMinutes(1), false, RateLimitKeyResolver.byIp());
    }

    public static RateLimitPolicy authenticatedUser() {
        return new RateLimitPolicy("authenticated-user", 120, 20, Duration.ofMinutes(1), true, RateLimitKeyResolver.byUser());
    }

    public static RateLimitPolicy expensiveOperation() {
        return new RateLimitPolicy("expensive-operation", 10, 2, Duration.ofMinutes(1), false, RateLimitKeyResolver.byUser());
    }
}
