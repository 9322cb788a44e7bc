package com.linkfolio.auth.ratelimit;

import lombok.Value;

import java.time.Instant;

@Value
public class RateLimitDecision {
    boolean allowed;
    int limit;
    int remaining;
    Instant resetAt;
}
