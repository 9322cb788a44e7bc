package com.linkfolio.auth.api.dto;

import jakarta.validation.constraints.Positive;

public class SessionRefreshRequestDto {

    /**
     * New lifetime in seconds. Omitted means the configured default.
     */
    @Positive(message = "ttlSeconds must be positive")
    private Long ttlSeconds;

    public Long getTtlSeconds() {
        return ttlSeconds;
    }

    public void setTtlSeconds(Long ttlSeconds) {
        this.ttlSeconds = ttlSeconds;
    }
}
