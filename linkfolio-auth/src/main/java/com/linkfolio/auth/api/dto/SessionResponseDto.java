package com.linkfolio.auth.api.dto;

import com.linkfolio.auth.domain.model.SessionData;

import java.time.Instant;

public class SessionResponseDto {

    private String id;
    private String userId;
    private String userAgent;
    private String ip;
    private Instant createdAt;
    private Instant expiresAt;

    public SessionResponseDto(String id, String userId, String userAgent, String ip,
                              Instant createdAt, Instant expiresAt) {
        this.id = id;
        this.userId = userId;
        this.userAgent = userAgent;
        this.ip = ip;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
    }

    public static SessionResponseDto from(SessionData session) {
        return new SessionResponseDto(session.getId(), session.getUserId(), session.getUserAgent(),
                session.getIp(), session.getCreatedAt(), session.getExpiresAt());
    }

    // Getters
    public String getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public String getIp() {
        return ip;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }
}
