package com.linkfolio.auth.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Server-side login session, stored as JSON under {@code session:<id>}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionData {
    private String id;
    private String userId;
    private String userAgent;
    private String ip;
    private Instant createdAt;
    private Instant expiresAt;

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }
}
