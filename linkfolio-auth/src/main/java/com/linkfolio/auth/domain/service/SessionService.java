package com.linkfolio.auth.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linkfolio.auth.domain.exception.KeyValueStoreException;
import com.linkfolio.auth.domain.exception.SessionNotFoundException;
import com.linkfolio.auth.domain.model.SessionData;
import com.linkfolio.auth.domain.port.KeyValueStore;
import com.linkfolio.auth.domain.utils.CryptoUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

import static com.linkfolio.auth.domain.constants.AuthConstants.SESSION_KEY_PREFIX;
import static com.linkfolio.auth.domain.constants.AuthConstants.USER_SESSIONS_KEY_FORMAT;

/**
 * Session Service - server-side login sessions in the key-value store
 *
 * <p>Layout: the record lives at {@code session:<id>}; a pointer at
 * {@code user:<userId>:sessions:<id>} allows revoking every session of a user.
 * Both carry the same TTL. Records read past their expiry are deleted and reported absent.
 */
@Service
@Slf4j
public class SessionService {

    private final KeyValueStore keyValueStore;
    private final ObjectMapper objectMapper;
    private final CryptoUtils cryptoUtils;
    private final Clock clock;
    private final Duration defaultTtl;

    public SessionService(KeyValueStore keyValueStore,
                          ObjectMapper objectMapper,
                          CryptoUtils cryptoUtils,
                          Clock clock,
                          @Value("${linkfolio.auth.session.ttl:24h}") Duration defaultTtl) {
        this.keyValueStore = keyValueStore;
        this.objectMapper = objectMapper;
        this.cryptoUtils = cryptoUtils;
        this.clock = clock;
        this.defaultTtl = defaultTtl;
    }

    public SessionData create(String userId, String userAgent, String ip, Duration ttl) {
        Duration effectiveTtl = effective(ttl);
        Instant now = clock.instant();
        String sessionId = cryptoUtils.generateSessionId();

        SessionData session = new SessionData(sessionId, userId, userAgent, ip, now, now.plus(effectiveTtl));
        keyValueStore.set(sessionKey(sessionId), serialize(session), effectiveTtl);

        try {
            keyValueStore.set(pointerKey(userId, sessionId), sessionId, effectiveTtl);
        } catch (KeyValueStoreException e) {
            log.warn("[SESSION_INDEX_FAILED] Could not index session for user | sessionId={} | userId={} | error={}",
                    sessionId, userId, e.getMessage());
        }

        log.debug("[SESSION_CREATED] Session stored | sessionId={} | userId={} | ttl={}", sessionId, userId, effectiveTtl);
        return session;
    }

    public Optional<SessionData> get(String sessionId) {
        Optional<String> raw = keyValueStore.get(sessionKey(sessionId));
        if (raw.isEmpty()) {
            return Optional.empty();
        }

        SessionData session = deserialize(raw.get());
        if (session.isExpiredAt(clock.instant())) {
            log.debug("[SESSION_EXPIRED] Expired session removed on read | sessionId={}", sessionId);
            try {
                keyValueStore.delete(sessionKey(sessionId), pointerKey(session.getUserId(), sessionId));
            } catch (KeyValueStoreException e) {
                log.warn("[SESSION_CLEANUP_FAILED] Could not remove expired session | sessionId={} | error={}",
                        sessionId, e.getMessage());
            }
            return Optional.empty();
        }
        return Optional.of(session);
    }

    public void delete(String sessionId) {
        Optional<String> raw = keyValueStore.get(sessionKey(sessionId));
        if (raw.isPresent()) {
            SessionData session = deserialize(raw.get());
            try {
                keyValueStore.delete(pointerKey(session.getUserId(), sessionId));
            } catch (KeyValueStoreException e) {
                log.warn("[SESSION_INDEX_CLEANUP_FAILED] Could not remove session pointer | sessionId={} | error={}",
                        sessionId, e.getMessage());
            }
        }
        keyValueStore.delete(sessionKey(sessionId));
        log.debug("[SESSION_DELETED] Session removed | sessionId={}", sessionId);
    }

    /**
     * Deletes every session indexed for the user. Individual failures are logged and skipped.
     *
     * @return number of sessions removed
     */
    public int deleteAllForPrincipal(String userId) {
        String prefix = String.format(USER_SESSIONS_KEY_FORMAT, userId);
        Set<String> pointers = keyValueStore.keys(prefix + "*");

        int deleted = 0;
        for (String pointer : pointers) {
            String sessionId = pointer.substring(prefix.length());
            try {
                deleted += keyValueStore.delete(sessionKey(sessionId)) > 0 ? 1 : 0;
                keyValueStore.delete(pointer);
            } catch (KeyValueStoreException e) {
                log.warn("[SESSION_DELETE_FAILED] Could not remove session | sessionId={} | userId={} | error={}",
                        sessionId, userId, e.getMessage());
            }
        }

        log.info("[SESSIONS_REVOKED] Sessions removed for user | userId={} | count={}", userId, deleted);
        return deleted;
    }

    /**
     * Extends the session to {@code now + ttl}.
     *
     * @throws SessionNotFoundException if the session is absent or expired
     */
    public SessionData refresh(String sessionId, Duration ttl) {
        SessionData session = get(sessionId)
                .orElseThrow(() -> new SessionNotFoundException("Session not found"));

        Duration effectiveTtl = effective(ttl);
        session.setExpiresAt(clock.instant().plus(effectiveTtl));
        keyValueStore.set(sessionKey(sessionId), serialize(session), effectiveTtl);

        try {
            keyValueStore.expire(pointerKey(session.getUserId(), sessionId), effectiveTtl);
        } catch (KeyValueStoreException e) {
            log.warn("[SESSION_INDEX_FAILED] Could not extend session pointer | sessionId={} | error={}",
                    sessionId, e.getMessage());
        }
        return session;
    }

    private Duration effective(Duration ttl) {
        return ttl == null || ttl.isZero() || ttl.isNegative() ? defaultTtl : ttl;
    }

    private String sessionKey(String sessionId) {
        return SESSION_KEY_PREFIX + sessionId;
    }

    private String pointerKey(String userId, String sessionId) {
        return String.format(USER_SESSIONS_KEY_FORMAT, userId) + sessionId;
    }

    private String serialize(SessionData session) {
        try {
            return objectMapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize session", e);
        }
    }

    private SessionData deserialize(String json) {
        try {
            return objectMapper.readValue(json, SessionData.class);
        } catch (JsonProcessingException e) {
            throw new KeyValueStoreException("Stored session is unreadable", e);
        }
    }
}
