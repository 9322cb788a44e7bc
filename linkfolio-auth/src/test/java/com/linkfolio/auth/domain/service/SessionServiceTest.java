package com.linkfolio.auth.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linkfolio.auth.domain.exception.KeyValueStoreException;
import com.linkfolio.auth.domain.exception.SessionNotFoundException;
import com.linkfolio.auth.domain.model.SessionData;
import com.linkfolio.auth.domain.port.KeyValueStore;
import com.linkfolio.auth.domain.utils.CryptoUtils;
import com.linkfolio.auth.support.InMemoryKeyValueStore;
import com.linkfolio.auth.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

@DisplayName("SessionService Tests")
class SessionServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final CryptoUtils cryptoUtils = new CryptoUtils(new SecureRandom());

    private MutableClock clock;
    private InMemoryKeyValueStore store;
    private SessionService sessionService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochSecond(1_700_000_000L);
        store = new InMemoryKeyValueStore(clock);
        sessionService = new SessionService(store, objectMapper, cryptoUtils, clock, Duration.ofHours(24));
    }

    @Test
    @DisplayName("create() stores the record and the per-user pointer")
    void createStoresRecordAndPointer() {
        // When
        SessionData session = sessionService.create("user-1", "JUnit", "203.0.113.7", Duration.ofMinutes(30));

        // Then
        assertThat(session.getId()).hasSize(64).matches("[0-9a-f]+");
        assertThat(session.getExpiresAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(30)));
        assertThat(store.contains("session:" + session.getId())).isTrue();
        assertThat(store.contains("user:user-1:sessions:" + session.getId())).isTrue();
        assertThat(sessionService.get(session.getId())).contains(session);
    }

    @Test
    @DisplayName("A missing or non-positive ttl falls back to the default")
    void defaultTtl() {
        Instant expected = clock.instant().plus(Duration.ofHours(24));

        assertThat(sessionService.create("u", "a", "i", null).getExpiresAt()).isEqualTo(expected);
        assertThat(sessionService.create("u", "a", "i", Duration.ZERO).getExpiresAt()).isEqualTo(expected);
        assertThat(sessionService.create("u", "a", "i", Duration.ofSeconds(-5)).getExpiresAt()).isEqualTo(expected);
    }

    @Test
    @DisplayName("A one-second session read two seconds later is gone with its pointer")
    void expiredSessionAbsent() {
        SessionData session = sessionService.create("user-1", "JUnit", "203.0.113.7", Duration.ofSeconds(1));

        clock.advance(Duration.ofSeconds(2));

        assertThat(sessionService.get(session.getId())).isEmpty();
        assertThat(store.contains("user:user-1:sessions:" + session.getId())).isFalse();
    }

    @Test
    @DisplayName("A record still in the store past its expiry is deleted on read")
    void lazyExpiryDeletesBothKeys() throws Exception {
        // Given - a store that has not evicted the record yet
        KeyValueStore lagging = mock(KeyValueStore.class);
        SessionService service = new SessionService(lagging, objectMapper, cryptoUtils, clock, Duration.ofHours(24));
        SessionData stale = new SessionData("abc", "user-1", "JUnit", "203.0.113.7",
                clock.instant().minusSeconds(120), clock.instant().minusSeconds(60));
        given(lagging.get("session:abc")).willReturn(Optional.of(objectMapper.writeValueAsString(stale)));

        // When
        Optional<SessionData> result = service.get("abc");

        // Then
        assertThat(result).isEmpty();
        verify(lagging).delete("session:abc", "user:user-1:sessions:abc");
    }

    @Test
    @DisplayName("create() succeeds when only the pointer write fails")
    void pointerFailureTolerated() {
        KeyValueStore flaky = mock(KeyValueStore.class);
        doNothing().when(flaky).set(startsWith("session:"), anyString(), any());
        doThrow(new KeyValueStoreException("connection reset", null))
                .when(flaky).set(startsWith("user:"), anyString(), any());
        SessionService service = new SessionService(flaky, objectMapper, cryptoUtils, clock, Duration.ofHours(24));

        SessionData session = service.create("user-1", "JUnit", "203.0.113.7", null);

        assertThat(session.getId()).isNotBlank();
        verify(flaky).set(eq("session:" + session.getId()), anyString(), eq(Duration.ofHours(24)));
    }

    @Test
    @DisplayName("create() fails when the record itself cannot be written")
    void recordFailurePropagates() {
        store.setUnavailable(true);

        assertThrows(KeyValueStoreException.class, () -> sessionService.create("user-1", "a", "i", null));
    }

    @Test
    @DisplayName("refresh() moves the expiry to now + ttl")
    void refreshExtends() {
        SessionData session = sessionService.create("user-1", "JUnit", "203.0.113.7", Duration.ofMinutes(5));
        clock.advance(Duration.ofMinutes(4));

        SessionData refreshed = sessionService.refresh(session.getId(), Duration.ofMinutes(10));
        clock.advance(Duration.ofMinutes(9));

        assertThat(refreshed.getExpiresAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(1)));
        assertThat(sessionService.get(session.getId())).isPresent();
        assertThat(store.contains("user:user-1:sessions:" + session.getId())).isTrue();
    }

    @Test
    @DisplayName("refresh() of an unknown or expired session fails")
    void refreshMissing() {
        SessionData session = sessionService.create("user-1", "JUnit", "203.0.113.7", Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(2));

        assertThrows(SessionNotFoundException.class, () -> sessionService.refresh(session.getId(), null));
        assertThrows(SessionNotFoundException.class, () -> sessionService.refresh("missing", null));
    }

    @Test
    @DisplayName("delete() removes the record and the pointer")
    void deleteRemovesBoth() {
        SessionData session = sessionService.create("user-1", "JUnit", "203.0.113.7", null);

        sessionService.delete(session.getId());

        assertThat(sessionService.get(session.getId())).isEmpty();
        assertThat(store.contains("user:user-1:sessions:" + session.getId())).isFalse();
    }

    @Test
    @DisplayName("deleteAllForPrincipal() only touches that user's sessions")
    void deleteAllForPrincipal() {
        SessionData first = sessionService.create("user-1", "a", "i", null);
        SessionData second = sessionService.create("user-1", "b", "i", null);
        SessionData other = sessionService.create("user-2", "c", "i", null);

        int deleted = sessionService.deleteAllForPrincipal("user-1");

        assertThat(deleted).isEqualTo(2);
        assertThat(sessionService.get(first.getId())).isEmpty();
        assertThat(sessionService.get(second.getId())).isEmpty();
        assertThat(sessionService.get(other.getId())).isPresent();
    }
}
