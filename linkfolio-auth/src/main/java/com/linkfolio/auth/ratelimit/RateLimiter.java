package com.linkfolio.auth.ratelimit;

import com.linkfolio.auth.domain.exception.KeyValueStoreException;
import com.linkfolio.auth.domain.model.QuotaAcquisition;
import com.linkfolio.auth.domain.port.KeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

import static com.linkfolio.auth.domain.constants.AuthConstants.BURST_KEY_SUFFIX;
import static com.linkfolio.auth.domain.constants.AuthConstants.BURST_WINDOW;

/**
 * Fixed-window rate limiter with burst protection over the key-value store.
 *
 * <p>Each key has a window counter ({@code <ns>:<key>}, TTL = window size) and a burst counter
 * ({@code <ns>:<key>:burst}, TTL = 10s). Both TTLs are set when the counter is created.
 *
 * <p>{@link #allow} followed by {@link #record} is a read-then-increment sequence: concurrent
 * requests can both see the last free slot and both pass. {@link #tryAcquire} checks and increments
 * both counters in one atomic store operation, and a denied request is not counted.
 *
 * <p>Store errors allow the request when fail-open is enabled (the default).
 */
@Component
@Slf4j
public class RateLimiter {

    private final KeyValueStore keyValueStore;
    private final Clock clock;
    private final String namespace;
    private final boolean failOpen;

    public RateLimiter(KeyValueStore keyValueStore,
                       Clock clock,
                       @Value("${linkfolio.auth.rate-limit.namespace:rate_limit}") String namespace,
                       @Value("${linkfolio.auth.rate-limit.fail-open:true}") boolean failOpen) {
        this.keyValueStore = keyValueStore;
        this.clock = clock;
        this.namespace = namespace;
        this.failOpen = failOpen;
    }

    /**
     * Read-only check against the current counters.
     */
    public RateLimitDecision allow(RateLimitPolicy policy, String key) {
        Instant resetAt = resetAt(policy);
        String windowKey = namespaced(key);
        int limit = policy.getRequestsPerWindow();

        try {
            long count = keyValueStore.get(windowKey).map(Long::parseLong).orElse(0L);
            long burst = keyValueStore.get(windowKey + BURST_KEY_SUFFIX).map(Long::parseLong).orElse(0L);

            if (count >= limit || burst >= policy.getBurstSize()) {
                log.debug("[RATE_LIMIT_DENIED] Request over quota | policy={} | key={} | count={} | burst={}",
                        policy.getName(), windowKey, count, burst);
                return new RateLimitDecision(false, limit, (int) Math.max(0, limit - count), resetAt);
            }
            return new RateLimitDecision(true, limit, (int) (limit - count - 1), resetAt);
        } catch (KeyValueStoreException | NumberFormatException e) {
            return onStoreError(policy, windowKey, resetAt, e);
        }
    }

    /**
     * Counts a completed request. Never throws.
     */
    public void record(RateLimitPolicy policy, String key, int status) {
        if (policy.isSkipSuccessful() && status >= 200 && status < 300) {
            return;
        }
        String windowKey = namespaced(key);
        try {
            keyValueStore.incrementWithTtl(windowKey, policy.getWindowSize());
            keyValueStore.incrementWithTtl(windowKey + BURST_KEY_SUFFIX, BURST_WINDOW);
        } catch (KeyValueStoreException e) {
            log.warn("[RATE_LIMIT_RECORD_FAILED] Could not count request | policy={} | key={} | error={}",
                    policy.getName(), windowKey, e.getMessage());
        }
    }

    /**
     * Decides and, when allowed, counts the request in one step.
     */
    public RateLimitDecision tryAcquire(RateLimitPolicy policy, String key) {
        Instant resetAt = resetAt(policy);
        String windowKey = namespaced(key);
        int limit = policy.getRequestsPerWindow();

        try {
            QuotaAcquisition acquisition = keyValueStore.acquireWithinLimits(
                    windowKey, limit, policy.getWindowSize(),
                    windowKey + BURST_KEY_SUFFIX, policy.getBurstSize(), BURST_WINDOW);

            long count = acquisition.getWindowCount();
            if (!acquisition.isAcquired()) {
                log.debug("[RATE_LIMIT_DENIED] Request over quota | policy={} | key={} | count={}",
                        policy.getName(), windowKey, count);
            }
            return new RateLimitDecision(acquisition.isAcquired(), limit, (int) Math.max(0, limit - count), resetAt);
        } catch (KeyValueStoreException e) {
            return onStoreError(policy, windowKey, resetAt, e);
        }
    }

    private RateLimitDecision onStoreError(RateLimitPolicy policy, String key, Instant resetAt, RuntimeException e) {
        if (!failOpen) {
            log.error("[RATE_LIMIT_UNAVAILABLE] Rate limiter store failed, rejecting | policy={} | key={}",
                    policy.getName(), key, e);
            throw e instanceof KeyValueStoreException
                    ? (KeyValueStoreException) e
                    : new KeyValueStoreException("Unreadable rate limit counter", e);
        }
        log.warn("[RATE_LIMIT_FAIL_OPEN] Rate limiter store failed, allowing request | policy={} | key={} | error={}",
                policy.getName(), key, e.getMessage());
        return new RateLimitDecision(true, policy.getRequestsPerWindow(), policy.getRequestsPerWindow(), resetAt);
    }

    private Instant resetAt(RateLimitPolicy policy) {
        long windowMillis = policy.getWindowSize().toMillis();
        long nowMillis = clock.millis();
        long windowStart = nowMillis - Math.floorMod(nowMillis, windowMillis);
        return Instant.ofEpochMilli(windowStart + windowMillis);
    }

    private String namespaced(String key) {
        return namespace + ":" + key;
    }
}
