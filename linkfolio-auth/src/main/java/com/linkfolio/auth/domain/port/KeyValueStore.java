package com.linkfolio.auth.domain.port;

import com.linkfolio.auth.domain.model.QuotaAcquisition;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Shared key-value store with per-key TTL and atomic counters.
 *
 * <p>Every operation raises {@link com.linkfolio.auth.domain.exception.KeyValueStoreException}
 * when the store cannot be reached. A missing key is never an error.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    /**
     * @return number of keys that existed and were removed
     */
    long delete(String... keys);

    long incr(String key);

    /**
     * Atomically increments the counter and, when the result is 1, sets its TTL.
     *
     * @return the counter value after the increment
     */
    long incrementWithTtl(String key, Duration ttl);

    /**
     * Atomically checks a window counter and a burst counter against their limits and increments
     * both only when neither limit is reached. Each counter's TTL is set when it is created.
     */
    QuotaAcquisition acquireWithinLimits(String windowKey, long windowLimit, Duration windowTtl,
                                         String burstKey, long burstLimit, Duration burstTtl);

    boolean expire(String key, Duration ttl);

    /**
     * Glob-style lookup ({@code *} wildcard).
     */
    Set<String> keys(String pattern);
}
