package com.linkfolio.auth.support;

import com.linkfolio.auth.domain.exception.KeyValueStoreException;
import com.linkfolio.auth.domain.model.QuotaAcquisition;
import com.linkfolio.auth.domain.port.KeyValueStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Key-value store with TTLs measured against the supplied clock.
 * {@link #setUnavailable(boolean)} makes every call fail like a lost connection.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Clock clock;
    private final Map<String, String> values = new HashMap<>();
    private final Map<String, Instant> expiries = new HashMap<>();
    private boolean unavailable;

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    public boolean contains(String key) {
        evictIfExpired(key);
        return values.containsKey(key);
    }

    @Override
    public Optional<String> get(String key) {
        check();
        evictIfExpired(key);
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        check();
        values.put(key, value);
        expiries.put(key, clock.instant().plus(ttl));
    }

    @Override
    public long delete(String... keys) {
        check();
        long deleted = 0;
        for (String key : keys) {
            evictIfExpired(key);
            if (values.remove(key) != null) {
                deleted++;
            }
            expiries.remove(key);
        }
        return deleted;
    }

    @Override
    public long incr(String key) {
        check();
        evictIfExpired(key);
        long next = Long.parseLong(values.getOrDefault(key, "0")) + 1;
        values.put(key, String.valueOf(next));
        return next;
    }

    @Override
    public long incrementWithTtl(String key, Duration ttl) {
        long next = incr(key);
        if (next == 1) {
            expiries.put(key, clock.instant().plus(ttl));
        }
        return next;
    }

    @Override
    public QuotaAcquisition acquireWithinLimits(String windowKey, long windowLimit, Duration windowTtl,
                                                String burstKey, long burstLimit, Duration burstTtl) {
        long count = get(windowKey).map(Long::parseLong).orElse(0L);
        long burst = get(burstKey).map(Long::parseLong).orElse(0L);
        if (count >= windowLimit || burst >= burstLimit) {
            return new QuotaAcquisition(false, count);
        }
        long next = incrementWithTtl(windowKey, windowTtl);
        incrementWithTtl(burstKey, burstTtl);
        return new QuotaAcquisition(true, next);
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        check();
        evictIfExpired(key);
        if (!values.containsKey(key)) {
            return false;
        }
        expiries.put(key, clock.instant().plus(ttl));
        return true;
    }

    @Override
    public Set<String> keys(String pattern) {
        check();
        Pattern regex = Pattern.compile(Pattern.quote(pattern).replace("*", "\\E.*\\Q"));
        Set<String> matches = new HashSet<>();
        for (String key : new HashSet<>(values.keySet())) {
            evictIfExpired(key);
            if (values.containsKey(key) && regex.matcher(key).matches()) {
                matches.add(key);
            }
        }
        return matches;
    }

    private void evictIfExpired(String key) {
        Instant expiry = expiries.get(key);
        if (expiry != null && !clock.instant().isBefore(expiry)) {
            values.remove(key);
            expiries.remove(key);
        }
    }

    private void check() {
        if (unavailable) {
            throw new KeyValueStoreException("connection refused", null);
        }
    }
}
