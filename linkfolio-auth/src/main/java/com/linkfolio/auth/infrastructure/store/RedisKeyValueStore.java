package com.linkfolio.auth.infrastructure.store;

import com.linkfolio.auth.domain.exception.KeyValueStoreException;
import com.linkfolio.auth.domain.model.QuotaAcquisition;
import com.linkfolio.auth.domain.port.KeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * {@link KeyValueStore} over Spring Data Redis.
 */
@Component
@Slf4j
public class RedisKeyValueStore implements KeyValueStore {

    private final StringRedisTemplate redisTemplate;
    private final RedisScript<Long> incrementWithTtlScript;
    @SuppressWarnings("rawtypes")
    private final RedisScript<List> rateLimitAcquireScript;

    @SuppressWarnings("rawtypes")
    public RedisKeyValueStore(StringRedisTemplate redisTemplate,
                              RedisScript<Long> incrementWithTtlScript,
                              RedisScript<List> rateLimitAcquireScript) {
        this.redisTemplate = redisTemplate;
        this.incrementWithTtlScript = incrementWithTtlScript;
        this.rateLimitAcquireScript = rateLimitAcquireScript;
    }

    @Override
    public Optional<String> get(String key) {
        return run("get", () -> Optional.ofNullable(redisTemplate.opsForValue().get(key)));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        run("set", () -> {
            redisTemplate.opsForValue().set(key, value, ttl);
            return null;
        });
    }

    @Override
    public long delete(String... keys) {
        if (keys.length == 0) {
            return 0;
        }
        Long deleted = run("delete", () -> redisTemplate.delete(Arrays.asList(keys)));
        return deleted != null ? deleted : 0;
    }

    @Override
    public long incr(String key) {
        Long value = run("incr", () -> redisTemplate.opsForValue().increment(key));
        return value != null ? value : 0;
    }

    @Override
    public long incrementWithTtl(String key, Duration ttl) {
        List<String> keys = Collections.singletonList(key);
        Long value = run("incrementWithTtl",
                () -> redisTemplate.execute(incrementWithTtlScript, keys, String.valueOf(ttl.toMillis())));
        return value != null ? value : 0;
    }

    @Override
    @SuppressWarnings("rawtypes")
    public QuotaAcquisition acquireWithinLimits(String windowKey, long windowLimit, Duration windowTtl,
                                                String burstKey, long burstLimit, Duration burstTtl) {
        List<String> keys = Arrays.asList(windowKey, burstKey);
        List result = run("acquireWithinLimits", () -> redisTemplate.execute(rateLimitAcquireScript, keys,
                String.valueOf(windowLimit), String.valueOf(windowTtl.toMillis()),
                String.valueOf(burstLimit), String.valueOf(burstTtl.toMillis())));
        if (result == null || result.size() < 2) {
            throw new KeyValueStoreException("Unexpected rate limit script reply: " + result, null);
        }
        return new QuotaAcquisition(
                ((Number) result.get(0)).longValue() == 1L,
                ((Number) result.get(1)).longValue()
        );
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        return Boolean.TRUE.equals(run("expire", () -> redisTemplate.expire(key, ttl)));
    }

    @Override
    public Set<String> keys(String pattern) {
        Set<String> keys = run("keys", () -> redisTemplate.keys(pattern));
        return keys != null ? keys : Collections.emptySet();
    }

    private <T> T run(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.warn("[REDIS_ERROR] Key-value operation failed | operation={} | error={}", operation, e.getMessage());
            throw new KeyValueStoreException("Key-value store operation failed: " + operation, e);
        }
    }
}
