package com.linkfolio.auth.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.script.RedisScript;

import java.util.List;

/**
 * Redis wiring. The {@code StringRedisTemplate} itself comes from Boot auto-configuration.
 */
@Configuration
public class RedisConfig {

    /**
     * INCR plus first-increment PEXPIRE, executed atomically by Redis.
     */
    @Bean
    public RedisScript<Long> incrementWithTtlScript() {
        return RedisScript.of(
                new ClassPathResource("scripts/increment_with_ttl.lua"),
                Long.class
        );
    }

    /**
     * Window and burst check plus both increments, executed atomically by Redis.
     */
    @Bean
    @SuppressWarnings("rawtypes")
    public RedisScript<List> rateLimitAcquireScript() {
        return RedisScript.of(
                new ClassPathResource("scripts/rate_limit_acquire.lua"),
                List.class
        );
    }
}
