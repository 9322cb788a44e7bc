package com.linkfolio.auth.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linkfolio.auth.ratelimit.RateLimitFilter;
import com.linkfolio.auth.ratelimit.RateLimitKeyResolver;
import com.linkfolio.auth.ratelimit.RateLimitPolicy;
import com.linkfolio.auth.ratelimit.RateLimiter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.security.SecurityProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Registers one rate-limit filter per policy. The IP-keyed default policy runs ahead of the security
 * filter chain so that requests it rejects with 401 are still counted. The other policies run after
 * it so that user-keyed policies see the authenticated principal.
 *
 * <p>Policies that share a route use different key resolvers, so their counters never collide.
 */
@Configuration
@ConditionalOnProperty(prefix = "linkfolio.auth.rate-limit", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RateLimitConfig {

    static final int PRE_SECURITY_ORDER = SecurityProperties.DEFAULT_FILTER_ORDER - 10;
    static final int POST_SECURITY_ORDER = 10;

    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RateLimitConfig(RateLimiter rateLimiter, ObjectMapper objectMapper, Clock clock) {
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Bean
    public FilterRegistrationBean<RateLimitFilter> defaultRateLimitFilter() {
        return register(RateLimitPolicy.defaultPolicy(), PRE_SECURITY_ORDER, "/*");
    }

    @Bean
    public FilterRegistrationBean<RateLimitFilter> credentialRateLimitFilter() {
        return register(RateLimitPolicy.strict().withKeyResolver(RateLimitKeyResolver.byEndpoint()),
                POST_SECURITY_ORDER,
                "/auth/login", "/auth/register", "/auth/verify-email",
                "/auth/password/forgot", "/auth/password/reset");
    }

    @Bean
    public FilterRegistrationBean<RateLimitFilter> refreshRateLimitFilter() {
        return register(RateLimitPolicy.expensiveOperation().withKeyResolver(RateLimitKeyResolver.byEndpoint()),
                POST_SECURITY_ORDER + 1,
                "/auth/token/refresh");
    }

    @Bean
    public FilterRegistrationBean<RateLimitFilter> authenticatedRateLimitFilter() {
        return register(RateLimitPolicy.authenticatedUser(), POST_SECURITY_ORDER + 2,
                "/auth/me", "/auth/email-verified", "/auth/logout", "/auth/sessions/*");
    }

    private FilterRegistrationBean<RateLimitFilter> register(RateLimitPolicy policy, int order, String... urlPatterns) {
        FilterRegistrationBean<RateLimitFilter> registration =
                new FilterRegistrationBean<>(new RateLimitFilter(rateLimiter, policy, objectMapper, clock));
        registration.setName("rateLimit-" + policy.getName());
        registration.addUrlPatterns(urlPatterns);
        registration.setOrder(order);
        return registration;
    }
}
