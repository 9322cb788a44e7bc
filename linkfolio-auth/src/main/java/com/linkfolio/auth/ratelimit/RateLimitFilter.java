package com.linkfolio.auth.ratelimit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linkfolio.auth.api.dto.ApiErrorResponse;
import com.linkfolio.auth.domain.exception.KeyValueStoreException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;

/**
 * Applies one {@link RateLimitPolicy} to the URL patterns it is registered for.
 *
 * <p>Policies that ignore successful responses need the status code, so they are checked before
 * the request and counted after it. All other policies count and decide up front.
 */
@Slf4j
public class RateLimitFilter extends OncePerRequestFilter {

    private final RateLimiter rateLimiter;
    private final RateLimitPolicy policy;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RateLimitFilter(RateLimiter rateLimiter, RateLimitPolicy policy, ObjectMapper objectMapper, Clock clock) {
        this.rateLimiter = rateLimiter;
        this.policy = policy;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String key = policy.getKeyResolver().resolve(request);

        RateLimitDecision decision;
        try {
            decision = policy.isSkipSuccessful()
                    ? rateLimiter.allow(policy, key)
                    : rateLimiter.tryAcquire(policy, key);
        } catch (KeyValueStoreException e) {
            writeError(response, request, HttpStatus.SERVICE_UNAVAILABLE, "RATE_LIMITER_UNAVAILABLE",
                    "Rate limiting is temporarily unavailable");
            return;
        }

        addRateLimitHeaders(response, decision);

        if (!decision.isAllowed()) {
            handleRateLimitExceeded(request, response, decision);
            return;
        }

        try {
            filterChain.doFilter(request, response);
        } finally {
            if (policy.isSkipSuccessful()) {
                rateLimiter.record(policy, key, response.getStatus());
            }
        }
    }

    private void addRateLimitHeaders(HttpServletResponse response, RateLimitDecision decision) {
        response.setHeader("X-RateLimit-Limit", String.valueOf(decision.getLimit()));
        response.setHeader("X-RateLimit-Remaining", String.valueOf(Math.max(0, decision.getRemaining())));
        response.setHeader("X-RateLimit-Reset", String.valueOf(decision.getResetAt().getEpochSecond()));
    }

    private void handleRateLimitExceeded(HttpServletRequest request, HttpServletResponse response,
                                         RateLimitDecision decision) throws IOException {
        long retryAfter = Math.max(1, Duration.between(clock.instant(), decision.getResetAt()).toSeconds());
        log.warn("[RATE_LIMIT_EXCEEDED] Request rejected | policy={} | path={} | retryAfter={}s",
                policy.getName(), request.getRequestURI(), retryAfter);

        response.setHeader("Retry-After", String.valueOf(retryAfter));
        writeError(response, request, HttpStatus.TOO_MANY_REQUESTS, "RATE_LIMIT_EXCEEDED", "Too many requests");
    }

    private void writeError(HttpServletResponse response, HttpServletRequest request, HttpStatus status,
                            String code, String message) throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        ApiErrorResponse body = new ApiErrorResponse(code, message, request.getHeader("X-Trace-Id"));
        objectMapper.writeValue(response.getOutputStream(), body);
    }
}
