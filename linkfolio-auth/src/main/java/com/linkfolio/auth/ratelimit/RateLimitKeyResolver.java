package com.linkfolio.auth.ratelimit;

import com.linkfolio.auth.domain.model.TokenClaims;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Derives the rate-limit key for a request. The namespace prefix is added by the limiter.
 */
@FunctionalInterface
public interface RateLimitKeyResolver {

    String resolve(HttpServletRequest request);

    /**
     * {@code ip:<addr>}
     */
    static RateLimitKeyResolver byIp() {
        return request -> "ip:" + clientIp(request);
    }

    /**
     * {@code user:<id>} for authenticated requests, otherwise {@code ip:<addr>}.
     */
    static RateLimitKeyResolver byUser() {
        return request -> {
            Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
            if (authentication != null && authentication.getPrincipal() instanceof TokenClaims) {
                return "user:" + ((TokenClaims) authentication.getPrincipal()).getUserId();
            }
            return "ip:" + clientIp(request);
        };
    }

    /**
     * {@code endpoint:<method>:<route>:<addr>}
     */
    static RateLimitKeyResolver byEndpoint() {
        return request -> "endpoint:" + request.getMethod() + ":" + request.getRequestURI() + ":" + clientIp(request);
    }

    static String clientIp(HttpServletRequest request) {
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
            return xForwardedFor.split(",")[0].trim();
        }

        String xRealIP = request.getHeader("X-Real-IP");
        if (xRealIP != null && !xRealIP.isEmpty()) {
            return xRealIP;
        }

        return request.getRemoteAddr() != null ? request.getRemoteAddr() : "unknown";
    }
}
