package com.linkfolio.auth.ratelimit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linkfolio.auth.support.InMemoryKeyValueStore;
import com.linkfolio.auth.support.MutableClock;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RateLimitFilter Tests")
class RateLimitFilterTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private MutableClock clock;
    private InMemoryKeyValueStore store;
    private RateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochSecond(1_700_000_040L);
        store = new InMemoryKeyValueStore(clock);
        rateLimiter = new RateLimiter(store, clock, "rate_limit", true);
    }

    @Test
    @DisplayName("Admitted requests carry the quota headers")
    void headersOnSuccess() throws Exception {
        RateLimitFilter filter = new RateLimitFilter(rateLimiter, RateLimitPolicy.strict(), objectMapper, clock);
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request("198.51.100.1"), response, chain);

        assertThat(chain.getRequest()).isNotNull();
        assertThat(response.getHeader("X-RateLimit-Limit")).isEqualTo("30");
        assertThat(response.getHeader("X-RateLimit-Remaining")).isEqualTo("29");
        assertThat(response.getHeader("X-RateLimit-Reset")).isEqualTo("1700000100");
    }

    @Test
    @DisplayName("Requests over the burst get 429 with Retry-After and never reach the handler")
    void tooManyRequests() throws Exception {
        RateLimitFilter filter = new RateLimitFilter(rateLimiter, RateLimitPolicy.strict(), objectMapper, clock);
        for (int i = 0; i < 5; i++) {
            filter.doFilter(request("198.51.100.1"), new MockHttpServletResponse(), new MockFilterChain());
        }

        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();
        filter.doFilter(request("198.51.100.1"), response, chain);

        assertThat(response.getStatus()).isEqualTo(429);
        assertThat(response.getHeader("Retry-After")).isEqualTo("60");
        assertThat(response.getContentAsString()).contains("RATE_LIMIT_EXCEEDED");
        assertThat(chain.getRequest()).isNull();

        MockHttpServletResponse otherClient = new MockHttpServletResponse();
        filter.doFilter(request("198.51.100.2"), otherClient, new MockFilterChain());
        assertThat(otherClient.getStatus()).isEqualTo(200);
    }

    @Test
    @DisplayName("The first X-Forwarded-For entry identifies the client")
    void forwardedFor() throws Exception {
        RateLimitFilter filter = new RateLimitFilter(rateLimiter, RateLimitPolicy.strict(), objectMapper, clock);
        MockHttpServletRequest request = request("10.0.0.1");
        request.addHeader("X-Forwarded-For", "203.0.113.9, 10.0.0.1");

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        assertThat(store.contains("rate_limit:ip:203.0.113.9")).isTrue();
    }

    @Test
    @DisplayName("A closed limiter with a dead store answers 503")
    void storeDownFailClosed() throws Exception {
        store.setUnavailable(true);
        RateLimiter closed = new RateLimiter(store, clock, "rate_limit", false);
        RateLimitFilter filter = new RateLimitFilter(closed, RateLimitPolicy.strict(), objectMapper, clock);
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request("198.51.100.1"), response, new MockFilterChain());

        assertThat(response.getStatus()).isEqualTo(503);
        assertThat(response.getContentAsString()).contains("RATE_LIMITER_UNAVAILABLE");
    }

    @Test
    @DisplayName("Skip-successful policies count the request after the handler fails")
    void countsFailedResponses() throws Exception {
        RateLimitPolicy policy = new RateLimitPolicy("auth", 10, 5, Duration.ofMinutes(1), true,
                RateLimitKeyResolver.byIp());
        RateLimitFilter filter = new RateLimitFilter(rateLimiter, policy, objectMapper, clock);

        filter.doFilter(request("198.51.100.1"), new MockHttpServletResponse(),
                new MockFilterChain(new HttpServlet() {
                    @Override
                    protected void service(HttpServletRequest req, HttpServletResponse res) {
                        res.setStatus(401);
                    }
                }));
        filter.doFilter(request("198.51.100.1"), new MockHttpServletResponse(), new MockFilterChain());

        assertThat(store.get("rate_limit:ip:198.51.100.1")).contains("1");
    }

    private MockHttpServletRequest request(String remoteAddr) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/auth/login");
        request.setRemoteAddr(remoteAddr);
        return request;
    }
}
