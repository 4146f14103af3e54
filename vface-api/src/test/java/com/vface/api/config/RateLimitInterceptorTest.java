package com.vface.api.config;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for per-IP rate limiting.
 */
class RateLimitInterceptorTest {

    private final RateLimitConfig config = new RateLimitConfig(2, Duration.ofMinutes(15), 3, Duration.ofMinutes(1));
    private final RateLimitInterceptor interceptor = new RateLimitInterceptor(config);

    @Test
    void registrationBucketRejectsAfterCapacity() throws Exception {
        assertThat(interceptor.preHandle(register("10.0.0.1"), new MockHttpServletResponse(), new Object())).isTrue();
        assertThat(interceptor.preHandle(register("10.0.0.1"), new MockHttpServletResponse(), new Object())).isTrue();

        MockHttpServletResponse rejected = new MockHttpServletResponse();
        assertThat(interceptor.preHandle(register("10.0.0.1"), rejected, new Object())).isFalse();
        assertThat(rejected.getStatus()).isEqualTo(429);
        assertThat(rejected.getContentAsString()).contains("\"code\":\"RATE_001\"");
        assertThat(rejected.getHeader("Retry-After")).isNotNull();
    }

    @Test
    void clientsHaveSeparateBuckets() throws Exception {
        interceptor.preHandle(register("10.0.0.1"), new MockHttpServletResponse(), new Object());
        interceptor.preHandle(register("10.0.0.1"), new MockHttpServletResponse(), new Object());

        assertThat(interceptor.preHandle(register("10.0.0.2"), new MockHttpServletResponse(), new Object())).isTrue();
    }

    @Test
    void registrationDoesNotDrainDefaultBucket() throws Exception {
        interceptor.preHandle(register("10.0.0.3"), new MockHttpServletResponse(), new Object());
        interceptor.preHandle(register("10.0.0.3"), new MockHttpServletResponse(), new Object());

        for (int i = 0; i < 3; i++) {
            assertThat(interceptor.preHandle(request("GET", "/api/v1/chain/root", "10.0.0.3"),
                    new MockHttpServletResponse(), new Object())).isTrue();
        }
        assertThat(interceptor.preHandle(request("GET", "/api/v1/chain/root", "10.0.0.3"),
                new MockHttpServletResponse(), new Object())).isFalse();
    }

    @Test
    void forwardedForHeaderTakesPrecedence() {
        MockHttpServletRequest request = request("GET", "/api/v1/info", "127.0.0.1");
        request.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.1");

        assertThat(RateLimitInterceptor.resolveClientId(request)).isEqualTo("203.0.113.7");
    }

    @Test
    void clearedBucketsAreRefilled() throws Exception {
        interceptor.preHandle(register("10.0.0.4"), new MockHttpServletResponse(), new Object());
        interceptor.preHandle(register("10.0.0.4"), new MockHttpServletResponse(), new Object());

        config.clearBuckets("10.0.0.4");

        assertThat(interceptor.preHandle(register("10.0.0.4"), new MockHttpServletResponse(), new Object())).isTrue();
    }

    private static MockHttpServletRequest register(String ip) {
        return request("POST", "/api/v1/identities", ip);
    }

    private static MockHttpServletRequest request(String method, String uri, String ip) {
        MockHttpServletRequest request = new MockHttpServletRequest(method, uri);
        request.setRemoteAddr(ip);
        return request;
    }
}
