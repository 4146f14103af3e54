package com.vface.api.config;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-client rate limiting using Bucket4j.
 * Registration has its own strict bucket; every other API call shares the default bucket.
 */
@Configuration
public class RateLimitConfig {

    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    private final long registerCapacity;
    private final Duration registerWindow;
    private final long defaultCapacity;
    private final Duration defaultWindow;

    public RateLimitConfig(
            @Value("${vface.rate-limit.register.capacity:5}") long registerCapacity,
            @Value("${vface.rate-limit.register.window:PT15M}") Duration registerWindow,
            @Value("${vface.rate-limit.default.capacity:100}") long defaultCapacity,
            @Value("${vface.rate-limit.default.window:PT1M}") Duration defaultWindow) {
        this.registerCapacity = registerCapacity;
        this.registerWindow = registerWindow;
        this.defaultCapacity = defaultCapacity;
        this.defaultWindow = defaultWindow;
    }

    public Bucket resolveBucket(String clientId) {
        return buckets.computeIfAbsent(clientId, key -> createBucket(defaultCapacity, defaultWindow));
    }

    public Bucket resolveRegisterBucket(String clientId) {
        return buckets.computeIfAbsent(clientId + ":register", key -> createBucket(registerCapacity, registerWindow));
    }

    private static Bucket createBucket(long capacity, Duration window) {
        Bandwidth limit = Bandwidth.classic(capacity, Refill.greedy(capacity, window));
        return Bucket.builder().addLimit(limit).build();
    }

    /**
     * Clear rate limit buckets for a client (for testing).
     */
    public void clearBuckets(String clientId) {
        buckets.remove(clientId);
        buckets.remove(clientId + ":register");
    }
}
