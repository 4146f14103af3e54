package com.vface.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vface.api.error.ErrorResponse;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Per-IP rate limiting. Registration draws from its own small bucket; every other call
 * shares the default bucket. An empty bucket answers 429 with the standard error body.
 */
@Component
public class RateLimitInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(RateLimitInterceptor.class);
    private static final ObjectMapper ERROR_WRITER = new ObjectMapper();

    static final String REGISTER_PATH = "/api/v1/identities";
    static final String REMAINING_HEADER = "X-Rate-Limit-Remaining";

    private final RateLimitConfig rateLimitConfig;

    public RateLimitInterceptor(RateLimitConfig rateLimitConfig) {
        this.rateLimitConfig = rateLimitConfig;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response,
                             Object handler) throws Exception {
        String clientId = resolveClientId(request);
        boolean registration = isRegistration(request);
        Bucket bucket = registration
                ? rateLimitConfig.resolveRegisterBucket(clientId)
                : rateLimitConfig.resolveBucket(clientId);

        ConsumptionProbe probe = bucket.tryConsumeAndReturnRemaining(1);
        if (!probe.isConsumed()) {
            reject(response, clientId, request, probe);
            return false;
        }
        response.addHeader(REMAINING_HEADER, Long.toString(probe.getRemainingTokens()));
        return true;
    }

    private void reject(HttpServletResponse response, String clientId, HttpServletRequest request,
                        ConsumptionProbe probe) throws IOException {
        // round up so clients never retry before the refill
        long retryAfterSeconds = Math.max(1, TimeUnit.NANOSECONDS.toSeconds(probe.getNanosToWaitForRefill() + 999_999_999L));
        log.warn("Rate limit exceeded for {} on {} {}", clientId, request.getMethod(), request.getRequestURI());

        ErrorResponse body = ErrorResponse.of("RATE_001", "RATE_LIMITED",
                "Rate limit exceeded, retry after " + retryAfterSeconds + "s", true);
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setHeader(HttpHeaders.RETRY_AFTER, Long.toString(retryAfterSeconds));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        ERROR_WRITER.writeValue(response.getWriter(), body);
    }

    private static boolean isRegistration(HttpServletRequest request) {
        return HttpMethod.POST.matches(request.getMethod()) && REGISTER_PATH.equals(request.getRequestURI());
    }

    /**
     * First hop of {@code X-Forwarded-For} when present, otherwise the socket address.
     */
    static String resolveClientId(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded == null || forwarded.isBlank()) {
            return request.getRemoteAddr();
        }
        int comma = forwarded.indexOf(',');
        return (comma < 0 ? forwarded : forwarded.substring(0, comma)).trim();
    }
}
