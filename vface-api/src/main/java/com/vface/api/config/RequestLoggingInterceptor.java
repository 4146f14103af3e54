package com.vface.api.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Logs each API request with its status and duration, tagged with a correlation ID.
 * Fingerprints in paths are shortened to their first 16 characters.
 */
@Component
public class RequestLoggingInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(RequestLoggingInterceptor.class);

    static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    private static final String TRACE_ID = "traceId";
    private static final String START_TIME_ATTRIBUTE = RequestLoggingInterceptor.class.getName() + ".startTime";
    private static final Pattern FINGERPRINT = Pattern.compile("([a-f0-9]{16})[a-f0-9]{48}");

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank() || correlationId.length() > 64) {
            correlationId = UUID.randomUUID().toString();
        }
        MDC.put(TRACE_ID, correlationId);
        request.setAttribute(START_TIME_ATTRIBUTE, System.nanoTime());
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler,
                                Exception ex) {
        Object start = request.getAttribute(START_TIME_ATTRIBUTE);
        if (start instanceof Long startNanos) {
            long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
            String uri = maskFingerprints(request.getRequestURI());
            int status = response.getStatus();
            if (status >= 500) {
                log.error("{} {} -> {} ({}ms)", request.getMethod(), uri, status, durationMs);
            } else if (status >= 400) {
                log.warn("{} {} -> {} ({}ms)", request.getMethod(), uri, status, durationMs);
            } else {
                log.info("{} {} -> {} ({}ms)", request.getMethod(), uri, status, durationMs);
            }
        }
        MDC.remove(TRACE_ID);
    }

    static String maskFingerprints(String uri) {
        return FINGERPRINT.matcher(uri).replaceAll("$1...");
    }
}
