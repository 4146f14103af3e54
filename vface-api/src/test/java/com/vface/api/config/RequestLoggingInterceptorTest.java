package com.vface.api.config;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.*;

class RequestLoggingInterceptorTest {

    private final RequestLoggingInterceptor interceptor = new RequestLoggingInterceptor();

    @Test
    void fingerprintsInPathsAreShortened() {
        String fingerprint = "a".repeat(16) + "b".repeat(48);

        assertThat(RequestLoggingInterceptor.maskFingerprints("/api/v1/consent/active/" + fingerprint))
                .isEqualTo("/api/v1/consent/active/aaaaaaaaaaaaaaaa...");
    }

    @Test
    void correlationIdIsEchoedOrGenerated() {
        MockHttpServletRequest tagged = new MockHttpServletRequest("GET", "/api/v1/info");
        tagged.addHeader(RequestLoggingInterceptor.CORRELATION_ID_HEADER, "trace-123");
        MockHttpServletResponse taggedResponse = new MockHttpServletResponse();
        interceptor.preHandle(tagged, taggedResponse, new Object());
        interceptor.afterCompletion(tagged, taggedResponse, new Object(), null);

        MockHttpServletRequest untagged = new MockHttpServletRequest("GET", "/api/v1/info");
        MockHttpServletResponse untaggedResponse = new MockHttpServletResponse();
        interceptor.preHandle(untagged, untaggedResponse, new Object());
        interceptor.afterCompletion(untagged, untaggedResponse, new Object(), null);

        assertThat(taggedResponse.getHeader(RequestLoggingInterceptor.CORRELATION_ID_HEADER)).isEqualTo("trace-123");
        assertThat(untaggedResponse.getHeader(RequestLoggingInterceptor.CORRELATION_ID_HEADER)).hasSize(36);
    }
}
