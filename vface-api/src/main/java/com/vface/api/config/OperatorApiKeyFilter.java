package com.vface.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vface.api.error.ErrorResponse;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Authenticates registry operators by a shared API key header.
 *
 * Operators may read decrypted vectors and run maintenance jobs. Requests without the header
 * continue anonymously; requests with a wrong key are rejected. An empty configured key
 * disables operator access entirely.
 */
public class OperatorApiKeyFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(OperatorApiKeyFilter.class);

    public static final String HEADER = "X-Operator-Key";
    public static final String ROLE_OPERATOR = "ROLE_OPERATOR";
    static final String INVALID_KEY = "AUTH_001";

    private final byte[] expectedKey;
    private final ObjectMapper objectMapper;

    public OperatorApiKeyFilter(String operatorApiKey, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.expectedKey = operatorApiKey == null || operatorApiKey.isBlank()
                ? null
                : operatorApiKey.getBytes(StandardCharsets.UTF_8);
        if (expectedKey == null) {
            log.warn("No operator API key configured; operator endpoints are disabled");
        }
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain) throws ServletException, IOException {

        String presented = request.getHeader(HEADER);
        if (presented != null) {
            if (expectedKey == null
                    || !MessageDigest.isEqual(expectedKey, presented.getBytes(StandardCharsets.UTF_8))) {
                log.warn("Rejected invalid operator key from {}", request.getRemoteAddr());
                response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
                response.setContentType(MediaType.APPLICATION_JSON_VALUE);
                objectMapper.writeValue(response.getWriter(),
                        ErrorResponse.of(INVALID_KEY, "AUTHORIZATION", "Invalid operator key", false));
                return;
            }
            UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                    "operator", null, List.of(new SimpleGrantedAuthority(ROLE_OPERATOR)));
            SecurityContextHolder.getContext().setAuthentication(authentication);
        }
        filterChain.doFilter(request, response);
    }

    public static boolean isOperator(Authentication authentication) {
        return authentication != null
                && authentication.isAuthenticated()
                && authentication.getAuthorities().stream()
                        .anyMatch(a -> ROLE_OPERATOR.equals(a.getAuthority()));
    }
}
