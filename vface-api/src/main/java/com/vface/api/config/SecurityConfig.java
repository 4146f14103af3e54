package com.vface.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vface.api.error.ErrorResponse;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;

import java.io.IOException;

/**
 * Security configuration for the registry API.
 *
 * Registry, consent and chain endpoints are public; ownership is proven per request by signatures.
 * Admin endpoints require the operator role granted by {@link OperatorApiKeyFilter}. Denials are
 * answered with the standard JSON error body.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private static final String OPERATOR_REQUIRED = "AUTH_002";

    @Bean
    public SecurityFilterChain securityFilterChain(
            HttpSecurity http,
            ObjectMapper objectMapper,
            @Value("${vface.security.operator-api-key:}") String operatorApiKey) throws Exception {
        http
            .csrf(AbstractHttpConfigurer::disable)
            .httpBasic(AbstractHttpConfigurer::disable)
            .formLogin(AbstractHttpConfigurer::disable)
            .sessionManagement(session -> session
                .sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .addFilterBefore(new OperatorApiKeyFilter(operatorApiKey, objectMapper), AnonymousAuthenticationFilter.class)
            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/api/v1/admin/**").hasRole("OPERATOR")
                .anyRequest().permitAll()
            )
            .exceptionHandling(handling -> handling
                .authenticationEntryPoint((request, response, e) -> writeForbidden(response, objectMapper))
                .accessDeniedHandler((request, response, e) -> writeForbidden(response, objectMapper))
            );

        return http.build();
    }

    private static void writeForbidden(HttpServletResponse response, ObjectMapper objectMapper) throws IOException {
        response.setStatus(HttpServletResponse.SC_FORBIDDEN);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getWriter(), ErrorResponse.of(OPERATOR_REQUIRED, "AUTHORIZATION",
                "Operator credentials required", false));
    }
}
