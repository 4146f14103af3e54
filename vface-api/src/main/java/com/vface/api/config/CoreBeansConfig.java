package com.vface.api.config;

import com.vface.core.fingerprint.FingerprintDeriver;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Beans for framework-free core components.
 */
@Configuration
public class CoreBeansConfig {

    @Bean
    public FingerprintDeriver fingerprintDeriver(
            @Value("${vface.fingerprint.dimension:128}") int dimension,
            @Value("${vface.fingerprint.precision:4}") int precision) {
        return new FingerprintDeriver(dimension, precision);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
