package com.vface.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * V-Face Identity Registry API Application
 *
 * Biometric identity registry with a signed hash chain and consent tokens.
 * Java 17 + Spring Boot 3.4.x
 */
@SpringBootApplication(scanBasePackages = "com.vface")
@EntityScan(basePackages = "com.vface.core.domain")
@EnableJpaRepositories(basePackages = "com.vface.core.repository")
@EnableScheduling
public class VFaceApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(VFaceApiApplication.class, args);
    }
}
