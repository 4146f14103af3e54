package com.vface.api.rotation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Runs a key rotation once at startup when {@code vface.rotation.run-on-startup=true}.
 * A failed rotation stops startup.
 */
@Component
@ConditionalOnProperty(prefix = "vface.rotation", name = "run-on-startup", havingValue = "true")
public class KeyRotationRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(KeyRotationRunner.class);

    private final KeyRotationService rotationService;
    private final boolean dryRun;

    public KeyRotationRunner(KeyRotationService rotationService,
                             @Value("${vface.rotation.dry-run:false}") boolean dryRun) {
        this.rotationService = rotationService;
        this.dryRun = dryRun;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("Startup key rotation requested (dryRun={})", dryRun);
        KeyRotationService.RotationReport report = rotationService.rotate(dryRun);
        log.info("Startup key rotation finished: {}", report);
    }
}
