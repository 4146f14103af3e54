package com.vface.api.rotation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator-only maintenance endpoints. Access is restricted to ROLE_OPERATOR in SecurityConfig.
 */
@RestController
@RequestMapping("/api/v1/admin")
public class AdminController {

    private final KeyRotationService rotationService;

    public AdminController(KeyRotationService rotationService) {
        this.rotationService = rotationService;
    }

    /**
     * Re-encrypt all stored vectors under the current key version.
     * POST /api/v1/admin/keys/rotate?dryRun=true
     */
    @PostMapping("/keys/rotate")
    public ResponseEntity<KeyRotationService.RotationReport> rotateKeys(
            @RequestParam(defaultValue = "false") boolean dryRun) {
        return ResponseEntity.ok(rotationService.rotate(dryRun));
    }
}
