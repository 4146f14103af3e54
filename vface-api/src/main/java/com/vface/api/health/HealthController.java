package com.vface.api.health;

import com.vface.api.chain.HashChainService;
import com.vface.api.crypto.EncryptionService;
import com.vface.api.key.KeyManagementService;
import com.vface.api.matching.VectorIndex;
import com.vface.core.repository.IdentityRecordRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health check endpoints.
 * - Basic health check for load balancers
 * - Info endpoint with registry and chain totals
 */
@RestController
@RequestMapping("/api/v1")
public class HealthController {

    private final HashChainService chainService;
    private final IdentityRecordRepository identityRepository;
    private final KeyManagementService keyManagementService;
    private final EncryptionService encryptionService;
    private final VectorIndex vectorIndex;
    private final Clock clock;

    public HealthController(HashChainService chainService, IdentityRecordRepository identityRepository,
                            KeyManagementService keyManagementService, EncryptionService encryptionService,
                            VectorIndex vectorIndex, Clock clock) {
        this.chainService = chainService;
        this.identityRepository = identityRepository;
        this.keyManagementService = keyManagementService;
        this.encryptionService = encryptionService;
        this.vectorIndex = vectorIndex;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
            "status", "UP",
            "timestamp", clock.instant().toString()
        ));
    }

    @GetMapping("/info")
    public ResponseEntity<Map<String, Object>> info() {
        HashChainService.ChainRoot root = chainService.getRoot();
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", "V-Face Identity Registry");
        info.put("version", "1.0.0-SNAPSHOT");
        info.put("identities", identityRepository.count());
        info.put("revoked", identityRepository.countByRevokedTrue());
        info.put("chainEntries", root.totalEntries());
        info.put("chainRoot", root.root());
        info.put("signingKeyId", keyManagementService.getKeyId());
        info.put("signingKeyPersistent", keyManagementService.getKeyStore().isPersistent());
        info.put("encryptionKeyVersion", encryptionService.getCurrentVersion());
        info.put("matcher", vectorIndex.getClass().getSimpleName());
        info.put("timestamp", clock.instant().toString());
        return ResponseEntity.ok(info);
    }
}
