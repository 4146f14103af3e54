package com.vface.api.chain;

import com.vface.api.key.KeyManagementService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only access to the hash chain for auditors and third-party verifiers.
 */
@RestController
@RequestMapping("/api/v1/chain")
public class ChainController {

    private final HashChainService chainService;
    private final KeyManagementService keyManagementService;

    public ChainController(HashChainService chainService, KeyManagementService keyManagementService) {
        this.chainService = chainService;
        this.keyManagementService = keyManagementService;
    }

    @GetMapping("/root")
    public ResponseEntity<HashChainService.ChainRoot> getRoot() {
        return ResponseEntity.ok(chainService.getRoot());
    }

    /**
     * Single entry with the public key needed to check its signature.
     * GET /api/v1/chain/entries/{index}
     */
    @GetMapping("/entries/{index}")
    public ResponseEntity<EntryResponse> getEntry(@PathVariable long index) {
        HashChainService.ChainEntryView entry = HashChainService.ChainEntryView.from(chainService.getEntry(index));
        return ResponseEntity.ok(new EntryResponse(entry, keyManagementService.getPublicKeyPem(),
                keyManagementService.getKeyId()));
    }

    /**
     * Verify entries {@code from..to}; omitting {@code to} verifies through the latest entry.
     * GET /api/v1/chain/verify?from=1&to=100
     */
    @GetMapping("/verify")
    public ResponseEntity<HashChainService.VerificationResult> verify(
            @RequestParam(defaultValue = "1") long from,
            @RequestParam(required = false) Long to) {
        return ResponseEntity.ok(chainService.verifyChain(from, to));
    }

    @GetMapping("/snapshot")
    public ResponseEntity<HashChainService.ChainSnapshot> snapshot() {
        return ResponseEntity.ok(chainService.exportSnapshot());
    }

    public record EntryResponse(HashChainService.ChainEntryView entry, String publicKey, String keyId) {}
}
