package com.vface.api.integration;

import com.vface.api.VFaceApiApplication;
import com.vface.api.registry.RevocationMessage;
import com.vface.api.support.DatabaseCleaner;
import com.vface.api.support.TestVectors;
import com.vface.core.crypto.Hashing;
import com.vface.core.fingerprint.FingerprintDeriver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.*;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.security.KeyPair;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for the HTTP API: status codes, error bodies and operator access.
 */
@SpringBootTest(
    classes = VFaceApiApplication.class,
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class ApiIntegrationTest {

    private static final String OPERATOR_KEY = "test-operator-key";

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private FingerprintDeriver fingerprintDeriver;

    @Autowired
    private JdbcTemplate jdbc;

    private final Random random = new Random(3);
    private String baseUrl;
    private HttpHeaders headers;
    private KeyPair owner;

    @BeforeEach
    void setUp() {
        DatabaseCleaner.reset(jdbc);
        baseUrl = "http://localhost:" + port + "/api/v1";
        headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        owner = TestVectors.ownerKeyPair();
    }

    // Health check tests

    @Test
    void healthEndpoint_shouldReturnUp() {
        ResponseEntity<Map> response = restTemplate.getForEntity(baseUrl + "/health", Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().get("status")).isEqualTo("UP");
    }

    @Test
    void infoEndpoint_shouldReportRegistryState() {
        ResponseEntity<Map> response = restTemplate.getForEntity(baseUrl + "/info", Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).containsKeys("name", "chainEntries", "signingKeyId", "encryptionKeyVersion");
        assertThat(response.getBody().get("matcher")).isEqualTo("LinearScanVectorIndex");
    }

    // Registry tests

    @Test
    void register_shouldReturnCreatedWithChainAnchor() {
        double[] vector = TestVectors.randomUnitVector(random);

        ResponseEntity<Map> response = post("/identities", registerBody(fingerprintDeriver.derive(vector), vector));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(response.getBody().get("success")).isEqualTo(true);
        assertThat(response.getBody().get("chainIndex")).isEqualTo(1);
        assertThat((String) response.getBody().get("entryHash")).hasSize(64);
    }

    @Test
    void register_duplicateFingerprintShouldReturnConflict() {
        String fingerprint = Hashing.randomHex(32);
        post("/identities", registerBody(fingerprint, null));

        ResponseEntity<Map> response = post("/identities", registerBody(fingerprint, null));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().get("code")).isEqualTo("REGISTRY_001");
        assertThat(response.getBody().get("kind")).isEqualTo("CONFLICT");
    }

    @Test
    void register_sybilShouldReturnConflictWithMatch() {
        double[] vector = TestVectors.randomUnitVector(random);
        String original = fingerprintDeriver.derive(vector);
        post("/identities", registerBody(original, vector));
        double[] nearCopy = TestVectors.perturb(vector, random, 0.01);

        ResponseEntity<Map> response = post("/identities", registerBody(fingerprintDeriver.derive(nearCopy), nearCopy));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().get("code")).isEqualTo("REGISTRY_002");
        assertThat((Map<String, Object>) response.getBody().get("details")).containsEntry("matchFingerprint", original);
    }

    @Test
    void register_invalidFingerprintShouldReturnFieldErrors() {
        ResponseEntity<Map> response = post("/identities", registerBody("NOT-HEX", null));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().get("code")).isEqualTo("VALIDATION_001");
        assertThat((Map<String, Object>) response.getBody().get("details")).containsKey("fingerprint");
    }

    @Test
    void malformedJson_shouldReturnBadRequest() {
        ResponseEntity<Map> response = restTemplate.exchange(baseUrl + "/identities", HttpMethod.POST,
                new HttpEntity<>("{not json", headers), Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().get("code")).isEqualTo("VALIDATION_002");
    }

    @Test
    void check_shouldIncludeVectorOnlyForOperators() {
        double[] vector = TestVectors.randomUnitVector(random);
        String fingerprint = fingerprintDeriver.derive(vector);
        post("/identities", registerBody(fingerprint, vector));

        ResponseEntity<Map> anonymous = post("/identities/check", Map.of("fingerprint", fingerprint));
        headers.set("X-Operator-Key", OPERATOR_KEY);
        ResponseEntity<Map> operator = post("/identities/check", Map.of("fingerprint", fingerprint));

        assertThat(anonymous.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(anonymous.getBody().get("exists")).isEqualTo(true);
        assertThat(anonymous.getBody().get("vector")).isNull();
        assertThat((List<?>) operator.getBody().get("vector")).hasSize(TestVectors.DIMENSION);
    }

    @Test
    void check_unknownFingerprintShouldReportAbsent() {
        ResponseEntity<Map> response = post("/identities/check", Map.of("fingerprint", Hashing.randomHex(32)));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().get("exists")).isEqualTo(false);
    }

    @Test
    void wrongOperatorKey_shouldReturnUnauthorized() {
        headers.set("X-Operator-Key", "guess");

        ResponseEntity<Map> response = restTemplate.exchange(baseUrl + "/chain/root", HttpMethod.GET,
                new HttpEntity<>(headers), Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(response.getBody().get("code")).isEqualTo("AUTH_001");
    }

    @Test
    void revokeAndConsentFlow_shouldFailClosedAfterRevocation() {
        String fingerprint = Hashing.randomHex(32);
        post("/identities", Map.of("fingerprint", fingerprint, "ownerKey", TestVectors.ownerKeyPem(owner)));

        ResponseEntity<Map> requested = post("/consent/request", Map.of(
                "fingerprint", fingerprint, "companyId", "acme", "scope", List.of("kyc"), "durationSeconds", 600));
        assertThat(requested.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(requested.getBody().get("status")).isEqualTo("pending_user_approval");

        ResponseEntity<Map> approved = post("/consent/approve", Map.of(
                "requestId", requested.getBody().get("requestId"), "fingerprint", fingerprint));
        assertThat(approved.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(approved.getBody().get("success")).isEqualTo(true);
        String token = (String) approved.getBody().get("token");

        ResponseEntity<Map> verified = post("/consent/verify", Map.of("token", token, "audience", "acme"));
        assertThat(verified.getBody().get("valid")).isEqualTo(true);

        RevocationMessage message = RevocationMessage.revoke(fingerprint, Instant.now().getEpochSecond(), Hashing.randomHex(16));
        ResponseEntity<Map> revoked = post("/identities/revoke", Map.of(
                "fingerprint", fingerprint,
                "signature", TestVectors.sign(owner.getPrivate(), message),
                "message", message));
        assertThat(revoked.getStatusCode()).isEqualTo(HttpStatus.OK);

        ResponseEntity<Map> replayed = post("/identities/revoke", Map.of(
                "fingerprint", fingerprint,
                "signature", TestVectors.sign(owner.getPrivate(), message),
                "message", message));
        assertThat(replayed.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(replayed.getBody().get("kind")).isEqualTo("REPLAY");

        ResponseEntity<Map> afterRevocation = post("/consent/verify", Map.of("token", token));
        assertThat(afterRevocation.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(afterRevocation.getBody().get("valid")).isEqualTo(false);
        assertThat(afterRevocation.getBody().get("reason")).isEqualTo("identity_revoked");
    }

    // Chain tests

    @Test
    void chainEndpoints_shouldExposeVerifiableEntries() {
        double[] vector = TestVectors.randomUnitVector(random);
        post("/identities", registerBody(fingerprintDeriver.derive(vector), vector));

        ResponseEntity<Map> entry = restTemplate.getForEntity(baseUrl + "/chain/entries/1", Map.class);
        ResponseEntity<Map> verify = restTemplate.getForEntity(baseUrl + "/chain/verify?from=1", Map.class);
        ResponseEntity<Map> snapshot = restTemplate.getForEntity(baseUrl + "/chain/snapshot", Map.class);
        ResponseEntity<Map> missing = restTemplate.getForEntity(baseUrl + "/chain/entries/99", Map.class);

        assertThat(entry.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat((String) entry.getBody().get("publicKey")).startsWith("-----BEGIN PUBLIC KEY-----");
        assertThat(verify.getBody().get("valid")).isEqualTo(true);
        assertThat(verify.getBody().get("checked")).isEqualTo(1);
        assertThat((List<?>) snapshot.getBody().get("entries")).hasSize(1);
        assertThat(missing.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(missing.getBody().get("code")).isEqualTo("CHAIN_004");
    }

    @Test
    void searchAndFingerprintHelpers_shouldWork() {
        double[] vector = TestVectors.randomUnitVector(random);
        String fingerprint = fingerprintDeriver.derive(vector);
        post("/identities", registerBody(fingerprint, vector));

        ResponseEntity<Map> derived = post("/identities/fingerprint", Map.of("vector", vector));
        ResponseEntity<Map> search = post("/identities/search", Map.of("vector", vector, "topK", 3));
        ResponseEntity<Map> badSearch = post("/identities/search", Map.of("vector", vector, "threshold", 2.0));

        assertThat(derived.getBody().get("fingerprint")).isEqualTo(fingerprint);
        List<Map<String, Object>> matches = (List<Map<String, Object>>) search.getBody().get("matches");
        assertThat(matches).hasSize(1);
        assertThat(matches.get(0).get("fingerprint")).isEqualTo(fingerprint);
        assertThat(badSearch.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(badSearch.getBody().get("code")).isEqualTo("MATCH_001");
    }

    // Admin tests

    @Test
    void adminRotation_shouldRequireOperatorKey() {
        ResponseEntity<Map> anonymous = post("/admin/keys/rotate?dryRun=true", Map.of());
        headers.set("X-Operator-Key", OPERATOR_KEY);
        ResponseEntity<Map> operator = post("/admin/keys/rotate?dryRun=true", Map.of());

        assertThat(anonymous.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(anonymous.getBody().get("code")).isEqualTo("AUTH_002");
        assertThat(operator.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(operator.getBody().get("dryRun")).isEqualTo(true);
        assertThat(operator.getBody().get("targetVersion")).isEqualTo(1);
    }

    private ResponseEntity<Map> post(String path, Object body) {
        return restTemplate.exchange(baseUrl + path, HttpMethod.POST, new HttpEntity<>(body, headers), Map.class);
    }

    private Map<String, Object> registerBody(String fingerprint, double[] vector) {
        Map<String, Object> body = new HashMap<>();
        body.put("fingerprint", fingerprint);
        body.put("ownerKey", TestVectors.ownerKeyPem(owner));
        if (vector != null) {
            body.put("vector", vector);
        }
        return body;
    }
}
