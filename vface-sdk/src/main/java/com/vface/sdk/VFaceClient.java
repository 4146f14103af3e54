package com.vface.sdk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vface.sdk.SDKModels.*;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.*;

/**
 * V-Face Registry SDK Client - HTTP client for the {@code /api/v1} registry API.
 *
 * Covers identity registration, owner revocation, the consent lifecycle and the public
 * hash chain. Operator-only calls (full check results, rotation) need an operator key.
 *
 * Non-2xx responses are raised as {@link VFaceClientException} carrying the server error code,
 * except for consent verification where a 503 body is a regular {@link TokenVerification}.
 */
public class VFaceClient implements AutoCloseable {

    private static final String OPERATOR_HEADER = "X-Operator-Key";

    private final String baseUrl;
    private final String operatorKey;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private VFaceClient(Builder builder) {
        this.baseUrl = stripTrailingSlash(builder.baseUrl);
        this.operatorKey = builder.operatorKey;
        this.requestTimeout = Duration.ofSeconds(builder.requestTimeoutSeconds);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(builder.connectTimeoutSeconds))
                .build();
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ==================== Registry ====================

    /**
     * Registers a fingerprint. With a vector the server runs the duplicate-face check,
     * encrypts the vector and anchors a commitment on the hash chain.
     */
    public RegistrationResult register(String fingerprint, String ownerKey, double[] vector,
                                       Map<String, Object> metadata) throws IOException, InterruptedException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("fingerprint", fingerprint);
        body.put("ownerKey", ownerKey);
        if (vector != null) {
            body.put("vector", vector);
        }
        if (metadata != null) {
            body.put("metadata", metadata);
        }
        return post("/api/v1/identities", body, new TypeReference<RegistrationResult>() {});
    }

    public IdentityStatus check(String fingerprint) throws IOException, InterruptedException {
        return post("/api/v1/identities/check", Map.of("fingerprint", fingerprint),
                new TypeReference<IdentityStatus>() {});
    }

    /**
     * Submits an owner-signed revocation, typically built with {@link RevocationProofSigner}.
     */
    public RevocationResult revoke(SignedRevocation revocation) throws IOException, InterruptedException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("fingerprint", revocation.message().fingerprint());
        body.put("signature", revocation.signature());
        body.put("message", revocation.message());
        return post("/api/v1/identities/revoke", body, new TypeReference<RevocationResult>() {});
    }

    public OwnerFingerprints listByOwner(String ownerKey) throws IOException, InterruptedException {
        return post("/api/v1/identities/owner", Map.of("ownerKey", ownerKey),
                new TypeReference<OwnerFingerprints>() {});
    }

    /**
     * Finds enrolled identities similar to a vector. Null threshold and topK use server defaults.
     */
    public SearchResult search(double[] vector, Double threshold, Integer topK)
            throws IOException, InterruptedException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("vector", vector);
        if (threshold != null) {
            body.put("threshold", threshold);
        }
        if (topK != null) {
            body.put("topK", topK);
        }
        return post("/api/v1/identities/search", body, new TypeReference<SearchResult>() {});
    }

    public String deriveFingerprint(double[] vector) throws IOException, InterruptedException {
        return post("/api/v1/identities/fingerprint", Map.of("vector", vector),
                new TypeReference<FingerprintResult>() {}).fingerprint();
    }

    // ==================== Consent ====================

    public ConsentRequestResult requestConsent(String fingerprint, String companyId, List<String> scope,
                                               long durationSeconds) throws IOException, InterruptedException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("fingerprint", fingerprint);
        body.put("companyId", companyId);
        body.put("scope", scope);
        body.put("durationSeconds", durationSeconds);
        return post("/api/v1/consent/request", body, new TypeReference<ConsentRequestResult>() {});
    }

    public ConsentApproval approveConsent(UUID requestId, String fingerprint)
            throws IOException, InterruptedException {
        return post("/api/v1/consent/approve", Map.of("requestId", requestId, "fingerprint", fingerprint),
                new TypeReference<ConsentApproval>() {});
    }

    /**
     * Verifies a consent token. A {@code registry_unavailable} result means the server could not
     * confirm the identity and the caller may retry.
     */
    public TokenVerification verifyToken(String token, String audience) throws IOException, InterruptedException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("token", token);
        body.put("audience", audience);
        HttpResponse<String> response = send(jsonPost("/api/v1/consent/verify", body));
        if (response.statusCode() == 503) {
            return objectMapper.readValue(response.body(), TokenVerification.class);
        }
        return readBody(response, new TypeReference<TokenVerification>() {});
    }

    public List<ActiveConsent> activeConsents(String fingerprint) throws IOException, InterruptedException {
        return get("/api/v1/consent/active/" + encode(fingerprint), new TypeReference<List<ActiveConsent>>() {});
    }

    public List<PendingConsent> pendingConsents(String fingerprint) throws IOException, InterruptedException {
        return get("/api/v1/consent/pending/" + encode(fingerprint), new TypeReference<List<PendingConsent>>() {});
    }

    // ==================== Hash Chain ====================

    public ChainRoot chainRoot() throws IOException, InterruptedException {
        return get("/api/v1/chain/root", new TypeReference<ChainRoot>() {});
    }

    public ChainEntryWithKey chainEntry(long index) throws IOException, InterruptedException {
        return get("/api/v1/chain/entries/" + index, new TypeReference<ChainEntryWithKey>() {});
    }

    /**
     * Server-side verification of entries {@code from..to}; a null {@code to} runs to the latest entry.
     */
    public ChainVerification verifyChain(long from, Long to) throws IOException, InterruptedException {
        String path = "/api/v1/chain/verify?from=" + from + (to != null ? "&to=" + to : "");
        return get(path, new TypeReference<ChainVerification>() {});
    }

    public ChainSnapshot snapshot() throws IOException, InterruptedException {
        return get("/api/v1/chain/snapshot", new TypeReference<ChainSnapshot>() {});
    }

    // ==================== Admin & Health ====================

    public RotationReport rotateKeys(boolean dryRun) throws IOException, InterruptedException {
        return post("/api/v1/admin/keys/rotate?dryRun=" + dryRun, Map.of(), new TypeReference<RotationReport>() {});
    }

    public Map<String, Object> health() throws IOException, InterruptedException {
        return get("/api/v1/health", new TypeReference<Map<String, Object>>() {});
    }

    public Map<String, Object> info() throws IOException, InterruptedException {
        return get("/api/v1/info", new TypeReference<Map<String, Object>>() {});
    }

    // ==================== HTTP Methods ====================

    private <T> T get(String path, TypeReference<T> typeRef) throws IOException, InterruptedException {
        HttpRequest request = requestBuilder(path).GET().build();
        return readBody(send(request), typeRef);
    }

    private <T> T post(String path, Object body, TypeReference<T> typeRef)
            throws IOException, InterruptedException {
        return readBody(send(jsonPost(path, body)), typeRef);
    }

    private HttpRequest jsonPost(String path, Object body) throws JsonProcessingException {
        String jsonBody = objectMapper.writeValueAsString(body);
        return requestBuilder(path)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                .build();
    }

    private HttpRequest.Builder requestBuilder(String path) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header("Accept", "application/json");
        if (operatorKey != null) {
            builder.header(OPERATOR_HEADER, operatorKey);
        }
        return builder;
    }

    private HttpResponse<String> send(HttpRequest request) throws IOException, InterruptedException {
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private <T> T readBody(HttpResponse<String> response, TypeReference<T> typeRef) throws IOException {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw toException(status, response.body());
        }
        return objectMapper.readValue(response.body(), typeRef);
    }

    private VFaceClientException toException(int status, String body) {
        if (body != null && !body.isBlank()) {
            try {
                ErrorBody error = objectMapper.readValue(body, ErrorBody.class);
                if (error.code() != null) {
                    return new VFaceClientException(status, error.code(), error.message(), error.retryable(),
                            error.details());
                }
            } catch (JsonProcessingException e) {
                return new VFaceClientException(status, null, body, status >= 500, null);
            }
        }
        return new VFaceClientException(status, null, "empty or unrecognised error body", status >= 500, null);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Override
    public void close() {
        // HttpClient on JDK 17 holds no resources that need closing
    }

    // ==================== Builder ====================

    public static class Builder {
        private String baseUrl = "http://localhost:8080";
        private String operatorKey;
        private int connectTimeoutSeconds = 10;
        private int requestTimeoutSeconds = 30;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder operatorKey(String operatorKey) {
            this.operatorKey = operatorKey;
            return this;
        }

        public Builder connectTimeout(int seconds) {
            this.connectTimeoutSeconds = seconds;
            return this;
        }

        public Builder requestTimeout(int seconds) {
            this.requestTimeoutSeconds = seconds;
            return this;
        }

        public VFaceClient build() {
            Objects.requireNonNull(baseUrl, "Base URL is required");
            return new VFaceClient(this);
        }
    }
}
