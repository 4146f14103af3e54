package com.vface.sdk;

import java.util.Map;

/**
 * Non-success response from the registry API.
 */
public class VFaceClientException extends RuntimeException {

    private final int status;
    private final String code;
    private final boolean retryable;
    private final Map<String, Object> details;

    public VFaceClientException(int status, String code, String message, boolean retryable,
                                Map<String, Object> details) {
        super("HTTP " + status + (code != null ? " [" + code + "]" : "") + ": " + message);
        this.status = status;
        this.code = code;
        this.retryable = retryable;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }

    public int getStatus() { return status; }
    public String getCode() { return code; }
    public boolean isRetryable() { return retryable; }
    public Map<String, Object> getDetails() { return details; }
}
