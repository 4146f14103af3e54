package com.vface.core.error;

import java.util.Map;

/**
 * Base type for every failure raised by the registry services.
 * Carries an {@link ErrorKind} and a stable error code for API consumers.
 */
public class RegistryException extends RuntimeException {

    private final ErrorKind kind;
    private final String code;

    public RegistryException(ErrorKind kind, String code, String message) {
        super(message);
        this.kind = kind;
        this.code = code;
    }

    public RegistryException(ErrorKind kind, String code, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = code;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    /**
     * Additional machine-readable details exposed to callers.
     */
    public Map<String, Object> getDetails() {
        return Map.of();
    }
}
