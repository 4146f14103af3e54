package com.vface.core.error;

/**
 * Classification of registry failures.
 *
 * Client-caused kinds are terminal: retrying the same request yields the same result.
 * Only {@link #INFRASTRUCTURE} failures may succeed on retry.
 */
public enum ErrorKind {
    VALIDATION(false),
    CONFLICT(false),
    NOT_FOUND(false),
    AUTHORIZATION(false),
    REPLAY(false),
    INTEGRITY(false),
    INFRASTRUCTURE(true);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
