package com.vface.core.error;

/**
 * Stale or reused proof message.
 */
public class ReplayException extends RegistryException {

    public ReplayException(String code, String message) {
        super(ErrorKind.REPLAY, code, message);
    }

    public ReplayException(String code, String message, Throwable cause) {
        super(ErrorKind.REPLAY, code, message, cause);
    }
}
