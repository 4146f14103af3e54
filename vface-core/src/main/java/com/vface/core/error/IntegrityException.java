package com.vface.core.error;

/**
 * Stored data failed an integrity check.
 */
public class IntegrityException extends RegistryException {

    public IntegrityException(String code, String message) {
        super(ErrorKind.INTEGRITY, code, message);
    }

    public IntegrityException(String code, String message, Throwable cause) {
        super(ErrorKind.INTEGRITY, code, message, cause);
    }
}
