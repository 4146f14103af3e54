package com.vface.core.error;

/**
 * Malformed or missing input.
 */
public class ValidationException extends RegistryException {

    public ValidationException(String code, String message) {
        super(ErrorKind.VALIDATION, code, message);
    }

    public ValidationException(String code, String message, Throwable cause) {
        super(ErrorKind.VALIDATION, code, message, cause);
    }
}
