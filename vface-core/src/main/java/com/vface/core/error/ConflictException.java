package com.vface.core.error;

/**
 * Operation conflicts with existing state.
 */
public class ConflictException extends RegistryException {

    public ConflictException(String code, String message) {
        super(ErrorKind.CONFLICT, code, message);
    }

    public ConflictException(String code, String message, Throwable cause) {
        super(ErrorKind.CONFLICT, code, message, cause);
    }
}
