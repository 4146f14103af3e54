package com.vface.core.error;

/**
 * Referenced entity does not exist.
 */
public class NotFoundException extends RegistryException {

    public NotFoundException(String code, String message) {
        super(ErrorKind.NOT_FOUND, code, message);
    }

    public NotFoundException(String code, String message, Throwable cause) {
        super(ErrorKind.NOT_FOUND, code, message, cause);
    }
}
