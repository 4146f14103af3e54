package com.vface.core.error;

/**
 * Caller could not prove ownership.
 */
public class AuthorizationException extends RegistryException {

    public AuthorizationException(String code, String message) {
        super(ErrorKind.AUTHORIZATION, code, message);
    }

    public AuthorizationException(String code, String message, Throwable cause) {
        super(ErrorKind.AUTHORIZATION, code, message, cause);
    }
}
