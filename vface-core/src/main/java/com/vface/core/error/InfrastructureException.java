package com.vface.core.error;

/**
 * Storage or dependency unreachable.
 */
public class InfrastructureException extends RegistryException {

    public InfrastructureException(String code, String message) {
        super(ErrorKind.INFRASTRUCTURE, code, message);
    }

    public InfrastructureException(String code, String message, Throwable cause) {
        super(ErrorKind.INFRASTRUCTURE, code, message, cause);
    }
}
