package io.kestra.plugin.adldap.exceptions;

/**
 * Base of the checked failures raised by the directory layer.
 */
public class AdldapException extends Exception {
    public AdldapException(String message) {
        super(message);
    }

    public AdldapException(String message, Throwable cause) {
        super(message, cause);
    }
}
