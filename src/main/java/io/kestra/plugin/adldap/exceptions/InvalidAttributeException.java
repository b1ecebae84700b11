package io.kestra.plugin.adldap.exceptions;

/**
 * Raised before any write reaches the directory when a mandatory attribute is missing or malformed.
 */
public class InvalidAttributeException extends AdldapException {
    public InvalidAttributeException(String message) {
        super(message);
    }
}
