package io.kestra.plugin.adldap.exceptions;

public class EntryNotFoundException extends AdldapException {
    public EntryNotFoundException(String message) {
        super(message);
    }
}
