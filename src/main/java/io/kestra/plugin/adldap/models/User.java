package io.kestra.plugin.adldap.models;

import io.kestra.plugin.adldap.client.RawEntry;

import java.util.Optional;

public class User extends Entry {
    public User(RawEntry raw) {
        super(raw);
    }

    @Override
    public EntryType getType() {
        return EntryType.USER;
    }

    public Optional<String> getAccountName() {
        return getFirstAttribute(ActiveDirectory.ACCOUNT_NAME);
    }

    public Optional<String> getUserPrincipalName() {
        return getFirstAttribute(ActiveDirectory.USER_PRINCIPAL_NAME);
    }

    public Optional<String> getDisplayName() {
        return getFirstAttribute(ActiveDirectory.DISPLAY_NAME);
    }

    public Optional<String> getFirstName() {
        return getFirstAttribute(ActiveDirectory.FIRST_NAME);
    }

    public Optional<String> getLastName() {
        return getFirstAttribute(ActiveDirectory.LAST_NAME);
    }

    public Optional<String> getEmail() {
        return getFirstAttribute(ActiveDirectory.EMAIL);
    }

    public Optional<String> getTitle() {
        return getFirstAttribute(ActiveDirectory.TITLE);
    }

    public Optional<String> getDepartment() {
        return getFirstAttribute(ActiveDirectory.DEPARTMENT);
    }

    public Optional<String> getTelephoneNumber() {
        return getFirstAttribute(ActiveDirectory.TELEPHONE);
    }

    public Optional<String> getObjectSid() {
        return getFirstAttribute(ActiveDirectory.OBJECT_SID);
    }

    public Optional<Integer> getPrimaryGroupId() {
        return getIntAttribute(ActiveDirectory.PRIMARY_GROUP_ID);
    }

    public boolean isDisabled() {
        return getIntAttribute(ActiveDirectory.USER_ACCOUNT_CONTROL)
            .map(control -> (control & ActiveDirectory.ACCOUNT_DISABLED) != 0)
            .orElse(false);
    }
}
