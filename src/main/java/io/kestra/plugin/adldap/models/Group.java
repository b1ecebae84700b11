package io.kestra.plugin.adldap.models;

import io.kestra.plugin.adldap.client.RawEntry;

import java.util.List;
import java.util.Optional;

public class Group extends Entry {
    public Group(RawEntry raw) {
        super(raw);
    }

    @Override
    public EntryType getType() {
        return EntryType.GROUP;
    }

    public Optional<String> getAccountName() {
        return getFirstAttribute(ActiveDirectory.ACCOUNT_NAME);
    }

    /**
     * @return the DNs of the direct members, users, contacts and groups alike.
     */
    public List<String> getMembers() {
        return getAttribute(ActiveDirectory.MEMBER);
    }

    public Optional<String> getAccountType() {
        return getFirstAttribute(ActiveDirectory.ACCOUNT_TYPE);
    }

    public boolean isSecurityGroup() {
        return getAccountType().map(ActiveDirectory.SECURITY_GROUP::equals).orElse(false);
    }

    public boolean isDistributionGroup() {
        return getAccountType().map(ActiveDirectory.DISTRIBUTION_GROUP::equals).orElse(false);
    }
}
