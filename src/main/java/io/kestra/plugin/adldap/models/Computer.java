package io.kestra.plugin.adldap.models;

import io.kestra.plugin.adldap.client.RawEntry;

import java.util.Optional;

public class Computer extends Entry {
    public Computer(RawEntry raw) {
        super(raw);
    }

    @Override
    public EntryType getType() {
        return EntryType.COMPUTER;
    }

    public Optional<String> getOperatingSystem() {
        return getFirstAttribute(ActiveDirectory.OPERATING_SYSTEM);
    }

    public Optional<String> getOperatingSystemVersion() {
        return getFirstAttribute(ActiveDirectory.OPERATING_SYSTEM_VERSION);
    }

    public Optional<String> getDnsHostName() {
        return getFirstAttribute(ActiveDirectory.DNS_HOST_NAME);
    }
}
