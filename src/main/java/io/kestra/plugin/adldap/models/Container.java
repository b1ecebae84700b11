package io.kestra.plugin.adldap.models;

import io.kestra.plugin.adldap.client.RawEntry;

public class Container extends Entry {
    public Container(RawEntry raw) {
        super(raw);
    }

    @Override
    public EntryType getType() {
        return EntryType.CONTAINER;
    }
}
