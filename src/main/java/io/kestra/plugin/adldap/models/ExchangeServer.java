package io.kestra.plugin.adldap.models;

import io.kestra.plugin.adldap.client.RawEntry;

import java.util.Optional;

public class ExchangeServer extends Entry {
    public ExchangeServer(RawEntry raw) {
        super(raw);
    }

    @Override
    public EntryType getType() {
        return EntryType.EXCHANGE_SERVER;
    }

    public Optional<String> getSerialNumber() {
        return getFirstAttribute(ActiveDirectory.SERIAL_NUMBER);
    }
}
