package io.kestra.plugin.adldap.models;

import io.kestra.plugin.adldap.client.RawEntry;

import java.util.Optional;

public class Printer extends Entry {
    public Printer(RawEntry raw) {
        super(raw);
    }

    @Override
    public EntryType getType() {
        return EntryType.PRINTER;
    }

    public Optional<String> getPrinterName() {
        return getFirstAttribute(ActiveDirectory.PRINTER_NAME);
    }

    public Optional<String> getLocation() {
        return getFirstAttribute(ActiveDirectory.PRINTER_LOCATION);
    }

    public Optional<String> getServerName() {
        return getFirstAttribute(ActiveDirectory.PRINTER_SERVER_NAME);
    }

    public Optional<String> getDriverName() {
        return getFirstAttribute(ActiveDirectory.PRINTER_DRIVER_NAME);
    }
}
