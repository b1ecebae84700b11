package io.kestra.plugin.adldap.models;

import io.kestra.plugin.adldap.client.RawEntry;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A directory entry whose object category has no dedicated type.
 * <p>
 * Every variant keeps the complete set of attributes the server returned, reachable through
 * {@link #getAttributes()} and {@link #getAttribute(String)} whatever typed accessors it also offers.
 */
@ToString
@EqualsAndHashCode
public class Entry {
    private final RawEntry raw;

    public Entry(RawEntry raw) {
        this.raw = raw;
    }

    public EntryType getType() {
        return EntryType.GENERIC;
    }

    public RawEntry getRaw() {
        return raw;
    }

    public String getDn() {
        return raw.getDn() != null ? raw.getDn() : getFirstAttribute(ActiveDirectory.DISTINGUISHED_NAME).orElse(null);
    }

    public Map<String, List<String>> getAttributes() {
        return raw.getAttributes();
    }

    public List<String> getAttribute(String name) {
        return raw.get(name);
    }

    public Optional<String> getFirstAttribute(String name) {
        return raw.first(name);
    }

    public boolean hasAttribute(String name) {
        return raw.has(name);
    }

    public Optional<String> getCommonName() {
        return getFirstAttribute(ActiveDirectory.COMMON_NAME);
    }

    public Optional<String> getName() {
        return getFirstAttribute(ActiveDirectory.NAME).or(this::getCommonName);
    }

    public Optional<String> getDescription() {
        return getFirstAttribute(ActiveDirectory.DESCRIPTION);
    }

    public List<String> getObjectClass() {
        return getAttribute(ActiveDirectory.OBJECT_CLASS);
    }

    public Optional<String> getObjectCategory() {
        return getFirstAttribute(ActiveDirectory.OBJECT_CATEGORY);
    }

    public List<String> getMemberOf() {
        return getAttribute(ActiveDirectory.MEMBER_OF);
    }

    protected Optional<Integer> getIntAttribute(String name) {
        return getFirstAttribute(name).map(value -> {
            try {
                return Integer.valueOf(value.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        });
    }
}
