package io.kestra.plugin.adldap.models;

import com.unboundid.ldap.sdk.DN;
import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldap.sdk.RDN;
import io.kestra.plugin.adldap.client.RawEntry;

import java.util.Optional;

/**
 * Turns raw entries into typed {@link Entry} variants according to their {@code objectCategory}.
 */
public final class EntryMapper {
    private EntryMapper() {
    }

    public static Entry map(RawEntry raw) {
        return typeOf(raw).create(raw);
    }

    public static EntryType typeOf(RawEntry raw) {
        return raw.first(ActiveDirectory.OBJECT_CATEGORY)
            .map(EntryMapper::categoryName)
            .map(EntryType::fromCategory)
            .orElse(EntryType.GENERIC);
    }

    /**
     * Extracts the first RDN value of an object category, {@code CN=Person,CN=Schema,...} giving {@code Person}.
     * Categories that are not DNs are returned unchanged.
     */
    static String categoryName(String objectCategory) {
        return firstRdnValue(objectCategory).orElse(objectCategory);
    }

    private static Optional<String> firstRdnValue(String dn) {
        try {
            RDN rdn = new DN(dn).getRDN();
            if (rdn == null || rdn.getAttributeValues().length == 0) {
                return Optional.empty();
            }
            return Optional.of(rdn.getAttributeValues()[0]);
        } catch (LDAPException e) {
            return Optional.empty();
        }
    }
}
