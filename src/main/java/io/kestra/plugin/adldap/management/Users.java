package io.kestra.plugin.adldap.management;

import io.kestra.plugin.adldap.client.Adldap;
import io.kestra.plugin.adldap.models.ActiveDirectory;
import io.kestra.plugin.adldap.models.Entry;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * User lookups by account name. A name carrying the configured account suffix is accepted too.
 */
public class Users {
    private final Adldap adldap;

    public Users(Adldap adldap) {
        this.adldap = adldap;
    }

    public Optional<Entry> find(String username) {
        return this.find(username, List.of());
    }

    public Optional<Entry> find(String username, List<String> fields) {
        if (username == null || username.isBlank()) {
            return Optional.empty();
        }

        return adldap.search()
            .select(fields)
            .where(ActiveDirectory.OBJECT_CATEGORY, ActiveDirectory.OBJECT_CATEGORY_PERSON)
            .where(ActiveDirectory.ACCOUNT_NAME, this.accountName(username))
            .first();
    }

    public Optional<Entry> info(String username, List<String> fields) {
        return this.find(username, fields);
    }

    public Optional<String> dn(String username) {
        return this.find(username).map(Entry::getDn);
    }

    /**
     * @return the DNs of the groups the user is a direct member of, empty when the user does not exist.
     */
    public Optional<List<String>> groups(String username) {
        return this.find(username, List.of(ActiveDirectory.MEMBER_OF)).map(Entry::getMemberOf);
    }

    String accountName(String username) {
        String suffix = adldap.getConfiguration().getAccountSuffix();
        String trimmed = username.trim();

        if (suffix != null && !suffix.isBlank() && trimmed.toLowerCase(Locale.ROOT).endsWith(suffix.toLowerCase(Locale.ROOT))) {
            return trimmed.substring(0, trimmed.length() - suffix.length());
        }
        return trimmed;
    }
}
