package io.kestra.plugin.adldap.query;

import java.util.Locale;

public enum SortDirection {
    ASC,
    DESC;

    public static SortDirection of(String direction) {
        if (direction == null || direction.isBlank()) {
            return DESC;
        }

        switch (direction.trim().toLowerCase(Locale.ROOT)) {
            case "asc":
                return ASC;
            case "desc":
                return DESC;
            default:
                throw new IllegalArgumentException(String.format("Invalid sort direction \"%s\", expected asc or desc.", direction));
        }
    }
}
