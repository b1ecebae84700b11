package io.kestra.plugin.adldap.models;

import io.kestra.plugin.adldap.client.RawEntry;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The closed set of entry variants, each tied to the object category that selects it.
 */
public enum EntryType {
    GENERIC(null, Entry::new),
    COMPUTER(ActiveDirectory.OBJECT_CATEGORY_COMPUTER, Computer::new),
    USER(ActiveDirectory.OBJECT_CATEGORY_PERSON, User::new),
    GROUP(ActiveDirectory.OBJECT_CATEGORY_GROUP, Group::new),
    CONTAINER(ActiveDirectory.OBJECT_CATEGORY_CONTAINER, Container::new),
    PRINTER(ActiveDirectory.OBJECT_CATEGORY_PRINTER, Printer::new),
    EXCHANGE_SERVER(ActiveDirectory.OBJECT_CATEGORY_EXCHANGE_SERVER, ExchangeServer::new);

    private static final Map<String, EntryType> BY_CATEGORY = Arrays.stream(values())
        .filter(type -> type.category != null)
        .collect(Collectors.toUnmodifiableMap(type -> type.category, Function.identity()));

    private final String category;
    private final Function<RawEntry, Entry> factory;

    EntryType(String category, Function<RawEntry, Entry> factory) {
        this.category = category;
        this.factory = factory;
    }

    public String getCategory() {
        return category;
    }

    Entry create(RawEntry raw) {
        return factory.apply(raw);
    }

    /**
     * @return the variant for a category name, {@link #GENERIC} when it is unknown or missing.
     */
    public static EntryType fromCategory(String category) {
        if (category == null) {
            return GENERIC;
        }
        return BY_CATEGORY.getOrDefault(category.trim().toLowerCase(Locale.ROOT), GENERIC);
    }
}
