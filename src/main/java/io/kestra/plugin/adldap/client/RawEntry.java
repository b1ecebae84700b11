package io.kestra.plugin.adldap.client;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * One entry as the directory returned it: its DN kept apart, then every attribute under a lower-cased name
 * with its values in server order.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RawEntry {
    private final String dn;
    private final Map<String, List<String>> attributes;

    public RawEntry(String dn, Map<String, List<String>> attributes) {
        this.dn = dn;

        Map<String, List<String>> normalized = new LinkedHashMap<>();
        if (attributes != null) {
            attributes.forEach((name, values) -> normalized.merge(
                name.toLowerCase(Locale.ROOT),
                values == null ? List.of() : List.copyOf(values),
                (left, right) -> {
                    List<String> merged = new ArrayList<>(left);
                    merged.addAll(right);
                    return List.copyOf(merged);
                }
            ));
        }
        this.attributes = Collections.unmodifiableMap(normalized);
    }

    /**
     * @return every value of the attribute, empty when the entry does not carry it.
     */
    public List<String> get(String name) {
        return attributes.getOrDefault(name.toLowerCase(Locale.ROOT), List.of());
    }

    public Optional<String> first(String name) {
        List<String> values = get(name);
        return values.isEmpty() ? Optional.empty() : Optional.ofNullable(values.get(0));
    }

    public boolean has(String name) {
        return !get(name).isEmpty();
    }
}
