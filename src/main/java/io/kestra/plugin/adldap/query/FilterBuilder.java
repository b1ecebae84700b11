package io.kestra.plugin.adldap.query;

import io.kestra.plugin.adldap.models.ActiveDirectory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Accumulates selected attributes and predicates, then renders them into one LDAP filter string.
 * <p>
 * Predicates are combined strictly left to right. Consecutive predicates sharing the same boolean are batched into
 * a single {@code (&...)} or {@code (|...)} group; whenever the boolean changes, the group built so far becomes the
 * first member of a new group. The boolean of the first predicate is never used.
 * <pre>
 * a AND b AND c      -> (&amp;(a)(b)(c))
 * a AND b OR c       -> (|(&amp;(a)(b))(c))
 * a OR b AND c AND d -> (&amp;(|(a)(b))(c)(d))
 * </pre>
 */
public class FilterBuilder {
    private final Map<String, String> selects = new LinkedHashMap<>();
    private final List<Predicate> predicates = new ArrayList<>();

    public FilterBuilder select(List<String> attributes) {
        attributes.forEach(this::select);
        return this;
    }

    public FilterBuilder select(String attribute) {
        if (attribute != null && !attribute.isBlank()) {
            selects.putIfAbsent(attribute.trim().toLowerCase(Locale.ROOT), attribute.trim());
        }
        return this;
    }

    public FilterBuilder addPredicate(String field, Operator operator, String value, BooleanOperator bool) {
        predicates.add(Predicate.builder()
            .field(field)
            .operator(operator)
            .value(value)
            .bool(bool)
            .build()
        );
        return this;
    }

    /**
     * Adds the catch-all {@code (objectclass=*)} predicate.
     */
    public FilterBuilder addWildcard() {
        return this.addWildcard(ActiveDirectory.OBJECT_CLASS);
    }

    public FilterBuilder addWildcard(String field) {
        return this.addPredicate(field, Operator.WILDCARD, null, BooleanOperator.AND);
    }

    public FilterBuilder addRawFilter(String clause, BooleanOperator bool) {
        return this.addPredicate(null, Operator.RAW, clause, bool);
    }

    public List<String> getSelects() {
        return List.copyOf(selects.values());
    }

    public List<Predicate> getPredicates() {
        return Collections.unmodifiableList(predicates);
    }

    public boolean hasPredicates() {
        return !predicates.isEmpty();
    }

    public String render() {
        return render(predicates);
    }

    /**
     * @return the filter for the given predicates, an empty string when there is none.
     */
    public static String render(List<Predicate> predicates) {
        if (predicates.isEmpty()) {
            return "";
        }
        if (predicates.size() == 1) {
            return predicates.get(0).toFilter();
        }

        BooleanOperator connector = predicates.get(1).getBool();
        List<String> members = new ArrayList<>();
        members.add(predicates.get(0).toFilter());

        for (Predicate predicate : predicates.subList(1, predicates.size())) {
            if (predicate.getBool() != connector) {
                String group = group(connector, members);
                members.clear();
                members.add(group);
                connector = predicate.getBool();
            }
            members.add(predicate.toFilter());
        }

        return group(connector, members);
    }

    private static String group(BooleanOperator connector, List<String> members) {
        return "(" + connector.getSymbol() + String.join("", members) + ")";
    }
}
