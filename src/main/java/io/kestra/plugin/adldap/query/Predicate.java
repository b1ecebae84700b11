package io.kestra.plugin.adldap.query;

import com.unboundid.ldap.sdk.Filter;
import com.unboundid.ldap.sdk.LDAPException;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One criterion of a filter together with the boolean connecting it to the criteria added before it.
 */
@Value
@Builder
public class Predicate {
    String field;

    @NonNull
    Operator operator;

    String value;

    @NonNull
    @Builder.Default
    BooleanOperator bool = BooleanOperator.AND;

    /**
     * Renders this predicate as a single parenthesised clause, field and value escaped.
     */
    public String toFilter() {
        if (operator == Operator.RAW) {
            return raw(value);
        }

        String f = escape(field);
        String v = value == null ? "" : escape(value);

        switch (operator) {
            case EQUALS:
                return "(" + f + "=" + v + ")";
            case NOT_EQUALS:
                return "(!(" + f + "=" + v + "))";
            case CONTAINS:
                return v.isEmpty() ? present(f) : "(" + f + "=*" + v + "*)";
            case STARTS_WITH:
                return v.isEmpty() ? present(f) : "(" + f + "=" + v + "*)";
            case ENDS_WITH:
                return v.isEmpty() ? present(f) : "(" + f + "=*" + v + ")";
            case WILDCARD:
            case HAS:
                return present(f);
            case NOT_HAS:
                return "(!" + present(f) + ")";
            case GREATER_THAN_OR_EQUALS:
                return "(" + f + ">=" + v + ")";
            case LESS_THAN_OR_EQUALS:
                return "(" + f + "<=" + v + ")";
            case APPROXIMATELY:
                return "(" + f + "~=" + v + ")";
            default:
                throw new IllegalStateException("Unsupported operator " + operator);
        }
    }

    /**
     * Escapes LDAP filter metacharacters ({@code ( ) * \} and NUL) as RFC 4515 hex pairs.
     */
    public static String escape(String text) {
        if (text == null) {
            throw new IllegalArgumentException("A filter field is required.");
        }
        return Filter.encodeValue(text);
    }

    private static String present(String field) {
        return "(" + field + "=*)";
    }

    private static String raw(String clause) {
        if (clause == null || clause.isBlank()) {
            throw new IllegalArgumentException("A raw filter clause can't be blank.");
        }

        String trimmed = clause.trim();
        String wrapped = trimmed.startsWith("(") ? trimmed : "(" + trimmed + ")";
        try {
            Filter.create(wrapped);
        } catch (LDAPException e) {
            throw new IllegalArgumentException(String.format("Invalid raw filter \"%s\": %s", clause, e.getMessage()), e);
        }
        return wrapped;
    }
}
