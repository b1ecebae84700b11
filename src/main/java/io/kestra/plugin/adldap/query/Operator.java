package io.kestra.plugin.adldap.query;

import java.util.Arrays;
import java.util.Locale;

/**
 * Comparison applied by a single {@link Predicate}.
 */
public enum Operator {
    EQUALS("="),
    CONTAINS("contains"),
    STARTS_WITH("starts_with"),
    ENDS_WITH("ends_with"),
    /** Matches every entry carrying the field, whatever the value. */
    WILDCARD("*"),
    HAS("has"),
    NOT_EQUALS("!"),
    NOT_HAS("!*"),
    GREATER_THAN_OR_EQUALS(">="),
    LESS_THAN_OR_EQUALS("<="),
    APPROXIMATELY("~="),
    /** A complete filter clause used verbatim, the field is ignored. */
    RAW("raw");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Resolves an operator from its symbol ({@code =}, {@code !}, {@code >=}, {@code contains}...) or its enum name.
     */
    public static Operator fromSymbol(String symbol) {
        String normalized = symbol.trim().toLowerCase(Locale.ROOT);

        return Arrays.stream(values())
            .filter(operator -> operator.symbol.equals(normalized) || operator.name().equalsIgnoreCase(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(String.format("Unknown operator \"%s\".", symbol)));
    }
}
