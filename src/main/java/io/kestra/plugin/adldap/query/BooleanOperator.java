package io.kestra.plugin.adldap.query;

public enum BooleanOperator {
    AND("&"),
    OR("|");

    private final String symbol;

    BooleanOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
