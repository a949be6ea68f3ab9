package org.flowdesigner.core.project.models;

import java.util.Arrays;

public enum RuleOperator {
    EQUALS("==");

    private final String symbol;

    RuleOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public static RuleOperator fromSymbol(String symbol) {
        return Arrays.stream(values())
                .filter(op -> op.symbol.equals(symbol))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown rule operator: " + symbol));
    }
}
