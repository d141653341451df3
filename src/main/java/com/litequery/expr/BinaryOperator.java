package com.litequery.expr;

public enum BinaryOperator {
    LESS_THAN("<", "<"),
    LESS_THAN_OR_EQUAL("<=", "<="),
    GREATER_THAN(">", ">"),
    GREATER_THAN_OR_EQUAL(">=", ">="),
    EQUAL("==", "="),
    NOT_EQUAL("!=", "!="),
    AND_ALSO("&&", null),
    OR_ELSE("||", null),
    ADD("+", null),
    SUBTRACT("-", null),
    MULTIPLY("*", null),
    DIVIDE("/", null),
    MODULO("%", null);

    private final String symbol;
    private final String queryToken;

    BinaryOperator(String symbol, String queryToken) {
        this.symbol = symbol;
        this.queryToken = queryToken;
    }

    /** Host-language spelling, as used in the JSON expression format. */
    public String symbol() {
        return symbol;
    }

    /** Engine operator token, or null when the engine has no comparison for it. */
    public String queryToken() {
        return queryToken;
    }

    public boolean isComparison() {
        return queryToken != null;
    }

    public static BinaryOperator fromSymbol(String symbol) {
        for (BinaryOperator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown binary operator: " + symbol);
    }
}
