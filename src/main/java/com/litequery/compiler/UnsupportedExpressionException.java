package com.litequery.compiler;

/**
 * Thrown when a predicate contains a construct the native query language cannot express.
 * The compilation is aborted as a whole; no partial query is produced.
 */
public class UnsupportedExpressionException extends IllegalArgumentException {
    private final String construct;

    public UnsupportedExpressionException(String construct) {
        this(construct, "Unsupported expression: " + construct);
    }

    public UnsupportedExpressionException(String construct, String message) {
        super(message);
        this.construct = construct;
    }

    /** The node category or method name that was rejected. */
    public String getConstruct() {
        return construct;
    }
}
