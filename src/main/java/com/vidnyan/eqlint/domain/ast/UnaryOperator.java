package com.vidnyan.eqlint.domain.ast;

/**
 * JavaScript prefix unary operators.
 */
public enum UnaryOperator {
    LOGICAL_NOT("!"),
    UNARY_PLUS("+"),
    UNARY_NEGATION("-"),
    BITWISE_NOT("~"),
    TYPEOF("typeof"),
    VOID("void"),
    DELETE("delete");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
