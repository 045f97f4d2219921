package com.vidnyan.eqlint.domain.ast;

import java.util.Optional;

/**
 * JavaScript binary operators.
 * Logical operators ({@code &&}, {@code ||}, {@code ??}) are not binary expressions here.
 */
public enum BinaryOperator {
    EQUALITY("=="),
    INEQUALITY("!="),
    STRICT_EQUALITY("==="),
    STRICT_INEQUALITY("!=="),
    LESS_THAN("<"),
    LESS_EQUAL_THAN("<="),
    GREATER_THAN(">"),
    GREATER_EQUAL_THAN(">="),
    SHIFT_LEFT("<<"),
    SHIFT_RIGHT(">>"),
    SHIFT_RIGHT_ZERO_FILL(">>>"),
    ADDITION("+"),
    SUBTRACTION("-"),
    MULTIPLICATION("*"),
    DIVISION("/"),
    REMAINDER("%"),
    EXPONENTIAL("**"),
    BITWISE_OR("|"),
    BITWISE_XOR("^"),
    BITWISE_AND("&"),
    IN("in"),
    INSTANCEOF("instanceof");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * {@code ==}, {@code !=}, {@code ===} or {@code !==}.
     */
    public boolean isEquality() {
        return this == EQUALITY || this == INEQUALITY
                || this == STRICT_EQUALITY || this == STRICT_INEQUALITY;
    }

    /**
     * The logical complement within the same strictness, or empty for
     * operators outside the equality family.
     */
    public Optional<BinaryOperator> equalityInverse() {
        return switch (this) {
            case EQUALITY -> Optional.of(INEQUALITY);
            case INEQUALITY -> Optional.of(EQUALITY);
            case STRICT_EQUALITY -> Optional.of(STRICT_INEQUALITY);
            case STRICT_INEQUALITY -> Optional.of(STRICT_EQUALITY);
            case LESS_THAN, LESS_EQUAL_THAN, GREATER_THAN, GREATER_EQUAL_THAN,
                 SHIFT_LEFT, SHIFT_RIGHT, SHIFT_RIGHT_ZERO_FILL,
                 ADDITION, SUBTRACTION, MULTIPLICATION, DIVISION, REMAINDER, EXPONENTIAL,
                 BITWISE_OR, BITWISE_XOR, BITWISE_AND,
                 IN, INSTANCEOF -> Optional.empty();
        };
    }

    @Override
    public String toString() {
        return symbol;
    }
}
