package com.vidnyan.eqlint.domain.ast;

import java.util.List;
import java.util.Objects;

/**
 * Prefix unary expression such as {@code !foo} or {@code typeof foo}.
 */
public record UnaryExpression(
    UnaryOperator operator,
    AstNode argument,
    Span span
) implements AstNode {

    public UnaryExpression {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(argument, "argument");
        Objects.requireNonNull(span, "span");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.UNARY;
    }

    @Override
    public List<AstNode> children() {
        return List.of(argument);
    }
}
