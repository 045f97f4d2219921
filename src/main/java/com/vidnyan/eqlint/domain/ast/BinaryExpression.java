package com.vidnyan.eqlint.domain.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code left operator right}, e.g. {@code !foo === bar}.
 */
public record BinaryExpression(
    BinaryOperator operator,
    AstNode left,
    AstNode right,
    Span span
) implements AstNode {

    public BinaryExpression {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        Objects.requireNonNull(span, "span");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BINARY;
    }

    @Override
    public List<AstNode> children() {
        return List.of(left, right);
    }
}
