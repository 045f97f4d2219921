package com.vidnyan.eqlint.domain.ast;

import java.util.List;
import java.util.Objects;

/**
 * Any node the rules do not inspect structurally: statements, identifiers,
 * calls, literals. {@code type} is the parser's own node name.
 */
public record OtherNode(
    String type,
    Span span,
    List<AstNode> children
) implements AstNode {

    public OtherNode {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(span, "span");
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static OtherNode leaf(String type, Span span) {
        return new OtherNode(type, span, List.of());
    }

    @Override
    public NodeKind kind() {
        return NodeKind.OTHER;
    }
}
