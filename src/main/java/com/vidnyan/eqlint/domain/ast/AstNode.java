package com.vidnyan.eqlint.domain.ast;

import java.util.List;

/**
 * Immutable syntax tree node produced by a parser adapter.
 * Rules switch on {@link #kind()} rather than on the concrete type.
 */
public interface AstNode {

    NodeKind kind();

    Span span();

    /**
     * Direct children in source order.
     */
    List<AstNode> children();
}
