package com.vidnyan.eqlint.domain.ast;

/**
 * Tag used to dispatch over {@link AstNode} variants.
 */
public enum NodeKind {
    BINARY,
    UNARY,
    OTHER
}
