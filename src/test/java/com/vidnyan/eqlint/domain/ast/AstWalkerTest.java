package com.vidnyan.eqlint.domain.ast;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AstWalkerTest {

    /**
     * Node type supplied by another parser adapter.
     */
    record TemplateLiteral(Span span, List<AstNode> children) implements AstNode {
        @Override
        public NodeKind kind() {
            return NodeKind.OTHER;
        }
    }

    @Test
    void walk_VisitsEveryNodeOnceInPreOrder() {
        // !a === b; c
        AstNode a = OtherNode.leaf("NAME", new Span(1, 2));
        AstNode not = new UnaryExpression(UnaryOperator.LOGICAL_NOT, a, new Span(0, 2));
        AstNode b = OtherNode.leaf("NAME", new Span(7, 8));
        AstNode comparison = new BinaryExpression(BinaryOperator.STRICT_EQUALITY, not, b, new Span(0, 8));
        AstNode c = OtherNode.leaf("NAME", new Span(10, 11));
        AstNode root = new OtherNode("SCRIPT", new Span(0, 11), List.of(comparison, c));

        List<AstNode> visited = new ArrayList<>();
        int count = AstWalker.walk(root, visited::add);

        assertEquals(6, count);
        assertEquals(List.of(root, comparison, not, a, b, c), visited);
    }

    @Test
    void walk_HandlesDeepNesting() {
        AstNode node = OtherNode.leaf("NAME", new Span(0, 0));
        for (int i = 0; i < 50_000; i++) {
            node = new UnaryExpression(UnaryOperator.LOGICAL_NOT, node, Span.EMPTY);
        }

        assertEquals(50_001, AstWalker.walk(node, n -> { }));
    }

    @Test
    void walk_AcceptsNodeTypesFromOtherAdapters() {
        AstNode inner = OtherNode.leaf("NAME", new Span(3, 4));
        AstNode template = new TemplateLiteral(new Span(0, 6), List.of(inner));
        AstNode root = new OtherNode("SCRIPT", new Span(0, 6), List.of(template));

        List<AstNode> visited = new ArrayList<>();
        assertEquals(3, AstWalker.walk(root, visited::add));
        assertEquals(List.of(root, template, inner), visited);
    }
}
