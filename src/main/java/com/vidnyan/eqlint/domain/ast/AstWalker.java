package com.vidnyan.eqlint.domain.ast;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * Pre-order traversal over a syntax tree.
 * Iterative, so deeply nested sources do not exhaust the stack.
 */
public final class AstWalker {

    private AstWalker() {
    }

    /**
     * Visit every node under {@code root} (inclusive) exactly once, parents
     * before children, siblings in source order.
     *
     * @return number of nodes visited
     */
    public static int walk(AstNode root, Consumer<AstNode> visitor) {
        Deque<AstNode> stack = new ArrayDeque<>();
        stack.push(root);
        int visited = 0;

        while (!stack.isEmpty()) {
            AstNode node = stack.pop();
            visitor.accept(node);
            visited++;

            List<AstNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return visited;
    }
}
