package com.vidnyan.eqlint.adapter.out.rule.unicorn;

import com.vidnyan.eqlint.domain.ast.AstNode;
import com.vidnyan.eqlint.domain.ast.BinaryExpression;
import com.vidnyan.eqlint.domain.ast.BinaryOperator;
import com.vidnyan.eqlint.domain.ast.UnaryExpression;
import com.vidnyan.eqlint.domain.ast.UnaryOperator;
import com.vidnyan.eqlint.domain.rule.Diagnostic;
import com.vidnyan.eqlint.domain.rule.RuleDefinition;

import java.util.Map;
import java.util.Optional;

/**
 * Detects a logical negation on the left of an (in)equality check,
 * e.g. {@code !foo === bar}, which almost always meant {@code !(foo === bar)}.
 * <p>
 * Double negation ({@code !!foo === bar}) is boolean coercion and is left alone,
 * as is any deeper chain.
 * <p>
 * Stateless and safe to share between threads.
 */
public class NegationInEqualityDetector {

    public static final String MESSAGE =
            "eslint-plugin-unicorn(no-negation-in-equality-check): "
                    + "Negated expression is not allowed in equality check.";

    public static final String SUGGESTED_OPERATOR = "suggestedOperator";

    /**
     * @return one diagnostic spanning the whole comparison, or empty
     */
    public Optional<Diagnostic> check(BinaryExpression node) {
        Optional<UnaryExpression> negation = asLogicalNot(node.left());
        if (negation.isEmpty()) {
            return Optional.empty();
        }

        if (asLogicalNot(negation.get().argument()).isPresent()) {
            return Optional.empty();
        }

        if (!node.operator().isEquality()) {
            return Optional.empty();
        }

        return node.operator().equalityInverse()
                .map(inverse -> diagnostic(node, inverse));
    }

    private static Optional<UnaryExpression> asLogicalNot(AstNode node) {
        return switch (node.kind()) {
            case UNARY -> Optional.of((UnaryExpression) node)
                    .filter(unary -> unary.operator() == UnaryOperator.LOGICAL_NOT);
            case BINARY, OTHER -> Optional.empty();
        };
    }

    private static Diagnostic diagnostic(BinaryExpression node, BinaryOperator suggested) {
        return Diagnostic.builder()
                .severity(RuleDefinition.Severity.WARN)
                .message(MESSAGE)
                .help(String.format("Remove the negation operator and use '%s' instead.",
                        suggested.symbol()))
                .span(node.span())
                .context(Map.of(SUGGESTED_OPERATOR, suggested.symbol()))
                .build();
    }
}
