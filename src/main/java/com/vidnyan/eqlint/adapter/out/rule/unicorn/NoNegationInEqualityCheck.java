package com.vidnyan.eqlint.adapter.out.rule.unicorn;

import com.vidnyan.eqlint.domain.ast.AstNode;
import com.vidnyan.eqlint.domain.ast.BinaryExpression;
import com.vidnyan.eqlint.domain.rule.LintContext;
import com.vidnyan.eqlint.domain.rule.LintRule;
import com.vidnyan.eqlint.domain.rule.RuleDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Disallow negated expressions on the left of (in)equality checks.
 * <p>
 * A negated expression on the left of an (in)equality check is likely a
 * mistake from trying to negate the whole condition.
 * <pre>
 * // Bad
 * if (!foo === bar) {}
 * if (!foo !== bar) {}
 *
 * // Good
 * if (foo !== bar) {}
 * if (!(foo === bar)) {}
 * </pre>
 */
@Slf4j
@Component
@Order(10)
public class NoNegationInEqualityCheck implements LintRule {
    
    public static final String RULE_ID = "unicorn/no-negation-in-equality-check";
    
    private final NegationInEqualityDetector detector = new NegationInEqualityDetector();
    
    @Override
    public boolean supports(RuleDefinition rule) {
        return RULE_ID.equals(rule.id());
    }
    
    @Override
    public void run(AstNode node, LintContext context) {
        switch (node.kind()) {
            case BINARY -> detector.check((BinaryExpression) node).ifPresent(diagnostic -> {
                log.debug("Negated equality check at {} in {}",
                        node.span(), context.sourceUnit().getPath());
                context.report(diagnostic);
            });
            case UNARY, OTHER -> {
                // not a comparison
            }
        }
    }
}
