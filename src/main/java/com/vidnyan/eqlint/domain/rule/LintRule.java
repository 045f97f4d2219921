package com.vidnyan.eqlint.domain.rule;

import com.vidnyan.eqlint.domain.ast.AstNode;

/**
 * Interface for lint rules.
 * The engine calls {@link #run} once for every node of every file; rules
 * must not keep state between calls.
 */
public interface LintRule {
    
    /**
     * Check if this rule implements the given definition.
     */
    boolean supports(RuleDefinition rule);
    
    /**
     * Inspect one node and report findings to the context.
     */
    void run(AstNode node, LintContext context);
    
    /**
     * Get the rule name for logging.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
