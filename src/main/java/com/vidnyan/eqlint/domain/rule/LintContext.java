package com.vidnyan.eqlint.domain.rule;

import com.vidnyan.eqlint.domain.ast.SourceUnit;

import java.util.ArrayList;
import java.util.List;

/**
 * Context provided to a rule while it runs over one file.
 * Not shared between threads: the engine creates one per (rule, file).
 */
public class LintContext {
    
    private final RuleDefinition rule;
    private final SourceUnit sourceUnit;
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    
    public LintContext(RuleDefinition rule, SourceUnit sourceUnit) {
        this.rule = rule;
        this.sourceUnit = sourceUnit;
    }
    
    public RuleDefinition rule() {
        return rule;
    }
    
    public SourceUnit sourceUnit() {
        return sourceUnit;
    }
    
    /**
     * Record a finding. Rule id, name and configured severity override
     * whatever the diagnostic carried.
     */
    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic.attributedTo(rule, sourceUnit.locate(diagnostic.span())));
    }
    
    public List<Diagnostic> diagnostics() {
        return List.copyOf(diagnostics);
    }
}
