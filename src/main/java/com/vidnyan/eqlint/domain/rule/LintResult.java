package com.vidnyan.eqlint.domain.rule;

import java.time.Duration;
import java.util.List;

/**
 * Result of running one rule over all linted files.
 */
public record LintResult(
    String ruleId,
    List<Diagnostic> diagnostics,
    Duration executionTime,
    int nodesVisited,
    LintStatus status,
    String errorMessage
) {
    
    public enum LintStatus {
        SUCCESS,
        ERROR,
        SKIPPED
    }
    
    /**
     * Create a successful result.
     */
    public static LintResult success(String ruleId, List<Diagnostic> diagnostics,
                                     Duration duration, int nodes) {
        return new LintResult(ruleId, diagnostics, duration, nodes,
                LintStatus.SUCCESS, null);
    }
    
    /**
     * Create an error result.
     */
    public static LintResult error(String ruleId, String message) {
        return new LintResult(ruleId, List.of(), Duration.ZERO, 0,
                LintStatus.ERROR, message);
    }
    
    /**
     * Create a skipped result.
     */
    public static LintResult skipped(String ruleId, String reason) {
        return new LintResult(ruleId, List.of(), Duration.ZERO, 0,
                LintStatus.SKIPPED, reason);
    }
    
    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
    
    public int diagnosticCount() {
        return diagnostics.size();
    }
}
