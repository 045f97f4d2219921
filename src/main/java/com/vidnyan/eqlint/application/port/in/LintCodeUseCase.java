package com.vidnyan.eqlint.application.port.in;

import com.vidnyan.eqlint.domain.rule.Diagnostic;
import com.vidnyan.eqlint.domain.rule.LintResult;
import com.vidnyan.eqlint.domain.rule.RuleDefinition;

import java.nio.file.Path;
import java.util.List;

/**
 * Primary use case: lint JavaScript sources.
 */
public interface LintCodeUseCase {
    
    /**
     * Lint every source file under a path.
     * @param request Lint request parameters
     * @return Report with diagnostics and metadata
     */
    LintReport lint(LintRequest request);
    
    /**
     * Lint a single in-memory source with all enabled rules.
     */
    LintReport lintSource(String path, String source);
    
    /**
     * Lint request parameters.
     */
    record LintRequest(
        Path sourcePath,
        List<String> ruleIds,          // Empty = all enabled rules
        List<String> excludePatterns
    ) {
        public static LintRequest forPath(Path path) {
            return new LintRequest(path, List.of(), List.of());
        }
    }
    
    /**
     * A file that could not be read or parsed.
     */
    record FileFailure(
        String path,
        String reason
    ) {}
    
    /**
     * Lint report.
     */
    record LintReport(
        List<Diagnostic> diagnostics,
        List<LintResult> ruleResults,
        List<FileFailure> failedFiles,
        LintStats stats
    ) {
        public int count(RuleDefinition.Severity severity) {
            return (int) diagnostics.stream()
                    .filter(d -> d.severity() == severity)
                    .count();
        }
        
        public boolean hasErrors() {
            return !failedFiles.isEmpty()
                    || count(RuleDefinition.Severity.BLOCKER) > 0
                    || count(RuleDefinition.Severity.ERROR) > 0;
        }
        
        /**
         * Process exit code: 1 on errors or when warnings exceed
         * {@code maxWarnings} (negative = unlimited), else 0.
         */
        public int exitCode(int maxWarnings) {
            if (hasErrors()) {
                return 1;
            }
            if (maxWarnings >= 0 && count(RuleDefinition.Severity.WARN) > maxWarnings) {
                return 1;
            }
            return 0;
        }
    }
    
    /**
     * Lint statistics.
     */
    record LintStats(
        int filesLinted,
        int nodesVisited,
        int rulesEvaluated,
        long totalDurationMs
    ) {}
}
