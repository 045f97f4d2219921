package com.vidnyan.eqlint.adapter.in.cli;

import com.vidnyan.eqlint.LintProperties;
import com.vidnyan.eqlint.application.port.in.LintCodeUseCase;
import com.vidnyan.eqlint.domain.ast.Span;
import com.vidnyan.eqlint.domain.model.Location;
import com.vidnyan.eqlint.domain.rule.Diagnostic;
import com.vidnyan.eqlint.domain.rule.RuleDefinition;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class LintCliRunnerTest {

    /**
     * Use case returning a canned report and recording the requests it saw.
     */
    static class StubLintCodeUseCase implements LintCodeUseCase {
        private final LintReport report;
        private final RuntimeException failure;
        final List<LintRequest> requests = new ArrayList<>();

        StubLintCodeUseCase(LintReport report) {
            this(report, null);
        }

        StubLintCodeUseCase(LintReport report, RuntimeException failure) {
            this.report = report;
            this.failure = failure;
        }

        @Override
        public LintReport lint(LintRequest request) {
            requests.add(request);
            if (failure != null) {
                throw failure;
            }
            return report;
        }

        @Override
        public LintReport lintSource(String path, String source) {
            throw new UnsupportedOperationException();
        }
    }

    private static Diagnostic diagnostic(RuleDefinition.Severity severity) {
        return Diagnostic.builder()
                .ruleId("unicorn/no-negation-in-equality-check")
                .ruleName("No Negation In Equality Check")
                .severity(severity)
                .message("Negated expression is not allowed in equality check.")
                .help("Remove the negation operator and use '!==' instead.")
                .span(new Span(0, 12))
                .location(new Location("a.js", 1, 1, 1, 13))
                .context(Map.of())
                .build();
    }

    private static LintCodeUseCase.LintReport report(List<Diagnostic> diagnostics,
                                                     List<LintCodeUseCase.FileFailure> failures) {
        return new LintCodeUseCase.LintReport(diagnostics, List.of(), failures,
                new LintCodeUseCase.LintStats(1, 10, 1, 5));
    }

    private static LintProperties properties(String path, int maxWarnings) {
        LintProperties properties = new LintProperties();
        properties.getLint().setPath(path);
        properties.getLint().setMaxWarnings(maxWarnings);
        return properties;
    }

    @Test
    void lint_BlankPath_ReturnsWithoutExitCode() {
        StubLintCodeUseCase useCase = new StubLintCodeUseCase(report(List.of(), List.of()));
        LintCliRunner runner = new LintCliRunner(useCase, properties("", -1), null);

        assertEquals(OptionalInt.empty(), runner.lint());
        assertTrue(useCase.requests.isEmpty());
    }

    @Test
    void run_BlankPath_DoesNotExit() {
        LintCliRunner runner = new LintCliRunner(
                new StubLintCodeUseCase(report(List.of(), List.of())), properties("   ", -1), null);

        assertDoesNotThrow(() -> runner.run());
    }

    @Test
    void lint_WarningsOnly_ExitsZero() {
        StubLintCodeUseCase useCase = new StubLintCodeUseCase(
                report(List.of(diagnostic(RuleDefinition.Severity.WARN)), List.of()));
        LintProperties properties = properties("src", -1);
        properties.getLint().setExclude(List.of("vendor"));

        assertEquals(OptionalInt.of(0), new LintCliRunner(useCase, properties, null).lint());
        assertEquals(1, useCase.requests.size());
        assertEquals(Path.of("src"), useCase.requests.get(0).sourcePath());
        assertEquals(List.of("vendor"), useCase.requests.get(0).excludePatterns());
    }

    @Test
    void lint_ErrorDiagnostic_ExitsOne() {
        StubLintCodeUseCase useCase = new StubLintCodeUseCase(
                report(List.of(diagnostic(RuleDefinition.Severity.ERROR)), List.of()));

        assertEquals(OptionalInt.of(1), new LintCliRunner(useCase, properties("src", -1), null).lint());
    }

    @Test
    void lint_UnparseableFile_ExitsOne() {
        StubLintCodeUseCase useCase = new StubLintCodeUseCase(
                report(List.of(), List.of(new LintCodeUseCase.FileFailure("bad.js", "Parse error"))));

        assertEquals(OptionalInt.of(1), new LintCliRunner(useCase, properties("src", -1), null).lint());
    }

    @Test
    void lint_TooManyWarnings_ExitsOne() {
        StubLintCodeUseCase useCase = new StubLintCodeUseCase(report(List.of(
                diagnostic(RuleDefinition.Severity.WARN),
                diagnostic(RuleDefinition.Severity.WARN)), List.of()));

        assertEquals(OptionalInt.of(1), new LintCliRunner(useCase, properties("src", 1), null).lint());
        assertEquals(OptionalInt.of(0), new LintCliRunner(useCase, properties("src", 2), null).lint());
    }

    @Test
    void lint_UseCaseThrows_ExitsOneWithoutPropagating() {
        StubLintCodeUseCase useCase = new StubLintCodeUseCase(null, new IllegalStateException("boom"));

        assertEquals(OptionalInt.of(1), new LintCliRunner(useCase, properties("src", -1), null).lint());
    }

    @Test
    void lint_InvalidPath_ExitsOneWithoutPropagating() {
        StubLintCodeUseCase useCase = new StubLintCodeUseCase(report(List.of(), List.of()));

        assertEquals(OptionalInt.of(1), new LintCliRunner(useCase, properties("bad\u0000path", -1), null).lint());
        assertTrue(useCase.requests.isEmpty());
    }
}
