package com.vidnyan.eqlint.adapter.in.cli;

import com.vidnyan.eqlint.LintProperties;
import com.vidnyan.eqlint.application.port.in.LintCodeUseCase;
import com.vidnyan.eqlint.application.port.in.LintCodeUseCase.FileFailure;
import com.vidnyan.eqlint.application.port.in.LintCodeUseCase.LintReport;
import com.vidnyan.eqlint.application.port.in.LintCodeUseCase.LintRequest;
import com.vidnyan.eqlint.domain.rule.Diagnostic;
import com.vidnyan.eqlint.domain.rule.RuleDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.OptionalInt;

/**
 * CLI Runner for standalone linting.
 * Runs when eqlint.lint.path is set, then exits with the lint status.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LintCliRunner implements CommandLineRunner {

    private static final int MAX_REPORTED = 200;

    private final LintCodeUseCase lintCodeUseCase;
    private final LintProperties properties;
    private final ConfigurableApplicationContext context;

    @Override
    public void run(String... args) {
        OptionalInt exitCode = lint();
        if (exitCode.isPresent()) {
            int code = exitCode.getAsInt();
            System.exit(SpringApplication.exit(context, () -> code));
        }
    }

    /**
     * Lint the configured path.
     * @return process exit code, or empty when no path is configured
     */
    OptionalInt lint() {
        String sourcePath = properties.getLint().getPath();
        if (sourcePath == null || sourcePath.isBlank()) {
            log.info("No lint path specified. Set eqlint.lint.path property.");
            return OptionalInt.empty();
        }

        try {
            log.info("Linting: {}", sourcePath);

            LintRequest request = new LintRequest(Path.of(sourcePath), List.of(),
                    properties.getLint().getExclude());
            LintReport report = lintCodeUseCase.lint(request);

            printDiagnostics(report);
            printSummary(report);

            return OptionalInt.of(report.exitCode(properties.getLint().getMaxWarnings()));
        } catch (Exception e) {
            log.error("Lint of {} failed: {}", sourcePath, e.getMessage(), e);
            return OptionalInt.of(1);
        }
    }

    private void printDiagnostics(LintReport report) {
        for (FileFailure failure : report.failedFiles()) {
            log.error("{} [PARSE] {}", failure.path(), failure.reason());
        }

        int count = 0;
        for (Diagnostic d : report.diagnostics()) {
            count++;
            if (count > MAX_REPORTED) {
                log.info("... and {} more diagnostics", report.diagnostics().size() - MAX_REPORTED);
                break;
            }

            String location = d.location() != null ? d.location().format() : "unknown";
            log.info("{} [{}] {} {}", location, d.severity(), d.ruleId(), d.message());
            if (d.help() != null) {
                log.info("    help: {}", d.help());
            }
        }
    }

    private void printSummary(LintReport report) {
        log.info("-----------------------------------------------------------");
        log.info(" Files linted:  {}", report.stats().filesLinted());
        log.info(" Nodes visited: {}", report.stats().nodesVisited());
        log.info(" Rules run:     {}", report.stats().rulesEvaluated());
        log.info(" Duration:      {}ms", report.stats().totalDurationMs());
        log.info(" Errors: {}  Warnings: {}  Info: {}  Unparseable: {}",
                report.count(RuleDefinition.Severity.BLOCKER) + report.count(RuleDefinition.Severity.ERROR),
                report.count(RuleDefinition.Severity.WARN),
                report.count(RuleDefinition.Severity.INFO),
                report.failedFiles().size());
        log.info("-----------------------------------------------------------");
    }
}
