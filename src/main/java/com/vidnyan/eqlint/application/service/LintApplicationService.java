package com.vidnyan.eqlint.application.service;

import com.vidnyan.eqlint.application.port.in.LintCodeUseCase;
import com.vidnyan.eqlint.application.port.out.RuleRepository;
import com.vidnyan.eqlint.application.port.out.SourceCodeParser;
import com.vidnyan.eqlint.application.port.out.SourceParseException;
import com.vidnyan.eqlint.domain.ast.AstWalker;
import com.vidnyan.eqlint.domain.ast.SourceUnit;
import com.vidnyan.eqlint.domain.rule.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main application service that orchestrates the lint workflow.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LintApplicationService implements LintCodeUseCase {

    private static final Comparator<Diagnostic> BY_POSITION = Comparator
            .comparing((Diagnostic d) -> d.location().filePath())
            .thenComparingInt(d -> d.span().start())
            .thenComparing(Diagnostic::ruleId);

    private final SourceCodeParser sourceCodeParser;
    private final RuleRepository ruleRepository;
    private final List<LintRule> lintRules;

    @Override
    public LintReport lint(LintRequest request) {
        Instant startTime = Instant.now();
        log.info("Starting lint of: {}", request.sourcePath());

        // Step 1: Collect files
        log.info("Step 1: Collecting source files...");
        List<Path> files;
        try {
            files = sourceCodeParser.collectFiles(request.sourcePath(),
                    new SourceCodeParser.ParsingOptions(request.excludePatterns()));
        } catch (UncheckedIOException e) {
            log.error("Cannot read {}: {}", request.sourcePath(), e.getMessage());
            return emptyReport(List.of(new FileFailure(request.sourcePath().toString(), e.getMessage())),
                    startTime);
        }
        log.info("Found {} source files", files.size());

        // Step 2: Parse
        log.info("Step 2: Parsing source files...");
        List<FileFailure> failures = Collections.synchronizedList(new ArrayList<>());
        List<SourceUnit> units = files.parallelStream()
                .map(file -> parseFile(file, failures))
                .flatMap(Optional::stream)
                .toList();
        log.info("Parsed {}/{} files", units.size(), files.size());

        // Step 3: Load rules
        log.info("Step 3: Loading rules...");
        List<RuleDefinition> rules = request.ruleIds().isEmpty()
                ? ruleRepository.findEnabled()
                : request.ruleIds().stream()
                        .map(ruleRepository::findById)
                        .flatMap(Optional::stream)
                        .toList();
        log.info("Loaded {} rules", rules.size());

        // Step 4: Run rules
        log.info("Step 4: Running rules...");
        return runRules(units, rules, failures, startTime);
    }

    @Override
    public LintReport lintSource(String path, String source) {
        Instant startTime = Instant.now();
        List<FileFailure> failures = new ArrayList<>();
        List<SourceUnit> units = new ArrayList<>();
        try {
            units.add(sourceCodeParser.parse(path, source));
        } catch (SourceParseException e) {
            log.warn("{}", e.getMessage());
            failures.add(new FileFailure(path, String.join("; ", e.getErrors())));
        }
        return runRules(units, ruleRepository.findEnabled(), failures, startTime);
    }

    private Optional<SourceUnit> parseFile(Path file, List<FileFailure> failures) {
        try {
            String source = Files.readString(file);
            return Optional.of(sourceCodeParser.parse(file.toString(), source));
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", file, e.getMessage());
            failures.add(new FileFailure(file.toString(), e.getMessage()));
        } catch (SourceParseException e) {
            log.warn("{}", e.getMessage());
            failures.add(new FileFailure(file.toString(), String.join("; ", e.getErrors())));
        }
        return Optional.empty();
    }

    private LintReport runRules(List<SourceUnit> units, List<RuleDefinition> rules,
                                List<FileFailure> failures, Instant startTime) {
        List<LintResult> ruleResults = new ArrayList<>();
        List<Diagnostic> allDiagnostics = new ArrayList<>();
        int nodesVisited = 0;

        for (RuleDefinition rule : rules) {
            log.debug("  Processing rule: {}", rule.id());

            LintRule lintRule = findRule(rule);
            if (lintRule == null) {
                log.warn("No implementation found for rule: {}", rule.id());
                ruleResults.add(LintResult.skipped(rule.id(), "No implementation available"));
                continue;
            }

            try {
                LintResult result = runRule(rule, lintRule, units);
                ruleResults.add(result);
                allDiagnostics.addAll(result.diagnostics());
                nodesVisited = Math.max(nodesVisited, result.nodesVisited());

                if (result.hasDiagnostics()) {
                    log.info("  {} reported {} diagnostics", rule.id(), result.diagnosticCount());
                }
            } catch (Exception e) {
                log.error("Error running rule {}: {}", rule.id(), e.getMessage(), e);
                ruleResults.add(LintResult.error(rule.id(), e.getMessage()));
            }
        }

        allDiagnostics.sort(BY_POSITION);

        Duration totalDuration = Duration.between(startTime, Instant.now());
        LintStats stats = new LintStats(
                units.size(),
                nodesVisited,
                rules.size(),
                totalDuration.toMillis()
        );

        log.info("Lint complete: {} diagnostics, {} unparseable files in {}ms",
                allDiagnostics.size(), failures.size(), stats.totalDurationMs());

        return new LintReport(List.copyOf(allDiagnostics), List.copyOf(ruleResults),
                List.copyOf(failures), stats);
    }

    private LintResult runRule(RuleDefinition rule, LintRule lintRule, List<SourceUnit> units) {
        Instant start = Instant.now();
        AtomicInteger nodes = new AtomicInteger();

        List<Diagnostic> diagnostics = units.parallelStream()
                .flatMap(unit -> {
                    LintContext context = new LintContext(rule, unit);
                    nodes.addAndGet(AstWalker.walk(unit.getRoot(), node -> lintRule.run(node, context)));
                    return context.diagnostics().stream();
                })
                .toList();

        return LintResult.success(rule.id(), diagnostics,
                Duration.between(start, Instant.now()), nodes.get());
    }

    private LintReport emptyReport(List<FileFailure> failures, Instant startTime) {
        return new LintReport(List.of(), List.of(), failures,
                new LintStats(0, 0, 0, Duration.between(startTime, Instant.now()).toMillis()));
    }

    private LintRule findRule(RuleDefinition rule) {
        return lintRules.stream()
                .filter(r -> r.supports(rule))
                .findFirst()
                .orElse(null);
    }
}
