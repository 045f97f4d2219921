package com.vidnyan.eqlint.api;

import com.vidnyan.eqlint.application.port.in.LintCodeUseCase;
import com.vidnyan.eqlint.application.port.in.LintCodeUseCase.FileFailure;
import com.vidnyan.eqlint.application.port.in.LintCodeUseCase.LintReport;
import com.vidnyan.eqlint.application.port.out.RuleRepository;
import com.vidnyan.eqlint.domain.rule.Diagnostic;
import com.vidnyan.eqlint.domain.rule.RuleDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * REST API for linting source snippets.
 */
@RestController
@RequestMapping("/api/lint")
public class LintController {

    private static final Logger log = LoggerFactory.getLogger(LintController.class);

    private final LintCodeUseCase lintCodeUseCase;
    private final RuleRepository ruleRepository;

    public LintController(LintCodeUseCase lintCodeUseCase, RuleRepository ruleRepository) {
        this.lintCodeUseCase = lintCodeUseCase;
        this.ruleRepository = ruleRepository;
    }

    @PostMapping
    public LintResponse lint(@RequestBody LintRequest request) {
        if (request == null || request.source() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "source is required");
        }
        String path = request.path() == null || request.path().isBlank() ? "input.js" : request.path();
        log.info("Received lint request for {} ({} chars)", path, request.source().length());

        LintReport report = lintCodeUseCase.lintSource(path, request.source());
        return new LintResponse(report.diagnostics().size(), report.diagnostics(), report.failedFiles());
    }

    @GetMapping("/rules")
    public List<RuleDefinition> rules() {
        return ruleRepository.findAll();
    }

    @GetMapping("/health")
    public String health() {
        return "OK";
    }

    public record LintRequest(
        String path,
        String source
    ) {}

    public record LintResponse(
        int totalDiagnostics,
        List<Diagnostic> diagnostics,
        List<FileFailure> parseErrors
    ) {}
}
