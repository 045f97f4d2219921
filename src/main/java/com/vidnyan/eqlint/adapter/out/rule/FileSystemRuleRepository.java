package com.vidnyan.eqlint.adapter.out.rule;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.eqlint.LintProperties;
import com.vidnyan.eqlint.application.port.out.RuleRepository;
import com.vidnyan.eqlint.domain.rule.RuleDefinition;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * File system based rule repository.
 * Loads rule definitions from JSON files in the classpath, then applies the
 * severity and enablement overrides from {@link LintProperties}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileSystemRuleRepository implements RuleRepository {

    private final ObjectMapper objectMapper;
    private final LintProperties properties;

    private final Map<String, RuleDefinition> rules = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadRules() {
        String rulesPath = properties.getRules().getPath();
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources(rulesPath);

            for (Resource resource : resources) {
                try {
                    RuleDto dto = objectMapper.readValue(resource.getInputStream(), RuleDto.class);
                    RuleDefinition rule = applyOverrides(mapToRule(dto));
                    rules.put(rule.id(), rule);
                    log.info("Loaded rule: {} ({}, {})", rule.id(), rule.severity(),
                            rule.isEnabled() ? "enabled" : "disabled");
                } catch (Exception e) {
                    log.warn("Failed to load rule from {}: {}", resource.getFilename(), e.getMessage());
                }
            }

            log.info("Loaded {} rules from {}", rules.size(), rulesPath);
        } catch (IOException e) {
            log.error("Failed to load rules", e);
        }
    }

    @Override
    public List<RuleDefinition> findAll() {
        return rules.values().stream()
                .sorted(Comparator.comparing(RuleDefinition::id))
                .toList();
    }

    @Override
    public Optional<RuleDefinition> findById(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    @Override
    public List<RuleDefinition> findByCategory(RuleDefinition.Category category) {
        return findAll().stream()
                .filter(r -> r.category() == category)
                .toList();
    }

    @Override
    public List<RuleDefinition> findEnabled() {
        return findAll().stream()
                .filter(RuleDefinition::isEnabled)
                .toList();
    }

    private RuleDefinition applyOverrides(RuleDefinition rule) {
        RuleDefinition result = rule;
        String severity = properties.getRules().getSeverity().get(rule.id());
        if (severity != null) {
            result = result.withSeverity(mapSeverity(severity));
        }
        if (properties.getRules().getDisabled().contains(rule.id())) {
            result = result.withEnabled(false);
        }
        return result;
    }

    private RuleDefinition mapToRule(RuleDto dto) {
        if (dto.id == null || dto.id.isBlank()) {
            throw new IllegalArgumentException("Rule definition without id");
        }
        return RuleDefinition.builder()
                .id(dto.id)
                .name(dto.name != null ? dto.name : dto.id)
                .description(dto.description)
                .severity(mapSeverity(dto.severity))
                .category(mapCategory(dto.category))
                .remediation(mapRemediation(dto.remediation))
                .config(dto.config != null ? dto.config : Map.of())
                .isEnabled(dto.isEnabled != null ? dto.isEnabled : true)
                .build();
    }

    private RuleDefinition.Severity mapSeverity(String severity) {
        if (severity == null) return RuleDefinition.Severity.WARN;
        return switch (severity.toUpperCase()) {
            case "BLOCKER" -> RuleDefinition.Severity.BLOCKER;
            case "ERROR", "DENY" -> RuleDefinition.Severity.ERROR;
            case "WARN", "WARNING" -> RuleDefinition.Severity.WARN;
            case "INFO" -> RuleDefinition.Severity.INFO;
            default -> RuleDefinition.Severity.WARN;
        };
    }

    private RuleDefinition.Category mapCategory(String category) {
        if (category == null) return RuleDefinition.Category.NURSERY;
        return switch (category.toUpperCase().replace("-", "_").replace(" ", "_")) {
            case "CORRECTNESS" -> RuleDefinition.Category.CORRECTNESS;
            case "SUSPICIOUS" -> RuleDefinition.Category.SUSPICIOUS;
            case "PEDANTIC" -> RuleDefinition.Category.PEDANTIC;
            case "PERF", "PERFORMANCE" -> RuleDefinition.Category.PERF;
            case "RESTRICTION" -> RuleDefinition.Category.RESTRICTION;
            case "STYLE" -> RuleDefinition.Category.STYLE;
            default -> RuleDefinition.Category.NURSERY;
        };
    }

    private RuleDefinition.Remediation mapRemediation(RemediationDto dto) {
        if (dto == null) return null;
        return new RuleDefinition.Remediation(
                dto.quickFix,
                dto.explanation,
                dto.references != null ? dto.references : List.of()
        );
    }

    // DTO classes for JSON deserialization
    static class RuleDto {
        public String id;
        public String name;
        public String description;
        public String severity;
        public String category;
        public RemediationDto remediation;
        public Map<String, Object> config;
        public Boolean isEnabled;
    }

    static class RemediationDto {
        public String quickFix;
        public String explanation;
        public List<String> references;
    }
}
