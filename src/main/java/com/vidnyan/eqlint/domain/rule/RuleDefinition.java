package com.vidnyan.eqlint.domain.rule;

import java.util.List;
import java.util.Map;

/**
 * Rule definition - identity, default severity and documentation of a lint rule.
 * Immutable value object loaded from JSON.
 */
public record RuleDefinition(
    String id,
    String name,
    String description,
    Severity severity,
    Category category,
    Remediation remediation,
    Map<String, Object> config,
    boolean isEnabled
) {
    
    public enum Severity {
        BLOCKER,    // Must fix before merge
        ERROR,      // Fails the lint run
        WARN,       // Reported, fails only past max-warnings
        INFO        // Informational
    }
    
    public enum Category {
        CORRECTNESS,
        SUSPICIOUS,
        PEDANTIC,
        PERF,
        RESTRICTION,
        STYLE,
        NURSERY     // New rules, not yet stable
    }
    
    /**
     * Remediation guidance.
     */
    public record Remediation(
        String quickFix,
        String explanation,
        List<String> references
    ) {}
    
    /**
     * Plugin part of the id, e.g. {@code unicorn} for {@code unicorn/no-negation-in-equality-check}.
     */
    public String plugin() {
        int slash = id.indexOf('/');
        return slash < 0 ? "" : id.substring(0, slash);
    }
    
    public RuleDefinition withSeverity(Severity newSeverity) {
        return new RuleDefinition(id, name, description, newSeverity, category,
                remediation, config, isEnabled);
    }
    
    public RuleDefinition withEnabled(boolean enabled) {
        return new RuleDefinition(id, name, description, severity, category,
                remediation, config, enabled);
    }
    
    /**
     * Builder for RuleDefinition.
     */
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private String id;
        private String name;
        private String description;
        private Severity severity = Severity.WARN;
        private Category category = Category.NURSERY;
        private Remediation remediation;
        private Map<String, Object> config = Map.of();
        private boolean isEnabled = true;
        
        public Builder id(String id) { this.id = id; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder description(String desc) { this.description = desc; return this; }
        public Builder severity(Severity sev) { this.severity = sev; return this; }
        public Builder category(Category cat) { this.category = cat; return this; }
        public Builder remediation(Remediation rem) { this.remediation = rem; return this; }
        public Builder config(Map<String, Object> cfg) { this.config = cfg; return this; }
        public Builder isEnabled(boolean enabled) { this.isEnabled = enabled; return this; }
        
        public RuleDefinition build() {
            return new RuleDefinition(id, name, description, severity, category,
                    remediation, config, isEnabled);
        }
    }
}
