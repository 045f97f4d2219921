package com.vidnyan.eqlint.domain.rule;

import com.vidnyan.eqlint.domain.ast.Span;
import com.vidnyan.eqlint.domain.model.Location;

import java.util.Map;

/**
 * A reported finding: where, what, and how to fix it.
 * Immutable value object.
 */
public record Diagnostic(
    String ruleId,
    String ruleName,
    RuleDefinition.Severity severity,
    String message,
    String help,
    Span span,
    Location location,
    Map<String, Object> context
) {
    
    /**
     * Get context value.
     */
    @SuppressWarnings("unchecked")
    public <T> T getContext(String key, Class<T> type) {
        return (T) context.get(key);
    }
    
    /**
     * Copy stamped with the reporting rule and the resolved location.
     */
    public Diagnostic attributedTo(RuleDefinition rule, Location resolvedLocation) {
        return new Diagnostic(rule.id(), rule.name(), rule.severity(), message, help,
                span, resolvedLocation, context);
    }
    
    /**
     * Builder for Diagnostic.
     */
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private String ruleId;
        private String ruleName;
        private RuleDefinition.Severity severity = RuleDefinition.Severity.WARN;
        private String message;
        private String help;
        private Span span = Span.EMPTY;
        private Location location;
        private Map<String, Object> context = Map.of();
        
        public Builder ruleId(String id) { this.ruleId = id; return this; }
        public Builder ruleName(String name) { this.ruleName = name; return this; }
        public Builder severity(RuleDefinition.Severity sev) { this.severity = sev; return this; }
        public Builder message(String msg) { this.message = msg; return this; }
        public Builder help(String help) { this.help = help; return this; }
        public Builder span(Span span) { this.span = span; return this; }
        public Builder location(Location loc) { this.location = loc; return this; }
        public Builder context(Map<String, Object> ctx) { this.context = ctx; return this; }
        
        public Diagnostic build() {
            return new Diagnostic(ruleId, ruleName, severity, message, help, span, location, context);
        }
    }
}
