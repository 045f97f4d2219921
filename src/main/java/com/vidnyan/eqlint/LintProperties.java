package com.vidnyan.eqlint;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the lint engine.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "eqlint")
public class LintProperties {
    
    private Lint lint = new Lint();
    
    private Rules rules = new Rules();
    
    @Data
    public static class Lint {
        
        /**
         * File or directory to lint. Empty disables the command line run.
         */
        private String path = "";
        
        /**
         * Path substrings to skip.
         */
        private List<String> exclude = new ArrayList<>();
        
        /**
         * Warnings tolerated before the run fails. Negative = unlimited.
         */
        private int maxWarnings = -1;
    }
    
    @Data
    public static class Rules {
        
        /**
         * Where rule definitions are loaded from.
         */
        private String path = "classpath*:rules/*.json";
        
        /**
         * Rule ids to turn off.
         */
        private List<String> disabled = new ArrayList<>();
        
        /**
         * Severity overrides keyed by rule id.
         */
        private Map<String, String> severity = new HashMap<>();
    }
}
