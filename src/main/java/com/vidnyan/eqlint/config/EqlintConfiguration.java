package com.vidnyan.eqlint.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.eqlint.domain.rule.LintRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring configuration for eqlint components.
 */
@Slf4j
@Configuration
public class EqlintConfiguration {

    /**
     * ObjectMapper for rule definitions and API responses.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    /**
     * Log available rules on startup.
     */
    @Bean
    public String logLintRules(List<LintRule> rules) {
        log.info("Registered {} lint rules:", rules.size());
        rules.forEach(r -> log.info("  - {}", r.getName()));
        return "lint-rules-logged";
    }
}
