package com.vidnyan.eqlint.application.port.out;

import java.util.List;

/**
 * Thrown when a source file cannot be parsed.
 */
public class SourceParseException extends RuntimeException {
    
    private final String path;
    private final List<String> errors;
    
    public SourceParseException(String path, List<String> errors) {
        super("Failed to parse " + path + ": " + String.join("; ", errors));
        this.path = path;
        this.errors = List.copyOf(errors);
    }
    
    public String getPath() {
        return path;
    }
    
    public List<String> getErrors() {
        return errors;
    }
}
