package com.vidnyan.eqlint.domain.model;

/**
 * Source code location, 1-based lines and columns.
 */
public record Location(
    String filePath,
    int line,
    int column,
    int endLine,
    int endColumn
) {
    
    /**
     * Format as readable string.
     */
    public String format() {
        return filePath + ":" + line + ":" + column;
    }
}
