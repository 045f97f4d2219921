package com.vidnyan.eqlint.application.port.out;

import com.vidnyan.eqlint.domain.ast.SourceUnit;

import java.nio.file.Path;
import java.util.List;

/**
 * Port for parsing source code into the syntax tree model.
 * Implemented by adapters (e.g., Closure Compiler adapter).
 */
public interface SourceCodeParser {
    
    /**
     * Parse one source text.
     * @param path Path reported in locations
     * @param source Source text
     * @return Parsed unit
     * @throws SourceParseException if the source has syntax errors
     */
    SourceUnit parse(String path, String source);
    
    /**
     * Collect lintable files under a directory, or the file itself.
     */
    List<Path> collectFiles(Path sourcePath, ParsingOptions options);
    
    /**
     * Parsing options.
     */
    record ParsingOptions(
        List<String> excludePatterns
    ) {
        public static ParsingOptions defaults() {
            return new ParsingOptions(List.of());
        }
    }
}
