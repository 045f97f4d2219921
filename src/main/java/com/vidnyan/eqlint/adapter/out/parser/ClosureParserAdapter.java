package com.vidnyan.eqlint.adapter.out.parser;

import com.google.javascript.jscomp.Compiler;
import com.google.javascript.jscomp.CompilerOptions;
import com.google.javascript.jscomp.JSError;
import com.google.javascript.jscomp.SourceFile;
import com.google.javascript.rhino.Node;
import com.google.javascript.rhino.Token;
import com.vidnyan.eqlint.application.port.out.SourceCodeParser;
import com.vidnyan.eqlint.application.port.out.SourceParseException;
import com.vidnyan.eqlint.domain.ast.AstNode;
import com.vidnyan.eqlint.domain.ast.BinaryExpression;
import com.vidnyan.eqlint.domain.ast.BinaryOperator;
import com.vidnyan.eqlint.domain.ast.OtherNode;
import com.vidnyan.eqlint.domain.ast.SourceUnit;
import com.vidnyan.eqlint.domain.ast.Span;
import com.vidnyan.eqlint.domain.ast.UnaryExpression;
import com.vidnyan.eqlint.domain.ast.UnaryOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Closure Compiler based implementation of SourceCodeParser.
 * Parses JavaScript and translates Closure's IR into the lint syntax tree.
 */
@Slf4j
@Component
public class ClosureParserAdapter implements SourceCodeParser {

    private static final List<String> EXTENSIONS = List.of(".js", ".mjs", ".cjs");

    private static final Map<Token, BinaryOperator> BINARY_TOKENS = new EnumMap<>(Token.class);
    private static final Map<Token, UnaryOperator> UNARY_TOKENS = new EnumMap<>(Token.class);

    static {
        BINARY_TOKENS.put(Token.EQ, BinaryOperator.EQUALITY);
        BINARY_TOKENS.put(Token.NE, BinaryOperator.INEQUALITY);
        BINARY_TOKENS.put(Token.SHEQ, BinaryOperator.STRICT_EQUALITY);
        BINARY_TOKENS.put(Token.SHNE, BinaryOperator.STRICT_INEQUALITY);
        BINARY_TOKENS.put(Token.LT, BinaryOperator.LESS_THAN);
        BINARY_TOKENS.put(Token.LE, BinaryOperator.LESS_EQUAL_THAN);
        BINARY_TOKENS.put(Token.GT, BinaryOperator.GREATER_THAN);
        BINARY_TOKENS.put(Token.GE, BinaryOperator.GREATER_EQUAL_THAN);
        BINARY_TOKENS.put(Token.LSH, BinaryOperator.SHIFT_LEFT);
        BINARY_TOKENS.put(Token.RSH, BinaryOperator.SHIFT_RIGHT);
        BINARY_TOKENS.put(Token.URSH, BinaryOperator.SHIFT_RIGHT_ZERO_FILL);
        BINARY_TOKENS.put(Token.ADD, BinaryOperator.ADDITION);
        BINARY_TOKENS.put(Token.SUB, BinaryOperator.SUBTRACTION);
        BINARY_TOKENS.put(Token.MUL, BinaryOperator.MULTIPLICATION);
        BINARY_TOKENS.put(Token.DIV, BinaryOperator.DIVISION);
        BINARY_TOKENS.put(Token.MOD, BinaryOperator.REMAINDER);
        BINARY_TOKENS.put(Token.EXPONENT, BinaryOperator.EXPONENTIAL);
        BINARY_TOKENS.put(Token.BITOR, BinaryOperator.BITWISE_OR);
        BINARY_TOKENS.put(Token.BITXOR, BinaryOperator.BITWISE_XOR);
        BINARY_TOKENS.put(Token.BITAND, BinaryOperator.BITWISE_AND);
        BINARY_TOKENS.put(Token.IN, BinaryOperator.IN);
        BINARY_TOKENS.put(Token.INSTANCEOF, BinaryOperator.INSTANCEOF);

        UNARY_TOKENS.put(Token.NOT, UnaryOperator.LOGICAL_NOT);
        UNARY_TOKENS.put(Token.POS, UnaryOperator.UNARY_PLUS);
        UNARY_TOKENS.put(Token.NEG, UnaryOperator.UNARY_NEGATION);
        UNARY_TOKENS.put(Token.BITNOT, UnaryOperator.BITWISE_NOT);
        UNARY_TOKENS.put(Token.TYPEOF, UnaryOperator.TYPEOF);
        UNARY_TOKENS.put(Token.VOID, UnaryOperator.VOID);
        UNARY_TOKENS.put(Token.DELPROP, UnaryOperator.DELETE);
    }

    @Override
    public SourceUnit parse(String path, String source) {
        // Compiler instances are not thread-safe; one per file
        Compiler compiler = new Compiler();
        CompilerOptions options = new CompilerOptions();
        options.setLanguageIn(CompilerOptions.LanguageMode.ECMASCRIPT_NEXT);
        compiler.initOptions(options);

        Node root = compiler.parse(SourceFile.fromCode(path, source));

        List<String> errors = new ArrayList<>();
        for (JSError error : compiler.getErrors()) {
            errors.add(error.toString());
        }
        if (!errors.isEmpty() || root == null) {
            throw new SourceParseException(path, errors);
        }

        log.debug("Parsed {} ({} chars)", path, source.length());
        return new SourceUnit(path, source, translate(root, source.length()));
    }

    @Override
    public List<Path> collectFiles(Path sourcePath, ParsingOptions options) {
        if (Files.isRegularFile(sourcePath)) {
            return List.of(sourcePath);
        }
        try (Stream<Path> paths = Files.walk(sourcePath)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(this::isJavaScriptFile)
                    .filter(p -> !isDependency(sourcePath.relativize(p)))
                    .filter(p -> !matchesExcludePattern(p, options.excludePatterns()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to walk directory: " + sourcePath, e);
        }
    }

    private boolean isJavaScriptFile(Path path) {
        String name = path.getFileName().toString();
        return EXTENSIONS.stream().anyMatch(name::endsWith);
    }

    private boolean isDependency(Path relativePath) {
        for (Path part : relativePath) {
            if ("node_modules".equals(part.toString())) {
                return true;
            }
        }
        return false;
    }

    private boolean matchesExcludePattern(Path path, List<String> patterns) {
        String pathStr = path.toString();
        return patterns.stream().anyMatch(pathStr::contains);
    }

    private AstNode translate(Node node, int sourceLength) {
        Span span = spanOf(node, sourceLength);
        Token token = node.getToken();

        BinaryOperator binary = BINARY_TOKENS.get(token);
        if (binary != null) {
            return new BinaryExpression(binary,
                    translate(node.getFirstChild(), sourceLength),
                    translate(node.getLastChild(), sourceLength),
                    span);
        }

        UnaryOperator unary = UNARY_TOKENS.get(token);
        if (unary != null) {
            return new UnaryExpression(unary, translate(node.getFirstChild(), sourceLength), span);
        }

        List<AstNode> children = new ArrayList<>();
        for (Node child : node.children()) {
            children.add(translate(child, sourceLength));
        }
        return new OtherNode(token.name(), span, children);
    }

    private Span spanOf(Node node, int sourceLength) {
        int start = node.getSourceOffset();
        if (start < 0) {
            // synthetic node without position
            return Span.EMPTY;
        }
        int end = Math.min(start + Math.max(node.getLength(), 0), sourceLength);
        return new Span(Math.min(start, end), end);
    }
}
