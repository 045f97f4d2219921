package com.vidnyan.eqlint.domain.ast;

import com.vidnyan.eqlint.domain.model.Location;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A parsed source file: its text and the root of its syntax tree.
 */
@Getter
public final class SourceUnit {

    private final String path;
    private final String source;
    private final AstNode root;
    @Getter(AccessLevel.NONE)
    private final int[] lineStarts;

    public SourceUnit(String path, String source, AstNode root) {
        this.path = Objects.requireNonNull(path, "path");
        this.source = Objects.requireNonNull(source, "source");
        this.root = Objects.requireNonNull(root, "root");
        this.lineStarts = computeLineStarts(source);
    }

    /**
     * 1-based line/column location of a span.
     */
    public Location locate(Span span) {
        int startLine = lineIndex(span.start());
        int endLine = lineIndex(span.end());
        return new Location(
                path,
                startLine + 1,
                span.start() - lineStarts[startLine] + 1,
                endLine + 1,
                span.end() - lineStarts[endLine] + 1
        );
    }

    private int lineIndex(int offset) {
        int low = 0;
        int high = lineStarts.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low;
    }

    private static int[] computeLineStarts(String source) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '\r' && i + 1 < source.length() && source.charAt(i + 1) == '\n') {
                i++;
                starts.add(i + 1);
            } else if (c == '\n' || c == '\r') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }
}
