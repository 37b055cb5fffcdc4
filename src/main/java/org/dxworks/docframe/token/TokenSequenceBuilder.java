package org.dxworks.docframe.token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Appends tokens in document order, assigning indices and nesting depth.
 * Close markers are emitted at the depth of their open marker.
 */
public class TokenSequenceBuilder {

    private final List<Token> tokens = new ArrayList<>();
    private int depth;

    public int open(Container container) {
        return open(container, null, null, null);
    }

    public int open(Container container, Map<String, Object> attrs) {
        return open(container, null, null, attrs);
    }

    public int open(Container container, Integer line, Integer endLine, Map<String, Object> attrs) {
        int index = append(TokenKind.openOf(container), depth, null, line, endLine, attrs);
        depth++;
        return index;
    }

    public int close(Container container) {
        depth = Math.max(0, depth - 1);
        return append(TokenKind.closeOf(container), depth, null, null, null, null);
    }

    public int text(String content) {
        return leaf(TokenKind.TEXT, content, null, null, null);
    }

    public int leaf(TokenKind kind) {
        return leaf(kind, null, null, null, null);
    }

    public int leaf(TokenKind kind, String content, Integer line, Integer endLine, Map<String, Object> attrs) {
        if (kind.getNesting() != Nesting.LEAF) {
            throw new IllegalArgumentException("Not a leaf kind: " + kind);
        }
        return append(kind, depth, content, line, endLine, attrs);
    }

    /** Appends a token verbatim at the given depth without touching the tracked depth. */
    public int raw(TokenKind kind, int tokenDepth) {
        return append(kind, tokenDepth, null, null, null, null);
    }

    public int size() {
        return tokens.size();
    }

    public int depth() {
        return depth;
    }

    public List<Token> build() {
        return Collections.unmodifiableList(new ArrayList<>(tokens));
    }

    private int append(TokenKind kind, int tokenDepth, String content,
                       Integer line, Integer endLine, Map<String, Object> attrs) {
        int index = tokens.size();
        tokens.add(new Token(index, kind, tokenDepth, content, line, endLine, attrs));
        return index;
    }
}
