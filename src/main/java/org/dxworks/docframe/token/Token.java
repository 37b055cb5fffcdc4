package org.dxworks.docframe.token;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One element of the flattened document. Tokens are immutable and identified by their index
 * in the sequence they belong to. Lines are 0-based and inclusive; close markers carry none.
 */
public final class Token {

    private final int index;
    private final TokenKind kind;
    private final int depth;
    private final String content;
    private final Integer line;
    private final Integer endLine;
    private final Map<String, Object> attrs;

    public Token(int index, TokenKind kind, int depth, String content,
                 Integer line, Integer endLine, Map<String, Object> attrs) {
        this.index = index;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.depth = depth;
        this.content = content;
        this.line = line;
        this.endLine = endLine;
        if (attrs == null || attrs.isEmpty()) {
            this.attrs = Map.of();
        } else {
            Map<String, Object> copy = new LinkedHashMap<>();
            attrs.forEach((key, value) -> {
                if (value != null) {
                    copy.put(key, value);
                }
            });
            this.attrs = Collections.unmodifiableMap(copy);
        }
    }

    public static Token of(int index, TokenKind kind, int depth) {
        return new Token(index, kind, depth, null, null, null, null);
    }

    public static Token text(int index, int depth, String content) {
        return new Token(index, TokenKind.TEXT, depth, content, null, null, null);
    }

    public int getIndex() {
        return index;
    }

    public TokenKind getKind() {
        return kind;
    }

    public int getDepth() {
        return depth;
    }

    public String getContent() {
        return content;
    }

    public Integer getLine() {
        return line;
    }

    public Integer getEndLine() {
        return endLine;
    }

    public Map<String, Object> getAttrs() {
        return attrs;
    }

    public Object attr(String name) {
        return attrs.get(name);
    }

    public String attrString(String name) {
        Object value = attrs.get(name);
        return value == null ? null : value.toString();
    }

    public Integer attrInt(String name) {
        Object value = attrs.get(name);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public boolean attrBoolean(String name) {
        Object value = attrs.get(name);
        if (value instanceof Boolean flag) {
            return flag;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    public List<String> attrList(String name) {
        Object value = attrs.get(name);
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).collect(Collectors.toList());
        }
        return List.of();
    }

    public Token withIndex(int newIndex) {
        return new Token(newIndex, kind, depth, content, line, endLine, attrs);
    }

    public Token withLines(Integer newLine, Integer newEndLine) {
        return new Token(index, kind, depth, content, newLine, newEndLine, attrs);
    }

    public Token withAttr(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(attrs);
        copy.put(name, value);
        return new Token(index, kind, depth, content, line, endLine, copy);
    }

    public Token withContent(String newContent) {
        return new Token(index, kind, depth, newContent, line, endLine, attrs);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('#').append(index).append(' ').append(kind).append(" d=").append(depth);
        if (content != null) {
            sb.append(" '").append(content).append('\'');
        }
        if (!attrs.isEmpty()) {
            sb.append(' ').append(attrs);
        }
        return sb.toString();
    }
}
