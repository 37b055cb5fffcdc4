package org.dxworks.docframe.legacy;

import org.dxworks.docframe.token.Container;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.token.TokenKind;
import org.dxworks.docframe.warehouse.Section;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Linear scans over the raw token list. Every call walks the sequence again; nothing is cached.
 */
final class LegacyTokenScans {

    private static final Set<Container> RAW = Set.of(Container.FENCE, Container.CODE_BLOCK,
            Container.CODE_INLINE, Container.HTML_BLOCK);

    private LegacyTokenScans() {
    }

    static int matchingClose(List<Token> tokens, int open) {
        Container container = tokens.get(open).getKind().getContainer();
        TokenKind openKind = TokenKind.openOf(container);
        TokenKind closeKind = TokenKind.closeOf(container);
        int depth = 0;
        for (int j = open + 1; j < tokens.size(); j++) {
            TokenKind kind = tokens.get(j).getKind();
            if (kind == openKind) {
                depth++;
            } else if (kind == closeKind) {
                if (depth == 0) {
                    return j;
                }
                depth--;
            }
        }
        return tokens.size() - 1;
    }

    static String textBetween(List<Token> tokens, int open, int close) {
        StringBuilder text = new StringBuilder();
        for (int j = open + 1; j < close; j++) {
            Token token = tokens.get(j);
            if (token.getKind().isTextual() && token.getContent() != null) {
                text.append(token.getContent());
            }
        }
        return text.toString();
    }

    static String textOf(List<Token> tokens, int open) {
        return textBetween(tokens, open, matchingClose(tokens, open));
    }

    static List<Integer> directChildren(List<Token> tokens, int open) {
        int close = matchingClose(tokens, open);
        int childDepth = tokens.get(open).getDepth() + 1;
        List<Integer> children = new ArrayList<>();
        for (int j = open + 1; j < close; j++) {
            Token token = tokens.get(j);
            if (token.getDepth() == childDepth && !token.getKind().isClose()) {
                children.add(j);
            }
        }
        return children;
    }

    /** Nearest open marker enclosing {@code index} whose container is in the set, or -1. */
    static int nearestAncestor(List<Token> tokens, int index, Set<Container> containers) {
        int balance = 0;
        for (int j = index - 1; j >= 0; j--) {
            TokenKind kind = tokens.get(j).getKind();
            if (kind.isClose()) {
                balance++;
            } else if (kind.isOpen()) {
                if (balance == 0) {
                    if (containers.contains(kind.getContainer())) {
                        return j;
                    }
                } else {
                    balance--;
                }
            }
        }
        return -1;
    }

    static boolean hasAncestor(List<Token> tokens, int index, Set<Container> containers) {
        return nearestAncestor(tokens, index, containers) >= 0;
    }

    static boolean insideRaw(List<Token> tokens, int index) {
        return hasAncestor(tokens, index, RAW);
    }

    /** Start index of every section, a preamble included when text precedes the first heading. */
    static List<Integer> sectionStarts(List<Token> tokens) {
        List<Integer> starts = new ArrayList<>();
        for (int j = 0; j < tokens.size(); j++) {
            Token token = tokens.get(j);
            if (token.getKind() == TokenKind.HEADING_OPEN) {
                if (starts.isEmpty() && j > 0) {
                    starts.add(0);
                }
                starts.add(j);
            }
        }
        return starts;
    }

    static String sectionIdAt(List<Integer> starts, int index) {
        int found = -1;
        for (int k = 0; k < starts.size(); k++) {
            if (starts.get(k) <= index) {
                found = k;
            }
        }
        return found < 0 ? null : Section.idOf(found);
    }
}
