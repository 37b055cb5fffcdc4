package org.dxworks.docframe.warehouse;

import org.dxworks.docframe.token.Container;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.token.TokenKind;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Read-only structural index over one token sequence. Built once by {@link WarehouseBuilder};
 * every query answers from the precomputed indices without re-scanning the document.
 */
public final class Warehouse {

    static final int ROOT = -1;

    private final List<Token> tokens;
    private final Map<TokenKind, List<Integer>> byType;
    private final int[] parents;
    private final Pair[] pairsByOpen;
    private final List<Pair> pairs;
    private final List<Section> sections;
    private final int[] sectionStarts;
    private final BitSet ignored;
    private final List<StructuralWarning> warnings;

    Warehouse(List<Token> tokens, Map<TokenKind, List<Integer>> byType, int[] parents,
              Pair[] pairsByOpen, List<Pair> pairs, List<Section> sections,
              BitSet ignored, List<StructuralWarning> warnings) {
        this.tokens = tokens;
        this.byType = byType;
        this.parents = parents;
        this.pairsByOpen = pairsByOpen;
        this.pairs = Collections.unmodifiableList(pairs);
        this.sections = Collections.unmodifiableList(sections);
        this.sectionStarts = new int[sections.size()];
        for (int s = 0; s < sections.size(); s++) {
            sectionStarts[s] = sections.get(s).getStartIndex();
        }
        this.ignored = ignored;
        this.warnings = Collections.unmodifiableList(warnings);
    }

    public List<Token> tokens() {
        return tokens;
    }

    public int size() {
        return tokens.size();
    }

    public Token token(int index) {
        Objects.checkIndex(index, tokens.size());
        return tokens.get(index);
    }

    /** Indices of every token of the given kind, in document order. */
    public List<Integer> byType(TokenKind kind) {
        return byType.getOrDefault(kind, List.of());
    }

    /** Nearest enclosing open marker, empty at document level. */
    public OptionalInt parent(int index) {
        Objects.checkIndex(index, tokens.size());
        int parent = parents[index];
        return parent == ROOT ? OptionalInt.empty() : OptionalInt.of(parent);
    }

    public Optional<Pair> rangeFor(int openIndex) {
        Objects.checkIndex(openIndex, tokens.size());
        return Optional.ofNullable(pairsByOpen[openIndex]);
    }

    /** All pairs ordered by open index. */
    public List<Pair> pairs() {
        return pairs;
    }

    public List<Section> sections() {
        return sections;
    }

    public Optional<Section> sectionOf(int index) {
        Objects.checkIndex(index, tokens.size());
        int pos = sectionPosition(index);
        return pos < 0 ? Optional.empty() : Optional.of(sections.get(pos));
    }

    /** Identifier of the owning section or {@code null} when the document has no sections. */
    public String sectionIdOf(int index) {
        Objects.checkIndex(index, tokens.size());
        int pos = sectionPosition(index);
        return pos < 0 ? null : sections.get(pos).getId();
    }

    // Rightmost section whose start is <= index
    private int sectionPosition(int index) {
        int lo = 0;
        int hi = sectionStarts.length - 1;
        int found = -1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (sectionStarts[mid] <= index) {
                found = mid;
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        if (found >= 0 && !sections.get(found).contains(index)) {
            return -1;
        }
        return found;
    }

    Optional<Section> sectionOfLinear(int index) {
        for (Section section : sections) {
            if (section.contains(index)) {
                return Optional.of(section);
            }
        }
        return Optional.empty();
    }

    public boolean isIgnored(int index) {
        Objects.checkIndex(index, tokens.size());
        return ignored.get(index);
    }

    /**
     * Visible text strictly inside the pair opened at {@code openIndex}. A text leaf yields its
     * own content; anything else yields an empty string.
     */
    public String textOf(int openIndex) {
        Token token = token(openIndex);
        if (token.getKind().isTextual()) {
            return token.getContent() == null ? "" : token.getContent();
        }
        Pair pair = pairsByOpen[openIndex];
        if (pair == null) {
            return "";
        }
        StringBuilder text = new StringBuilder();
        for (int i = pair.getOpenIndex() + 1; i < pair.getCloseIndex(); i++) {
            Token inner = tokens.get(i);
            if (inner.getKind().isTextual() && inner.getContent() != null) {
                text.append(inner.getContent());
            }
        }
        return text.toString();
    }

    /** Nearest ancestor open marker whose container is one of {@code containers}. */
    public OptionalInt enclosing(int index, Set<Container> containers) {
        Objects.checkIndex(index, tokens.size());
        for (int p = parents[index]; p != ROOT; p = parents[p]) {
            if (containers.contains(tokens.get(p).getKind().getContainer())) {
                return OptionalInt.of(p);
            }
        }
        return OptionalInt.empty();
    }

    public OptionalInt enclosing(int index, Container container) {
        return enclosing(index, Set.of(container));
    }

    /** Farthest ancestor open marker of the given container. */
    public OptionalInt outermost(int index, Container container) {
        Objects.checkIndex(index, tokens.size());
        int found = ROOT;
        for (int p = parents[index]; p != ROOT; p = parents[p]) {
            if (tokens.get(p).getKind().getContainer() == container) {
                found = p;
            }
        }
        return found == ROOT ? OptionalInt.empty() : OptionalInt.of(found);
    }

    /** Direct children of an open marker, excluding its own close marker. */
    public List<Integer> children(int openIndex) {
        Pair pair = rangeFor(openIndex).orElse(null);
        if (pair == null) {
            return List.of();
        }
        List<Integer> children = new ArrayList<>();
        for (int i = pair.getOpenIndex() + 1; i < pair.getCloseIndex(); i++) {
            if (parents[i] == openIndex) {
                children.add(i);
                Pair nested = pairsByOpen[i];
                if (nested != null && nested.getCloseIndex() > i) {
                    i = nested.getCloseIndex();
                }
            }
        }
        return children;
    }

    public List<StructuralWarning> warnings() {
        return warnings;
    }

    public List<SectionOutline> outline() {
        List<SectionOutline> outline = new ArrayList<>(sections.size());
        for (Section section : sections) {
            outline.add(new SectionOutline(section.getLevel(), section.getStartIndex(),
                    section.getEndIndex(), section.getTitle()));
        }
        return outline;
    }

    public String debugDumpSections() {
        StringBuilder dump = new StringBuilder();
        for (Section section : sections) {
            dump.append(String.format("[%02d] L%d %4d-%4d | '%s'\n",
                    section.getOrdinal(), section.getLevel(), section.getStartIndex(),
                    section.getEndIndex(), section.getTitle() == null ? "" : section.getTitle()));
        }
        return dump.toString();
    }
}
