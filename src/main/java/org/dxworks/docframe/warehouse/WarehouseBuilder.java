package org.dxworks.docframe.warehouse;

import org.dxworks.docframe.token.Container;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.token.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link Warehouse} in one forward pass over the token sequence. Parent links, pairs,
 * the ignore mask, sections and the by-type index are all maintained during the same walk.
 */
public class WarehouseBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(WarehouseBuilder.class);

    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;
    private static final int MAX_HEADING_LEVEL = 6;

    private final int maxNestingDepth;

    public WarehouseBuilder(int maxNestingDepth) {
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
        this.maxNestingDepth = maxNestingDepth;
    }

    public static WarehouseBuilder withDefaults() {
        return new WarehouseBuilder(DEFAULT_MAX_NESTING_DEPTH);
    }

    public Warehouse build(List<Token> tokens) {
        return build(tokens, null);
    }

    /**
     * @param parentHint optional parent indices computed elsewhere ({@code -1} for document level);
     *                   only compared against the computed parents, never trusted
     */
    public Warehouse build(List<Token> tokens, int[] parentHint) {
        if (tokens == null) {
            throw new IllegalArgumentException("tokens must not be null");
        }
        Pass pass = new Pass(tokens);
        for (int i = 0; i < tokens.size(); i++) {
            pass.visit(i);
        }
        Warehouse warehouse = pass.finish();
        if (parentHint != null) {
            compareParents(warehouse, parentHint);
        }
        return warehouse;
    }

    private void compareParents(Warehouse warehouse, int[] parentHint) {
        int disagreements = 0;
        int limit = Math.min(parentHint.length, warehouse.size());
        for (int i = 0; i < limit; i++) {
            int computed = warehouse.parent(i).orElse(Warehouse.ROOT);
            if (computed != parentHint[i]) {
                disagreements++;
                LOGGER.debug("Parent hint disagrees at token {}: hint={}, computed={}", i, parentHint[i], computed);
            }
        }
        if (parentHint.length != warehouse.size()) {
            LOGGER.debug("Parent hint covers {} tokens, sequence has {}", parentHint.length, warehouse.size());
        }
        if (disagreements > 0) {
            LOGGER.debug("Parent hint ignored, {} disagreements", disagreements);
        }
    }

    private final class Pass {
        private final List<Token> tokens;
        private final int n;
        private final Map<TokenKind, List<Integer>> byType = new EnumMap<>(TokenKind.class);
        private final int[] parents;
        private final Pair[] pairsByOpen;
        private final List<Pair> pairs = new ArrayList<>();
        private final BitSet ignored = new BitSet();
        private final List<StructuralWarning> warnings = new ArrayList<>();

        private final Deque<Integer> openStack = new ArrayDeque<>();
        private final Map<Container, Deque<Integer>> kindStacks = new EnumMap<>(Container.class);
        private int rawDepth;

        private final List<SectionDraft> sections = new ArrayList<>();
        private final Deque<SectionDraft> headingStack = new ArrayDeque<>();
        private SectionDraft titleTarget;

        Pass(List<Token> tokens) {
            this.tokens = tokens;
            this.n = tokens.size();
            this.parents = new int[n];
            this.pairsByOpen = new Pair[n];
            for (Container container : Container.values()) {
                kindStacks.put(container, new ArrayDeque<>());
            }
        }

        void visit(int i) {
            Token token = tokens.get(i);
            validate(i, token);
            byType.computeIfAbsent(token.getKind(), k -> new ArrayList<>()).add(i);

            TokenKind kind = token.getKind();
            if (kind.isOpen()) {
                visitOpen(i, token);
            } else if (kind.isClose()) {
                visitClose(i, token);
            } else {
                parents[i] = top();
                if (rawDepth > 0) {
                    ignored.set(i);
                }
            }

            if (titleTarget != null && kind.isTextual() && token.getContent() != null) {
                titleTarget.title.append(token.getContent());
            }
        }

        private void validate(int i, Token token) {
            if (token == null) {
                throw new BuilderInvariantViolation(i, "null token");
            }
            if (token.getIndex() != i) {
                throw new BuilderInvariantViolation(i, "token index " + token.getIndex() + " does not match its position");
            }
            if (token.getDepth() < 0) {
                throw new BuilderInvariantViolation(i, "negative depth " + token.getDepth());
            }
            if (token.getKind() == TokenKind.HEADING_OPEN) {
                Integer level = token.attrInt("level");
                if (level == null || level < 1 || level > MAX_HEADING_LEVEL) {
                    throw new BuilderInvariantViolation(i, "invalid heading level " + token.attr("level"));
                }
            }
        }

        private void visitOpen(int i, Token token) {
            Container container = token.getKind().getContainer();
            parents[i] = top();
            if (rawDepth > 0) {
                ignored.set(i);
                if (container.isRaw()) {
                    warn(i, container.getLabel() + " opened inside another raw span");
                }
            }
            openStack.push(i);
            kindStacks.get(container).push(i);
            if (openStack.size() > maxNestingDepth) {
                throw new BuilderInvariantViolation(i, "nesting depth exceeds " + maxNestingDepth);
            }
            if (container.isRaw()) {
                rawDepth++;
            }
            if (container == Container.HEADING) {
                startSection(i, token.attrInt("level"));
            }
        }

        private void visitClose(int i, Token token) {
            Container container = token.getKind().getContainer();
            Deque<Integer> kindStack = kindStacks.get(container);
            if (kindStack.isEmpty()) {
                parents[i] = top();
                if (rawDepth > 0) {
                    ignored.set(i);
                }
                warn(i, "unmatched " + container.getLabel() + " close ignored");
                return;
            }

            int openIndex = kindStack.peek();
            while (openStack.peek() != openIndex) {
                int crossed = openStack.pop();
                Container crossedKind = tokens.get(crossed).getKind().getContainer();
                kindStacks.get(crossedKind).pop();
                addPair(crossed, i, crossedKind, true);
                warn(crossed, crossedKind.getLabel() + " closed implicitly by " + container.getLabel() + " close at " + i);
            }
            openStack.pop();
            kindStack.pop();
            parents[i] = openIndex;
            addPair(openIndex, i, container, false);
            if (rawDepth > 0) {
                ignored.set(i);
            }
        }

        private void addPair(int openIndex, int closeIndex, Container kind, boolean synthesized) {
            Pair pair = new Pair(openIndex, closeIndex, kind, synthesized);
            pairsByOpen[openIndex] = pair;
            pairs.add(pair);
            if (kind.isRaw()) {
                rawDepth--;
            }
            if (titleTarget != null && titleTarget.headingIndex == openIndex) {
                titleTarget = null;
            }
        }

        private void startSection(int i, int level) {
            if (sections.isEmpty() && i > 0) {
                SectionDraft preamble = new SectionDraft(0, -1, 0, 0, Section.NO_PARENT);
                preamble.endIndex = i - 1;
                preamble.scopeEndIndex = i - 1;
                sections.add(preamble);
            }
            if (!sections.isEmpty()) {
                sections.get(sections.size() - 1).endIndex = i - 1;
            }
            while (!headingStack.isEmpty() && headingStack.peek().level >= level) {
                headingStack.pop().scopeEndIndex = i - 1;
            }
            int parent = headingStack.isEmpty() ? Section.NO_PARENT : headingStack.peek().ordinal;
            SectionDraft section = new SectionDraft(sections.size(), i, i, level, parent);
            sections.add(section);
            headingStack.push(section);
            titleTarget = section;
        }

        private int top() {
            return openStack.isEmpty() ? Warehouse.ROOT : openStack.peek();
        }

        private void warn(int index, String message) {
            warnings.add(new StructuralWarning(index, message));
        }

        Warehouse finish() {
            int last = n - 1;
            while (!openStack.isEmpty()) {
                int open = openStack.pop();
                Container container = tokens.get(open).getKind().getContainer();
                kindStacks.get(container).pop();
                addPair(open, last, container, true);
                warn(open, "unclosed " + container.getLabel() + " closed at end of document");
            }
            pairs.sort(Comparator.comparingInt(Pair::getOpenIndex));

            if (!sections.isEmpty()) {
                sections.get(sections.size() - 1).endIndex = last;
            }
            while (!headingStack.isEmpty()) {
                headingStack.pop().scopeEndIndex = last;
            }
            List<Section> built = new ArrayList<>(sections.size());
            for (SectionDraft draft : sections) {
                built.add(draft.toSection());
            }

            Map<TokenKind, List<Integer>> frozen = new EnumMap<>(TokenKind.class);
            byType.forEach((kind, indices) -> frozen.put(kind, Collections.unmodifiableList(indices)));

            if (!warnings.isEmpty()) {
                LOGGER.debug("Warehouse built with {} structural warnings", warnings.size());
            }
            return new Warehouse(tokens, frozen, parents, pairsByOpen, pairs, built, ignored, warnings);
        }
    }

    private static final class SectionDraft {
        final int ordinal;
        final int headingIndex;
        final int startIndex;
        final int level;
        final int parentOrdinal;
        final StringBuilder title = new StringBuilder();
        int endIndex;
        int scopeEndIndex;

        SectionDraft(int ordinal, int headingIndex, int startIndex, int level, int parentOrdinal) {
            this.ordinal = ordinal;
            this.headingIndex = headingIndex;
            this.startIndex = startIndex;
            this.level = level;
            this.parentOrdinal = parentOrdinal;
        }

        Section toSection() {
            String text = headingIndex < 0 ? null : title.toString().trim();
            return new Section(ordinal, headingIndex, startIndex, endIndex, level, parentOrdinal, scopeEndIndex, text);
        }
    }
}
