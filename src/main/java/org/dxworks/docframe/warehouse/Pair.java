package org.dxworks.docframe.warehouse;

import org.dxworks.docframe.token.Container;

/**
 * A matched open/close marker pair. Synthesized pairs were closed implicitly by the builder
 * because the input never closed them.
 */
public final class Pair {

    private final int openIndex;
    private final int closeIndex;
    private final Container kind;
    private final boolean synthesized;

    public Pair(int openIndex, int closeIndex, Container kind, boolean synthesized) {
        this.openIndex = openIndex;
        this.closeIndex = closeIndex;
        this.kind = kind;
        this.synthesized = synthesized;
    }

    public int getOpenIndex() {
        return openIndex;
    }

    public int getCloseIndex() {
        return closeIndex;
    }

    public Container getKind() {
        return kind;
    }

    public boolean isSynthesized() {
        return synthesized;
    }

    public boolean contains(int index) {
        return index > openIndex && index < closeIndex;
    }

    @Override
    public String toString() {
        return "Pair{" + openIndex + ".." + closeIndex + ", " + kind.getLabel() + (synthesized ? ", synthesized" : "") + "}";
    }
}
