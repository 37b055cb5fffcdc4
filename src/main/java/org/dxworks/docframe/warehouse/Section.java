package org.dxworks.docframe.warehouse;

/**
 * A heading-delimited token range. Sections are contiguous and ordered; {@link #getEndIndex()}
 * stops right before the next section heading while {@link #getScopeEndIndex()} extends over
 * every following heading of a deeper level.
 */
public final class Section {

    public static final int NO_PARENT = -1;

    private final int ordinal;
    private final int headingIndex;
    private final int startIndex;
    private final int endIndex;
    private final int level;
    private final int parentOrdinal;
    private final int scopeEndIndex;
    private final String title;

    public Section(int ordinal, int headingIndex, int startIndex, int endIndex, int level,
                   int parentOrdinal, int scopeEndIndex, String title) {
        this.ordinal = ordinal;
        this.headingIndex = headingIndex;
        this.startIndex = startIndex;
        this.endIndex = endIndex;
        this.level = level;
        this.parentOrdinal = parentOrdinal;
        this.scopeEndIndex = scopeEndIndex;
        this.title = title;
    }

    public int getOrdinal() {
        return ordinal;
    }

    public String getId() {
        return idOf(ordinal);
    }

    /** Index of the heading open marker, {@code -1} for the preamble. */
    public int getHeadingIndex() {
        return headingIndex;
    }

    public int getStartIndex() {
        return startIndex;
    }

    public int getEndIndex() {
        return endIndex;
    }

    /** Heading level 1-6, 0 for the preamble. */
    public int getLevel() {
        return level;
    }

    public int getParentOrdinal() {
        return parentOrdinal;
    }

    public int getScopeEndIndex() {
        return scopeEndIndex;
    }

    public String getTitle() {
        return title;
    }

    public boolean isPreamble() {
        return headingIndex < 0;
    }

    public boolean contains(int index) {
        return index >= startIndex && index <= endIndex;
    }

    public static String idOf(int ordinal) {
        return "section_" + ordinal;
    }

    @Override
    public String toString() {
        return "Section{" + getId() + ", L" + level + ", " + startIndex + ".." + endIndex + ", '" + title + "'}";
    }
}
