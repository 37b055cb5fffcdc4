package org.dxworks.docframe.warehouse;

public final class SectionOutline {

    private final int level;
    private final int startIndex;
    private final int endIndex;
    private final String headingText;

    public SectionOutline(int level, int startIndex, int endIndex, String headingText) {
        this.level = level;
        this.startIndex = startIndex;
        this.endIndex = endIndex;
        this.headingText = headingText;
    }

    public int getLevel() {
        return level;
    }

    public int getStartIndex() {
        return startIndex;
    }

    public int getEndIndex() {
        return endIndex;
    }

    public String getHeadingText() {
        return headingText;
    }
}
