package org.dxworks.docframe.model;

public class ParagraphEntry {
    public String id;
    public String text;
    public Integer startLine;
    public Integer endLine;
    public String sectionId;
    public int wordCount;
    public boolean hasLinks;
    public boolean hasEmphasis;
    public boolean hasCode;
}
