package org.dxworks.docframe.model;

public class SectionEntry {
    public String id;
    public int level; // 1-6, with 0 used for preamble
    public String title;
    public Integer headingIndex;
    public int startIndex;
    public int endIndex;
    public Integer line;
    public String parentId;
}
