package org.dxworks.docframe.model;

public class HeadingEntry {
    public String id;
    public int level;
    public String text;
    public Integer line;
    public String slug;
    public String parentId; // id of the enclosing heading, null at top level
}
