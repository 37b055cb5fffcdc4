package org.dxworks.docframe.model;

public class CodeBlockEntry {
    public String id;
    public String type; // fenced or indented
    public String language;
    public String content;
    public Integer startLine;
    public Integer endLine;
    public String sectionId;
}
