package org.dxworks.docframe.model;

public class ImageEntry {
    public String imageId;
    public String src;
    public String alt;
    public String title;
    public Integer line;
    public String imageKind; // data, external, local
    public String format;
    public boolean hasAlt;
    public boolean hasTitle;
    public String scheme;
    public boolean allowed;
    public String sectionId;
}
