package org.dxworks.docframe.model;

public class LinkEntry {
    public String id;
    public String text;
    public String url;
    public String title;
    public Integer line;
    public String type; // anchor, internal, external, email, phone, file, custom
    public String scheme;
    public boolean allowed;
    public String sectionId;
}
