package org.dxworks.docframe.model;

public class TaskEntry {
    public String text;
    public boolean checked;
    public Integer line;
    public String sectionId;
}
