package org.dxworks.docframe.model;

public class ChildrenSummary {
    public int lists;
    public int tables;
    public int code;
}
