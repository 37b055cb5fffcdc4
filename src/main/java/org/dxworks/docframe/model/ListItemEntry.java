package org.dxworks.docframe.model;

import java.util.ArrayList;
import java.util.List;

public class ListItemEntry {
    public String text;
    public Boolean checked; // null for items without a task marker
    public List<ListItemEntry> children = new ArrayList<>();
    public List<BlockRef> blocks = new ArrayList<>();
}
