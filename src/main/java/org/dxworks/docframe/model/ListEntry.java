package org.dxworks.docframe.model;

import java.util.ArrayList;
import java.util.List;

public class ListEntry {
    public String id;
    public String type; // bullet or ordered
    public Integer startLine;
    public Integer endLine;
    public String sectionId;
    public List<ListItemEntry> items = new ArrayList<>();
    public int itemsCount;
    public int taskItemsCount;
    public boolean hasMixedTaskItems;

    /** Fills the derived counters from {@link #items}. */
    public ListEntry summarize() {
        itemsCount = items.size();
        int tasks = 0;
        for (ListItemEntry item : items) {
            if (item.checked != null) {
                tasks++;
            }
        }
        taskItemsCount = tasks;
        hasMixedTaskItems = tasks > 0 && tasks < items.size();
        return this;
    }
}
