package org.dxworks.docframe.model;

import java.util.ArrayList;
import java.util.List;

public class TableEntry {
    public String id;
    public List<String> headers = new ArrayList<>();
    public List<List<String>> rows = new ArrayList<>();
    public List<String> align = new ArrayList<>();
    public Integer startLine;
    public Integer endLine;
    public String sectionId;
    public int columnCount;
    public int rowCount;
    public boolean ragged;

    /**
     * Pads or truncates alignments to the header width and computes the derived counters.
     * Missing alignments default to {@code left}.
     */
    public TableEntry summarize() {
        columnCount = headers.size();
        List<String> normalized = new ArrayList<>(columnCount);
        for (int c = 0; c < columnCount; c++) {
            String value = c < align.size() ? align.get(c) : null;
            normalized.add(value == null ? "left" : value);
        }
        align = normalized;
        rowCount = rows.size();
        boolean uneven = false;
        for (List<String> row : rows) {
            if (row.size() != columnCount) {
                uneven = true;
                break;
            }
        }
        ragged = uneven;
        return this;
    }
}
