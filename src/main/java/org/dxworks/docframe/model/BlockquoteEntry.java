package org.dxworks.docframe.model;

import java.util.ArrayList;
import java.util.List;

public class BlockquoteEntry {
    public String content;
    public Integer startLine;
    public Integer endLine;
    public String sectionId;
    public ChildrenSummary childrenSummary = new ChildrenSummary();
    public List<BlockRef> childrenBlocks = new ArrayList<>();
}
