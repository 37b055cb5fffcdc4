package org.dxworks.docframe.model;

import java.util.ArrayList;
import java.util.List;

public class MathResult {
    public List<Block> blocks = new ArrayList<>();
    public List<Inline> inline = new ArrayList<>();

    public static class Block {
        public String id;
        public String kind; // display or fenced
        public String content;
        public Integer startLine;
        public Integer endLine;
    }

    public static class Inline {
        public String id;
        public String content;
        public Integer line;
    }
}
