package org.dxworks.docframe.model;

import org.dxworks.docframe.token.Container;

public class BlockRef {
    public String type; // list, code_block, blockquote, table
    public Integer startLine;
    public Integer endLine;

    public BlockRef() {
    }

    public BlockRef(String type, Integer startLine, Integer endLine) {
        this.type = type;
        this.startLine = startLine;
        this.endLine = endLine;
    }

    /** Block type reported for a child container, {@code null} when it is not a reportable block. */
    public static String typeOf(Container container) {
        if (container == null) {
            return null;
        }
        return switch (container) {
            case FENCE, CODE_BLOCK -> "code_block";
            case BLOCKQUOTE -> "blockquote";
            case TABLE -> "table";
            case BULLET_LIST, ORDERED_LIST -> "list";
            default -> null;
        };
    }
}
