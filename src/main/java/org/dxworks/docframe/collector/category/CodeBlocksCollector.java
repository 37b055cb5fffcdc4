package org.dxworks.docframe.collector.category;

import org.dxworks.docframe.collector.Collector;
import org.dxworks.docframe.model.Categories;
import org.dxworks.docframe.model.CodeBlockEntry;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.token.TokenKind;
import org.dxworks.docframe.warehouse.Warehouse;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public class CodeBlocksCollector implements Collector {

    private final List<CodeBlockEntry> blocks = new ArrayList<>();

    @Override
    public String name() {
        return Categories.CODE_BLOCKS;
    }

    @Override
    public Set<TokenKind> interest() {
        return Set.of(TokenKind.FENCE_OPEN, TokenKind.CODE_BLOCK_OPEN);
    }

    @Override
    public boolean shouldProcess(Token token, Warehouse warehouse) {
        return !warehouse.isIgnored(token.getIndex());
    }

    @Override
    public void onToken(Token token, Warehouse warehouse) {
        CodeBlockEntry block = new CodeBlockEntry();
        block.id = "code_" + blocks.size();
        boolean fenced = token.getKind() == TokenKind.FENCE_OPEN;
        block.type = fenced ? "fenced" : "indented";
        block.language = fenced ? language(token.attrString("info")) : null;
        block.content = warehouse.textOf(token.getIndex());
        block.startLine = token.getLine();
        block.endLine = token.getEndLine();
        block.sectionId = warehouse.sectionIdOf(token.getIndex());
        blocks.add(block);
    }

    /** First word of the info string, {@code null} when absent. */
    public static String language(String info) {
        if (info == null || info.isBlank()) {
            return null;
        }
        return info.trim().split("\\s+", 2)[0];
    }

    @Override
    public Object finish(Warehouse warehouse) {
        return blocks;
    }
}
