package org.dxworks.docframe.legacy;

import org.dxworks.docframe.collector.category.CodeBlocksCollector;
import org.dxworks.docframe.model.Categories;
import org.dxworks.docframe.model.CodeBlockEntry;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.token.TokenKind;

import java.util.ArrayList;
import java.util.List;

class LegacyCodeBlocksExtractor implements LegacyExtractor {

    @Override
    public String category() {
        return Categories.CODE_BLOCKS;
    }

    @Override
    public Object extract(List<Token> tokens) {
        List<Integer> sectionStarts = LegacyTokenScans.sectionStarts(tokens);
        List<CodeBlockEntry> blocks = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            boolean fenced = token.getKind() == TokenKind.FENCE_OPEN;
            if ((!fenced && token.getKind() != TokenKind.CODE_BLOCK_OPEN) || LegacyTokenScans.insideRaw(tokens, i)) {
                continue;
            }
            CodeBlockEntry block = new CodeBlockEntry();
            block.id = "code_" + blocks.size();
            block.type = fenced ? "fenced" : "indented";
            block.language = fenced ? CodeBlocksCollector.language(token.attrString("info")) : null;
            block.content = LegacyTokenScans.textOf(tokens, i);
            block.startLine = token.getLine();
            block.endLine = token.getEndLine();
            block.sectionId = LegacyTokenScans.sectionIdAt(sectionStarts, i);
            blocks.add(block);
        }
        return blocks;
    }
}
