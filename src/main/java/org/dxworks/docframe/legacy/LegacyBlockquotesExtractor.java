package org.dxworks.docframe.legacy;

import org.dxworks.docframe.model.BlockRef;
import org.dxworks.docframe.model.BlockquoteEntry;
import org.dxworks.docframe.model.Categories;
import org.dxworks.docframe.token.Container;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.token.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

class LegacyBlockquotesExtractor implements LegacyExtractor {

    private static final Set<Container> BLOCKQUOTE = Set.of(Container.BLOCKQUOTE);

    @Override
    public String category() {
        return Categories.BLOCKQUOTES;
    }

    @Override
    public Object extract(List<Token> tokens) {
        List<Integer> sectionStarts = LegacyTokenScans.sectionStarts(tokens);
        List<BlockquoteEntry> blockquotes = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.getKind() != TokenKind.BLOCKQUOTE_OPEN
                    || LegacyTokenScans.insideRaw(tokens, i)
                    || LegacyTokenScans.hasAncestor(tokens, i, BLOCKQUOTE)) {
                continue;
            }
            int close = LegacyTokenScans.matchingClose(tokens, i);
            BlockquoteEntry quote = new BlockquoteEntry();
            quote.content = LegacyTokenScans.textBetween(tokens, i, close).trim();
            quote.startLine = token.getLine();
            quote.endLine = token.getEndLine();
            quote.sectionId = LegacyTokenScans.sectionIdAt(sectionStarts, i);
            for (int j = i + 1; j < close; j++) {
                TokenKind kind = tokens.get(j).getKind();
                if (kind == TokenKind.BULLET_LIST_OPEN || kind == TokenKind.ORDERED_LIST_OPEN) {
                    quote.childrenSummary.lists++;
                } else if (kind == TokenKind.TABLE_OPEN) {
                    quote.childrenSummary.tables++;
                } else if (kind == TokenKind.FENCE_OPEN || kind == TokenKind.CODE_BLOCK_OPEN) {
                    quote.childrenSummary.code++;
                }
            }
            for (int child : LegacyTokenScans.directChildren(tokens, i)) {
                Token childToken = tokens.get(child);
                String type = BlockRef.typeOf(childToken.getKind().getContainer());
                if (type != null && childToken.getKind().isOpen()) {
                    quote.childrenBlocks.add(new BlockRef(type, childToken.getLine(), childToken.getEndLine()));
                }
            }
            blockquotes.add(quote);
        }
        return blockquotes;
    }
}
