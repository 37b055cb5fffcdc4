package org.dxworks.docframe.collector.category;

import org.dxworks.docframe.collector.Collector;
import org.dxworks.docframe.model.BlockRef;
import org.dxworks.docframe.model.BlockquoteEntry;
import org.dxworks.docframe.model.Categories;
import org.dxworks.docframe.token.Container;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.token.TokenKind;
import org.dxworks.docframe.warehouse.Pair;
import org.dxworks.docframe.warehouse.Warehouse;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/** Outermost blockquotes; nested quotes show up in the children of their outer quote. */
public class BlockquotesCollector implements Collector {

    private final List<BlockquoteEntry> blockquotes = new ArrayList<>();

    @Override
    public String name() {
        return Categories.BLOCKQUOTES;
    }

    @Override
    public Set<TokenKind> interest() {
        return Set.of(TokenKind.BLOCKQUOTE_OPEN);
    }

    @Override
    public boolean shouldProcess(Token token, Warehouse warehouse) {
        int index = token.getIndex();
        return !warehouse.isIgnored(index) && warehouse.enclosing(index, Container.BLOCKQUOTE).isEmpty();
    }

    @Override
    public void onToken(Token token, Warehouse warehouse) {
        int index = token.getIndex();
        BlockquoteEntry quote = new BlockquoteEntry();
        quote.content = warehouse.textOf(index).trim();
        quote.startLine = token.getLine();
        quote.endLine = token.getEndLine();
        quote.sectionId = warehouse.sectionIdOf(index);

        Pair pair = warehouse.rangeFor(index).orElse(null);
        if (pair != null) {
            for (int i = pair.getOpenIndex() + 1; i < pair.getCloseIndex(); i++) {
                TokenKind kind = warehouse.token(i).getKind();
                if (kind == TokenKind.BULLET_LIST_OPEN || kind == TokenKind.ORDERED_LIST_OPEN) {
                    quote.childrenSummary.lists++;
                } else if (kind == TokenKind.TABLE_OPEN) {
                    quote.childrenSummary.tables++;
                } else if (kind == TokenKind.FENCE_OPEN || kind == TokenKind.CODE_BLOCK_OPEN) {
                    quote.childrenSummary.code++;
                }
            }
        }
        for (int child : warehouse.children(index)) {
            Token childToken = warehouse.token(child);
            String type = BlockRef.typeOf(childToken.getKind().getContainer());
            if (type != null && childToken.getKind().isOpen()) {
                quote.childrenBlocks.add(new BlockRef(type, childToken.getLine(), childToken.getEndLine()));
            }
        }
        blockquotes.add(quote);
    }

    @Override
    public Object finish(Warehouse warehouse) {
        return blockquotes;
    }
}
