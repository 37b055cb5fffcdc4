package org.dxworks.docframe.collector.category;

import org.dxworks.docframe.collector.Collector;
import org.dxworks.docframe.model.Categories;
import org.dxworks.docframe.model.ParagraphEntry;
import org.dxworks.docframe.text.TextMetrics;
import org.dxworks.docframe.token.Container;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.token.TokenKind;
import org.dxworks.docframe.warehouse.Pair;
import org.dxworks.docframe.warehouse.Warehouse;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/** Free-standing paragraphs; paragraphs inside list items and blockquotes belong to those. */
public class ParagraphsCollector implements Collector {

    private static final Set<Container> OWNING_CONTAINERS = Set.of(Container.LIST_ITEM, Container.BLOCKQUOTE);

    private final List<ParagraphEntry> paragraphs = new ArrayList<>();

    @Override
    public String name() {
        return Categories.PARAGRAPHS;
    }

    @Override
    public Set<TokenKind> interest() {
        return Set.of(TokenKind.PARAGRAPH_OPEN);
    }

    @Override
    public boolean shouldProcess(Token token, Warehouse warehouse) {
        int index = token.getIndex();
        return !warehouse.isIgnored(index) && warehouse.enclosing(index, OWNING_CONTAINERS).isEmpty();
    }

    @Override
    public void onToken(Token token, Warehouse warehouse) {
        int index = token.getIndex();
        ParagraphEntry paragraph = new ParagraphEntry();
        paragraph.id = "para_" + paragraphs.size();
        paragraph.text = warehouse.textOf(index).trim();
        paragraph.startLine = token.getLine();
        paragraph.endLine = token.getEndLine();
        paragraph.sectionId = warehouse.sectionIdOf(index);
        paragraph.wordCount = TextMetrics.wordCount(paragraph.text);

        Pair pair = warehouse.rangeFor(index).orElse(null);
        if (pair != null) {
            for (int i = pair.getOpenIndex() + 1; i < pair.getCloseIndex(); i++) {
                TokenKind kind = warehouse.token(i).getKind();
                paragraph.hasLinks |= kind == TokenKind.LINK_OPEN;
                paragraph.hasEmphasis |= kind == TokenKind.EM_OPEN || kind == TokenKind.STRONG_OPEN;
                paragraph.hasCode |= kind == TokenKind.CODE_INLINE_OPEN;
            }
        }
        paragraphs.add(paragraph);
    }

    @Override
    public Object finish(Warehouse warehouse) {
        return paragraphs;
    }
}
