package org.dxworks.docframe.legacy;

import org.dxworks.docframe.model.Categories;
import org.dxworks.docframe.model.ParagraphEntry;
import org.dxworks.docframe.text.TextMetrics;
import org.dxworks.docframe.token.Container;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.token.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

class LegacyParagraphsExtractor implements LegacyExtractor {

    private static final Set<Container> OWNING_CONTAINERS = Set.of(Container.LIST_ITEM, Container.BLOCKQUOTE);

    @Override
    public String category() {
        return Categories.PARAGRAPHS;
    }

    @Override
    public Object extract(List<Token> tokens) {
        List<Integer> sectionStarts = LegacyTokenScans.sectionStarts(tokens);
        List<ParagraphEntry> paragraphs = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.getKind() != TokenKind.PARAGRAPH_OPEN
                    || LegacyTokenScans.insideRaw(tokens, i)
                    || LegacyTokenScans.hasAncestor(tokens, i, OWNING_CONTAINERS)) {
                continue;
            }
            int close = LegacyTokenScans.matchingClose(tokens, i);
            ParagraphEntry paragraph = new ParagraphEntry();
            paragraph.id = "para_" + paragraphs.size();
            paragraph.text = LegacyTokenScans.textBetween(tokens, i, close).trim();
            paragraph.startLine = token.getLine();
            paragraph.endLine = token.getEndLine();
            paragraph.sectionId = LegacyTokenScans.sectionIdAt(sectionStarts, i);
            paragraph.wordCount = TextMetrics.wordCount(paragraph.text);
            for (int j = i + 1; j < close; j++) {
                TokenKind kind = tokens.get(j).getKind();
                if (kind == TokenKind.LINK_OPEN) {
                    paragraph.hasLinks = true;
                } else if (kind == TokenKind.EM_OPEN || kind == TokenKind.STRONG_OPEN) {
                    paragraph.hasEmphasis = true;
                } else if (kind == TokenKind.CODE_INLINE_OPEN) {
                    paragraph.hasCode = true;
                }
            }
            paragraphs.add(paragraph);
        }
        return paragraphs;
    }
}
