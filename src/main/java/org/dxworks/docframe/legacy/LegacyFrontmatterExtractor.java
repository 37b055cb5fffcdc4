package org.dxworks.docframe.legacy;

import org.dxworks.docframe.model.Categories;
import org.dxworks.docframe.model.Frontmatter;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.token.TokenKind;

import java.util.List;

class LegacyFrontmatterExtractor implements LegacyExtractor {

    @Override
    public String category() {
        return Categories.FRONTMATTER;
    }

    @Override
    public Object extract(List<Token> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.getKind() != TokenKind.FRONTMATTER_OPEN) {
                continue;
            }
            Frontmatter frontmatter = new Frontmatter();
            frontmatter.startLine = token.getLine();
            frontmatter.endLine = token.getEndLine();
            int close = LegacyTokenScans.matchingClose(tokens, i);
            for (int j = i + 1; j < close; j++) {
                Token entry = tokens.get(j);
                if (entry.getKind() == TokenKind.FRONTMATTER_ENTRY && entry.attrString("key") != null) {
                    frontmatter.put(entry.attrString("key"), entry.attrList("values"));
                }
            }
            return frontmatter;
        }
        return null;
    }

    @Override
    public Object emptyResult() {
        return null;
    }
}
