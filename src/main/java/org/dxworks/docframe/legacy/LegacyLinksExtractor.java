package org.dxworks.docframe.legacy;

import org.dxworks.docframe.model.Categories;
import org.dxworks.docframe.model.LinkEntry;
import org.dxworks.docframe.text.UrlClassifier;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.token.TokenKind;

import java.util.ArrayList;
import java.util.List;

class LegacyLinksExtractor implements LegacyExtractor {

    private final UrlClassifier classifier;

    LegacyLinksExtractor(UrlClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public String category() {
        return Categories.LINKS;
    }

    @Override
    public Object extract(List<Token> tokens) {
        List<Integer> sectionStarts = LegacyTokenScans.sectionStarts(tokens);
        List<LinkEntry> links = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.getKind() != TokenKind.LINK_OPEN || LegacyTokenScans.insideRaw(tokens, i)) {
                continue;
            }
            String url = token.attrString("href") == null ? "" : token.attrString("href");
            LinkEntry link = new LinkEntry();
            link.id = "link_" + links.size();
            link.text = LegacyTokenScans.textOf(tokens, i);
            link.url = url;
            link.title = token.attrString("title");
            link.line = token.getLine();
            link.type = UrlClassifier.linkType(url);
            link.scheme = UrlClassifier.scheme(url);
            link.allowed = classifier.isAllowed(url);
            link.sectionId = LegacyTokenScans.sectionIdAt(sectionStarts, i);
            links.add(link);
        }
        return links;
    }
}
