package org.dxworks.docframe.collector.category;

import org.dxworks.docframe.collector.Collector;
import org.dxworks.docframe.model.Categories;
import org.dxworks.docframe.model.LinkEntry;
import org.dxworks.docframe.text.UrlClassifier;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.token.TokenKind;
import org.dxworks.docframe.warehouse.Warehouse;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public class LinksCollector implements Collector {

    private final UrlClassifier classifier;
    private final List<LinkEntry> links = new ArrayList<>();

    public LinksCollector(UrlClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public String name() {
        return Categories.LINKS;
    }

    @Override
    public Set<TokenKind> interest() {
        return Set.of(TokenKind.LINK_OPEN);
    }

    @Override
    public boolean shouldProcess(Token token, Warehouse warehouse) {
        return !warehouse.isIgnored(token.getIndex());
    }

    @Override
    public void onToken(Token token, Warehouse warehouse) {
        String url = token.attrString("href") == null ? "" : token.attrString("href");
        LinkEntry link = new LinkEntry();
        link.id = "link_" + links.size();
        link.text = warehouse.textOf(token.getIndex());
        link.url = url;
        link.title = token.attrString("title");
        link.line = token.getLine();
        link.type = UrlClassifier.linkType(url);
        link.scheme = UrlClassifier.scheme(url);
        link.allowed = classifier.isAllowed(url);
        link.sectionId = warehouse.sectionIdOf(token.getIndex());
        links.add(link);
    }

    @Override
    public Object finish(Warehouse warehouse) {
        return links;
    }
}
