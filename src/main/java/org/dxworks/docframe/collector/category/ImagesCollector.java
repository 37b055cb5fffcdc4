package org.dxworks.docframe.collector.category;

import org.dxworks.docframe.collector.Collector;
import org.dxworks.docframe.model.Categories;
import org.dxworks.docframe.model.ImageEntry;
import org.dxworks.docframe.text.ImageIds;
import org.dxworks.docframe.text.UrlClassifier;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.token.TokenKind;
import org.dxworks.docframe.warehouse.Warehouse;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class ImagesCollector implements Collector {

    private final UrlClassifier classifier;
    private final List<ImageEntry> images = new ArrayList<>();
    private final Set<String> seenIds = new HashSet<>();

    public ImagesCollector(UrlClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public String name() {
        return Categories.IMAGES;
    }

    @Override
    public Set<TokenKind> interest() {
        return Set.of(TokenKind.IMAGE_OPEN);
    }

    @Override
    public boolean shouldProcess(Token token, Warehouse warehouse) {
        return !warehouse.isIgnored(token.getIndex());
    }

    @Override
    public void onToken(Token token, Warehouse warehouse) {
        String src = token.attrString("src") == null ? "" : token.attrString("src");
        String imageId = ImageIds.of(src, token.getLine());
        if (!seenIds.add(imageId)) {
            return;
        }
        ImageEntry image = new ImageEntry();
        image.imageId = imageId;
        image.src = src;
        image.alt = warehouse.textOf(token.getIndex());
        image.title = token.attrString("title");
        image.line = token.getLine();
        image.imageKind = UrlClassifier.imageKind(src);
        image.format = UrlClassifier.imageFormat(src);
        image.hasAlt = !image.alt.isBlank();
        image.hasTitle = image.title != null && !image.title.isEmpty();
        image.scheme = UrlClassifier.scheme(src);
        image.allowed = classifier.isAllowed(src);
        image.sectionId = warehouse.sectionIdOf(token.getIndex());
        images.add(image);
    }

    @Override
    public Object finish(Warehouse warehouse) {
        return images;
    }
}
