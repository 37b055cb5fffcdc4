package org.dxworks.docframe.legacy;

import org.dxworks.docframe.model.Categories;
import org.dxworks.docframe.model.ImageEntry;
import org.dxworks.docframe.text.ImageIds;
import org.dxworks.docframe.text.UrlClassifier;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.token.TokenKind;

import java.util.ArrayList;
import java.util.List;

class LegacyImagesExtractor implements LegacyExtractor {

    private final UrlClassifier classifier;

    LegacyImagesExtractor(UrlClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public String category() {
        return Categories.IMAGES;
    }

    @Override
    public Object extract(List<Token> tokens) {
        List<Integer> sectionStarts = LegacyTokenScans.sectionStarts(tokens);
        List<ImageEntry> images = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.getKind() != TokenKind.IMAGE_OPEN || LegacyTokenScans.insideRaw(tokens, i)) {
                continue;
            }
            String src = token.attrString("src") == null ? "" : token.attrString("src");
            String imageId = ImageIds.of(src, token.getLine());
            boolean duplicate = false;
            for (ImageEntry existing : images) {
                if (existing.imageId.equals(imageId)) {
                    duplicate = true;
                    break;
                }
            }
            if (duplicate) {
                continue;
            }
            ImageEntry image = new ImageEntry();
            image.imageId = imageId;
            image.src = src;
            image.alt = LegacyTokenScans.textOf(tokens, i);
            image.title = token.attrString("title");
            image.line = token.getLine();
            image.imageKind = UrlClassifier.imageKind(src);
            image.format = UrlClassifier.imageFormat(src);
            image.hasAlt = !image.alt.isBlank();
            image.hasTitle = image.title != null && !image.title.isEmpty();
            image.scheme = UrlClassifier.scheme(src);
            image.allowed = classifier.isAllowed(src);
            image.sectionId = LegacyTokenScans.sectionIdAt(sectionStarts, i);
            images.add(image);
        }
        return images;
    }
}
