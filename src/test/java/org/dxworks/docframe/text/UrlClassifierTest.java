package org.dxworks.docframe.text;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class UrlClassifierTest {

    private final UrlClassifier classifier = new UrlClassifier(Set.of("http", "https", "mailto"));

    @Test
    void linkTypes() {
        assertEquals("anchor", UrlClassifier.linkType("#usage"));
        assertEquals("external", UrlClassifier.linkType("https://example.com"));
        assertEquals("external", UrlClassifier.linkType("http://example.com"));
        assertEquals("email", UrlClassifier.linkType("mailto:a@b.c"));
        assertEquals("phone", UrlClassifier.linkType("tel:+40"));
        assertEquals("file", UrlClassifier.linkType("file:///etc/hosts"));
        assertEquals("custom", UrlClassifier.linkType("vscode://open"));
        assertEquals("malformed", UrlClassifier.linkType("1x://nope"));
        assertEquals("malformed", UrlClassifier.linkType("://nothing"));
        assertEquals("internal", UrlClassifier.linkType("docs/readme.md"));
        assertEquals("internal", UrlClassifier.linkType(""));
        assertEquals("internal", UrlClassifier.linkType(null));
    }

    @Test
    void schemeIsLowerCasedPrefix() {
        assertEquals("https", UrlClassifier.scheme("HTTPS://Example.com"));
        assertEquals("javascript", UrlClassifier.scheme("javascript:alert(1)"));
        assertNull(UrlClassifier.scheme("./local.md"));
        assertNull(UrlClassifier.scheme(null));
    }

    @Test
    void allowedSchemes() {
        assertTrue(classifier.isAllowed("https://example.com"));
        assertTrue(classifier.isAllowed("MAILTO:someone@example.com"));
        assertTrue(classifier.isAllowed("relative/path.png"));
        assertFalse(classifier.isAllowed("javascript:alert(1)"));
        assertFalse(classifier.isAllowed("tel:+40"));
        assertTrue(new UrlClassifier(Set.of("tel")).isAllowed("tel:+40"));
    }

    @Test
    void imageKinds() {
        assertEquals("data", UrlClassifier.imageKind("data:image/png;base64,AAAA"));
        assertEquals("external", UrlClassifier.imageKind("https://example.com/a.png"));
        assertEquals("local", UrlClassifier.imageKind("img/a.png"));
    }

    @Test
    void imageFormats() {
        assertEquals("png", UrlClassifier.imageFormat("data:image/png;base64,AAAA"));
        assertEquals("svg+xml", UrlClassifier.imageFormat("data:image/svg+xml,<svg/>"));
        assertEquals("plain", UrlClassifier.imageFormat("data:,hello"));
        assertEquals("jpg", UrlClassifier.imageFormat("https://example.com/photo.JPG?size=2#top"));
        assertEquals("gif", UrlClassifier.imageFormat("a.b/c.gif"));
        assertEquals("unknown", UrlClassifier.imageFormat("images/noextension"));
        assertEquals("unknown", UrlClassifier.imageFormat(".hidden"));
        assertEquals("unknown", UrlClassifier.imageFormat("data:broken"));
    }

    @Test
    void imageIdsDependOnSourceAndLine() {
        String id = ImageIds.of("a.png", 3);

        assertEquals(16, id.length());
        assertEquals(id, ImageIds.of("a.png", 3));
        assertFalse(id.equals(ImageIds.of("a.png", 4)));
        assertFalse(id.equals(ImageIds.of("b.png", 3)));
        assertEquals(ImageIds.of("a.png", -1), ImageIds.of("a.png", null));
    }
}
