package org.dxworks.docframe.token;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TokenSequenceBuilderTest {

    @Test
    void closeSharesDepthOfOpen() {
        TokenSequenceBuilder seq = new TokenSequenceBuilder();
        seq.open(Container.BLOCKQUOTE);
        seq.open(Container.PARAGRAPH);
        seq.text("x");
        seq.close(Container.PARAGRAPH);
        seq.close(Container.BLOCKQUOTE);

        List<Token> tokens = seq.build();

        assertEquals(List.of(0, 1, 2, 1, 0), tokens.stream().map(Token::getDepth).collect(Collectors.toList()));
        assertEquals(TokenKind.PARAGRAPH_CLOSE, tokens.get(3).getKind());
        assertEquals(0, seq.depth());
    }

    @Test
    void leafRejectsContainerKinds() {
        TokenSequenceBuilder seq = new TokenSequenceBuilder();

        assertThrows(IllegalArgumentException.class, () -> seq.leaf(TokenKind.PARAGRAPH_OPEN));
        assertEquals(0, seq.size());
    }

    @Test
    void rawAppendsWithoutTrackingDepth() {
        TokenSequenceBuilder seq = new TokenSequenceBuilder();
        seq.raw(TokenKind.PARAGRAPH_CLOSE, 3);

        assertEquals(3, seq.build().get(0).getDepth());
        assertEquals(0, seq.depth());
    }

    @Test
    void builtListIsSnapshot() {
        TokenSequenceBuilder seq = new TokenSequenceBuilder();
        seq.text("a");
        List<Token> first = seq.build();
        seq.text("b");

        assertEquals(1, first.size());
        assertThrows(UnsupportedOperationException.class, () -> first.add(Token.text(1, 0, "c")));
    }

    @Test
    void tokenAttributesDropNullsAndConvert() {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("level", "3");
        attrs.put("title", null);
        attrs.put("checked", Boolean.TRUE);
        Token token = new Token(0, TokenKind.HEADING_OPEN, 0, null, 1, 1, attrs);

        assertEquals(3, token.attrInt("level"));
        assertFalse(token.getAttrs().containsKey("title"));
        assertTrue(token.attrBoolean("checked"));
        assertFalse(token.attrBoolean("missing"));
        assertNull(token.attrString("title"));
        assertTrue(token.attrList("values").isEmpty());
        assertEquals(5, token.withIndex(5).getIndex());
        assertEquals("x", token.withContent("x").getContent());
        assertEquals(9, token.withAttr("level", 9).attrInt("level"));
        assertEquals(3, token.attrInt("level"));
    }

    @Test
    void attrListConvertsElementsToStrings() {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("values", List.of(1, true, "three"));
        Token token = new Token(0, TokenKind.FRONTMATTER_ENTRY, 0, null, 0, 0, attrs);

        List<String> values = token.attrList("values");

        assertEquals(List.of("1", "true", "three"), values);
        assertTrue(token.withAttr("values", "scalar").attrList("values").isEmpty());
    }

    @Test
    void kindTableIsConsistent() {
        for (Container container : Container.values()) {
            TokenKind open = TokenKind.openOf(container);
            TokenKind close = TokenKind.closeOf(container);
            assertTrue(open.isOpen());
            assertTrue(close.isClose());
            assertEquals(container, open.getContainer());
            assertEquals(container, close.getContainer());
        }
        assertNull(TokenKind.TEXT.getContainer());
        assertEquals(Nesting.LEAF, TokenKind.TASK_MARKER.getNesting());
        assertTrue(TokenKind.SOFTBREAK.isTextual());
        assertFalse(TokenKind.HTML_INLINE.isTextual());
    }
}
