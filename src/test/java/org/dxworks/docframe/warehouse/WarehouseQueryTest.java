package org.dxworks.docframe.warehouse;

import org.dxworks.docframe.TestUtils;
import org.dxworks.docframe.token.Container;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.token.TokenKind;
import org.dxworks.docframe.token.TokenSequenceBuilder;
import org.dxworks.docframe.tokenizer.CommonmarkTokenizer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class WarehouseQueryTest {

    private final WarehouseBuilder builder = WarehouseBuilder.withDefaults();
    private final CommonmarkTokenizer tokenizer = new CommonmarkTokenizer();

    private Warehouse sample(String name) {
        return builder.build(tokenizer.tokenize(TestUtils.readSample(name)));
    }

    @Test
    void sectionLookupAgreesWithLinearScan() {
        for (String name : TestUtils.sampleNames()) {
            Warehouse warehouse = sample(name);
            for (int i = 0; i < warehouse.size(); i++) {
                assertEquals(warehouse.sectionOfLinear(i), warehouse.sectionOf(i), name + " token " + i);
            }
        }
    }

    @Test
    void sectionIdOfNamesOwningSection() {
        Warehouse warehouse = sample("Basic.md");

        assertEquals("section_0", warehouse.sectionIdOf(0));
        int firstHeading = warehouse.byType(TokenKind.HEADING_OPEN).get(0);
        assertEquals("section_1", warehouse.sectionIdOf(firstHeading));
        assertEquals("section_0", warehouse.sectionIdOf(firstHeading - 1));
        assertEquals("section_4", warehouse.sectionIdOf(warehouse.size() - 1));
    }

    @Test
    void queriesRejectOutOfRangeIndices() {
        Warehouse warehouse = sample("Basic.md");
        int size = warehouse.size();

        assertThrows(IndexOutOfBoundsException.class, () -> warehouse.token(size));
        assertThrows(IndexOutOfBoundsException.class, () -> warehouse.parent(-1));
        assertThrows(IndexOutOfBoundsException.class, () -> warehouse.sectionOf(size));
        assertThrows(IndexOutOfBoundsException.class, () -> warehouse.rangeFor(size + 3));
        assertThrows(IndexOutOfBoundsException.class, () -> warehouse.isIgnored(-5));
    }

    @Test
    void rangeForLeafIsEmpty() {
        TokenSequenceBuilder seq = new TokenSequenceBuilder();
        seq.open(Container.PARAGRAPH);
        int text = seq.text("x");
        seq.close(Container.PARAGRAPH);

        Warehouse warehouse = builder.build(seq.build());

        assertTrue(warehouse.rangeFor(text).isEmpty());
        assertTrue(warehouse.rangeFor(2).isEmpty());
        assertTrue(warehouse.children(text).isEmpty());
    }

    @Test
    void textOfJoinsTextualTokensInsidePair() {
        TokenSequenceBuilder seq = new TokenSequenceBuilder();
        int paragraph = seq.open(Container.PARAGRAPH);
        seq.text("one ");
        seq.open(Container.STRONG);
        seq.text("two");
        seq.close(Container.STRONG);
        seq.leaf(TokenKind.SOFTBREAK, "\n", null, null, null);
        int three = seq.text("three");
        seq.close(Container.PARAGRAPH);

        Warehouse warehouse = builder.build(seq.build());

        assertEquals("one two\nthree", warehouse.textOf(paragraph));
        assertEquals("three", warehouse.textOf(three));
    }

    @Test
    void textOfTokenWithoutPairIsEmpty() {
        TokenSequenceBuilder seq = new TokenSequenceBuilder();
        int hr = seq.leaf(TokenKind.HR);

        assertEquals("", builder.build(seq.build()).textOf(hr));
    }

    @Test
    void enclosingAndOutermostWalkAncestors() {
        TokenSequenceBuilder seq = new TokenSequenceBuilder();
        int outer = seq.open(Container.BLOCKQUOTE);
        int inner = seq.open(Container.BLOCKQUOTE);
        int list = seq.open(Container.BULLET_LIST);
        int item = seq.open(Container.LIST_ITEM);
        int paragraph = seq.open(Container.PARAGRAPH);
        int text = seq.text("deep");
        seq.close(Container.PARAGRAPH);
        seq.close(Container.LIST_ITEM);
        seq.close(Container.BULLET_LIST);
        seq.close(Container.BLOCKQUOTE);
        seq.close(Container.BLOCKQUOTE);

        Warehouse warehouse = builder.build(seq.build());

        assertEquals(paragraph, warehouse.enclosing(text, Container.PARAGRAPH).getAsInt());
        assertEquals(item, warehouse.enclosing(text, Set.of(Container.LIST_ITEM, Container.BLOCKQUOTE)).getAsInt());
        assertEquals(inner, warehouse.enclosing(text, Container.BLOCKQUOTE).getAsInt());
        assertEquals(outer, warehouse.outermost(text, Container.BLOCKQUOTE).getAsInt());
        assertEquals(list, warehouse.outermost(text, Container.BULLET_LIST).getAsInt());
        assertTrue(warehouse.enclosing(outer, Container.BLOCKQUOTE).isEmpty());
        assertTrue(warehouse.outermost(text, Container.TABLE).isEmpty());
    }

    @Test
    void childrenSkipNestedContent() {
        TokenSequenceBuilder seq = new TokenSequenceBuilder();
        int quote = seq.open(Container.BLOCKQUOTE);
        int first = seq.open(Container.PARAGRAPH);
        seq.text("a");
        seq.close(Container.PARAGRAPH);
        int rule = seq.leaf(TokenKind.HR);
        int second = seq.open(Container.BULLET_LIST);
        seq.open(Container.LIST_ITEM);
        seq.text("b");
        seq.close(Container.LIST_ITEM);
        seq.close(Container.BULLET_LIST);
        seq.close(Container.BLOCKQUOTE);

        Warehouse warehouse = builder.build(seq.build());

        assertEquals(List.of(first, rule, second), warehouse.children(quote));
    }

    @Test
    void outlineListsSectionsInOrder() {
        Warehouse warehouse = sample("Bold_headers.md");

        List<SectionOutline> outline = warehouse.outline();

        assertEquals(4, outline.size());
        assertEquals(1, outline.get(0).getLevel());
        assertEquals("Bold Title", outline.get(0).getHeadingText());
        assertEquals(3, outline.get(1).getLevel());
        assertEquals("Skipped Level", outline.get(1).getHeadingText());
        assertEquals(2, outline.get(2).getLevel());
        assertEquals("Back To Two", outline.get(2).getHeadingText());
        assertEquals(0, outline.get(0).getStartIndex());
        assertEquals(warehouse.size() - 1, outline.get(3).getEndIndex());
    }

    @Test
    void debugDumpHasOneLinePerSection() {
        List<Token> tokens = List.of(
                new Token(0, TokenKind.HEADING_OPEN, 0, null, null, null, Map.of("level", 1)),
                Token.text(1, 1, "Title"),
                Token.of(2, TokenKind.HEADING_CLOSE, 0),
                Token.of(3, TokenKind.HR, 0));

        String dump = builder.build(tokens).debugDumpSections();

        assertEquals("[00] L1    0-   3 | 'Title'\n", dump);
    }

    @Test
    void preambleHasNoTitleInDump() {
        Warehouse warehouse = sample("Frontmatter.md");

        Section preamble = warehouse.sections().get(0);
        assertTrue(preamble.isPreamble());
        assertNull(preamble.getTitle());
        assertTrue(warehouse.debugDumpSections().startsWith("[00] L0    0-"));
        assertTrue(warehouse.debugDumpSections().contains("'Heading After Front Matter'"));
    }
}
