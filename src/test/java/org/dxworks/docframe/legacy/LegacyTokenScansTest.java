package org.dxworks.docframe.legacy;

import org.dxworks.docframe.DocframeConfig;
import org.dxworks.docframe.model.Categories;
import org.dxworks.docframe.model.DiagnosticKind;
import org.dxworks.docframe.model.ExtractionResult;
import org.dxworks.docframe.token.Container;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.token.TokenKind;
import org.dxworks.docframe.token.TokenSequenceBuilder;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LegacyTokenScansTest {

    private static Map<String, Object> level(int level) {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("level", level);
        return attrs;
    }

    @Test
    void matchingCloseSkipsNestedPairsOfSameKind() {
        TokenSequenceBuilder seq = new TokenSequenceBuilder();
        int outer = seq.open(Container.BLOCKQUOTE);
        int inner = seq.open(Container.BLOCKQUOTE);
        seq.text("x");
        int innerClose = seq.close(Container.BLOCKQUOTE);
        int outerClose = seq.close(Container.BLOCKQUOTE);
        List<Token> tokens = seq.build();

        assertEquals(outerClose, LegacyTokenScans.matchingClose(tokens, outer));
        assertEquals(innerClose, LegacyTokenScans.matchingClose(tokens, inner));
        assertEquals("x", LegacyTokenScans.textOf(tokens, outer));
    }

    @Test
    void nearestAncestorSkipsClosedSiblings() {
        TokenSequenceBuilder seq = new TokenSequenceBuilder();
        int quote = seq.open(Container.BLOCKQUOTE);
        seq.open(Container.PARAGRAPH);
        seq.text("a");
        seq.close(Container.PARAGRAPH);
        int code = seq.open(Container.FENCE);
        int inside = seq.text("b");
        seq.close(Container.FENCE);
        int after = seq.text("c");
        List<Token> tokens = seq.build();

        assertEquals(quote, LegacyTokenScans.nearestAncestor(tokens, after, Set.of(Container.BLOCKQUOTE, Container.PARAGRAPH)));
        assertEquals(code, LegacyTokenScans.nearestAncestor(tokens, inside, Set.of(Container.FENCE)));
        assertTrue(LegacyTokenScans.insideRaw(tokens, inside));
        assertFalse(LegacyTokenScans.insideRaw(tokens, after));
        assertEquals(-1, LegacyTokenScans.nearestAncestor(tokens, quote, Set.of(Container.BLOCKQUOTE)));
        assertEquals(List.of(1, code), LegacyTokenScans.directChildren(tokens, quote).subList(0, 2));
    }

    @Test
    void sectionStartsIncludePreamble() {
        TokenSequenceBuilder seq = new TokenSequenceBuilder();
        seq.open(Container.PARAGRAPH);
        seq.text("intro");
        seq.close(Container.PARAGRAPH);
        int heading = seq.open(Container.HEADING, level(1));
        seq.text("Title");
        seq.close(Container.HEADING);
        List<Token> tokens = seq.build();

        List<Integer> starts = LegacyTokenScans.sectionStarts(tokens);

        assertEquals(List.of(0, heading), starts);
        assertEquals("section_0", LegacyTokenScans.sectionIdAt(starts, 2));
        assertEquals("section_1", LegacyTokenScans.sectionIdAt(starts, heading + 1));
        assertNull(LegacyTokenScans.sectionIdAt(List.of(), 0));
    }

    @Test
    void pipelineContainsExtractorFailures() {
        List<Token> tokens = List.of(
                new Token(0, TokenKind.HEADING_OPEN, 0, null, null, null, Map.of("level", "high")),
                Token.text(1, 1, "x"),
                Token.of(2, TokenKind.HEADING_CLOSE, 0));

        ExtractionResult result = new LegacyPipeline(DocframeConfig.defaults()).run(tokens);

        assertEquals(Categories.ORDER, List.copyOf(result.structure.keySet()));
        assertEquals(List.of(), result.category(Categories.SECTIONS));
        assertEquals(List.of(), result.category(Categories.HEADINGS));
        assertEquals(2, result.diagnostics.size());
        assertEquals(DiagnosticKind.COLLECTOR_FAILURE, result.diagnostics.get(0).kind);
        assertEquals(Categories.SECTIONS, result.diagnostics.get(0).source);
        assertNull(result.diagnostics.get(0).tokenIndex);
    }
}
