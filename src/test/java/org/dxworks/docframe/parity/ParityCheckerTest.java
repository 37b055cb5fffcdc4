package org.dxworks.docframe.parity;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.dxworks.docframe.DocframeConfig;
import org.dxworks.docframe.RoutingMode;
import org.dxworks.docframe.StructureExtractor;
import org.dxworks.docframe.TestUtils;
import org.dxworks.docframe.model.Categories;
import org.dxworks.docframe.model.ExtractionResult;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ParityCheckerTest {

    private final StructureExtractor extractor = new StructureExtractor(DocframeConfig.defaults());
    private final ParityChecker checker = new ParityChecker(extractor);

    @Test
    void bothPathsAgreeOnEverySample() throws JsonProcessingException {
        for (String name : TestUtils.sampleNames()) {
            String markdown = TestUtils.readSample(name);
            ParityReport report = checker.check(name, markdown);
            if (!report.isIdentical()) {
                ExtractionResult warehouse = extractor.extract(name, markdown, RoutingMode.WAREHOUSE);
                ExtractionResult legacy = extractor.extract(name, markdown, RoutingMode.LEGACY);
                String category = report.mismatchedCategories.get(0);
                assertEquals(TestUtils.PRETTY_MAPPER.writeValueAsString(legacy.category(category)),
                        TestUtils.PRETTY_MAPPER.writeValueAsString(warehouse.category(category)),
                        name + " differs in " + report.mismatchedCategories);
            }
            assertTrue(report.isIdentical(), name + " differs in " + report.mismatchedCategories);
            assertEquals(0, report.warehouseDiagnostics, name);
            assertEquals(0, report.legacyDiagnostics, name);
        }
    }

    @Test
    void pathsAgreeOnIrregularDocuments() {
        List<String> documents = List.of(
                "",
                "No headings at all.\n\n- a\n- b\n",
                "Intro\n\n## Starts at two\n\n# Then one\n\n### Then three\n",
                "> # Quoted heading\n>\n> | a |\n> |---|\n> | 1 |\n",
                "> # Only heading\n\ntext\n",
                "# Top\n\n- item\n\n  ## Listed\n\n  body\n\n## Next\n",
                "- [x] outer\n  - [ ] inner\n  - plain\n\n      indented in item\n",
                "Text with $x$ and `$y$` and <span>$z$</span>\n\n$$\n\n$$ not display\n",
                "```math\n a + b \n```\n\n```\nunclosed fence\n");
        for (String markdown : documents) {
            ParityReport report = checker.check("inline.md", markdown);
            assertTrue(report.isIdentical(), "differs in " + report.mismatchedCategories + " for:\n" + markdown);
        }
    }

    @Test
    void canonicalJsonIgnoresMapInsertionOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("b", 1);
        first.put("a", List.of("x"));
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("a", List.of("x"));
        second.put("b", 1);

        assertEquals(ParityChecker.canonical(first), ParityChecker.canonical(second));
        assertEquals("null", ParityChecker.canonical(null));
    }

    @Test
    void reportWithMismatchIsNotIdentical() {
        ParityReport report = new ParityReport();
        report.mismatchedCategories = List.of(Categories.LINKS);

        assertFalse(report.isIdentical());
    }
}
