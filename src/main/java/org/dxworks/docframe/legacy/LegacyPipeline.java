package org.dxworks.docframe.legacy;

import org.dxworks.docframe.DocframeConfig;
import org.dxworks.docframe.model.Diagnostic;
import org.dxworks.docframe.model.ExtractionResult;
import org.dxworks.docframe.text.UrlClassifier;
import org.dxworks.docframe.token.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Multi-pass extraction: each category walks the whole token list on its own. Kept as the
 * reference the single-pass dispatch is checked against.
 */
public class LegacyPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(LegacyPipeline.class);

    private final List<LegacyExtractor> extractors;

    public LegacyPipeline(DocframeConfig config) {
        UrlClassifier classifier = new UrlClassifier(config.getAllowedSchemes());
        this.extractors = List.of(
                new LegacySectionsExtractor(),
                new LegacyParagraphsExtractor(),
                new LegacyListsExtractor(),
                new LegacyTablesExtractor(),
                new LegacyCodeBlocksExtractor(),
                new LegacyHeadingsExtractor(),
                new LegacyLinksExtractor(classifier),
                new LegacyImagesExtractor(classifier),
                new LegacyBlockquotesExtractor(),
                new LegacyFrontmatterExtractor(),
                new LegacyTasklistsExtractor(),
                new LegacyMathExtractor()
        );
    }

    public ExtractionResult run(List<Token> tokens) {
        ExtractionResult result = new ExtractionResult();
        for (LegacyExtractor extractor : extractors) {
            Object value;
            try {
                value = extractor.extract(tokens);
            } catch (RuntimeException e) {
                result.diagnostics.add(Diagnostic.collectorFailure(extractor.category(), null, e));
                LOGGER.warn("Legacy extractor '{}' failed: {}", extractor.category(), e.toString());
                value = extractor.emptyResult();
            }
            result.structure.put(extractor.category(), value);
        }
        return result;
    }
}
