package org.dxworks.docframe.parity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.docframe.RoutingMode;
import org.dxworks.docframe.StructureExtractor;
import org.dxworks.docframe.model.Categories;
import org.dxworks.docframe.model.ExtractionResult;
import org.dxworks.docframe.token.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/** Runs both extraction paths on the same tokens and compares their canonical JSON per category. */
public class ParityChecker {

    private static final Logger LOGGER = LoggerFactory.getLogger(ParityChecker.class);

    public static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private final StructureExtractor extractor;

    public ParityChecker(StructureExtractor extractor) {
        this.extractor = extractor;
    }

    public ParityReport check(String filePath, String markdown) {
        List<Token> tokens = extractor.tokenize(markdown);
        ExtractionResult warehouse = extractor.extractTokens(filePath, tokens, RoutingMode.WAREHOUSE);
        ExtractionResult legacy = extractor.extractTokens(filePath, tokens, RoutingMode.LEGACY);

        ParityReport report = new ParityReport();
        report.filePath = filePath;
        report.mismatchedCategories = new ArrayList<>();
        report.warehouseDiagnostics = warehouse.diagnostics.size();
        report.legacyDiagnostics = legacy.diagnostics.size();
        for (String category : Categories.ORDER) {
            String left = canonical(warehouse.category(category));
            String right = canonical(legacy.category(category));
            if (!left.equals(right)) {
                report.mismatchedCategories.add(category);
                LOGGER.debug("Parity mismatch in {} for {}:\n  warehouse={}\n  legacy={}", category, filePath, left, right);
            }
        }
        return report;
    }

    public static String canonical(Object value) {
        try {
            return CANONICAL_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize category value", e);
        }
    }
}
