package org.dxworks.docframe;

import org.dxworks.docframe.collector.CollectorRegistry;
import org.dxworks.docframe.collector.Dispatcher;
import org.dxworks.docframe.collector.StandardCollectors;
import org.dxworks.docframe.legacy.LegacyPipeline;
import org.dxworks.docframe.model.ExtractionResult;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.tokenizer.CommonmarkTokenizer;
import org.dxworks.docframe.warehouse.Warehouse;
import org.dxworks.docframe.warehouse.WarehouseBuilder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Entry point for extracting the category map of one document. The registry, tokenizer and
 * legacy pipeline are built once; each call works on its own warehouse and collectors.
 */
public class StructureExtractor {

    private final DocframeConfig config;
    private final CommonmarkTokenizer tokenizer = new CommonmarkTokenizer();
    private final WarehouseBuilder builder;
    private final CollectorRegistry registry;
    private final Dispatcher dispatcher = new Dispatcher();
    private final LegacyPipeline legacy;

    public StructureExtractor(DocframeConfig config) {
        this.config = config;
        this.builder = new WarehouseBuilder(config.getMaxNestingDepth());
        this.registry = StandardCollectors.registry(config);
        this.legacy = new LegacyPipeline(config);
    }

    public DocframeConfig getConfig() {
        return config;
    }

    public List<Token> tokenize(String markdown) {
        return tokenizer.tokenize(markdown);
    }

    public Warehouse warehouse(String markdown) {
        return builder.build(tokenize(markdown));
    }

    public ExtractionResult extract(String filePath, String markdown) {
        return extract(filePath, markdown, config.getRoutingMode());
    }

    public ExtractionResult extract(String filePath, String markdown, RoutingMode mode) {
        return extractTokens(filePath, tokenize(markdown), mode);
    }

    public ExtractionResult extractTokens(String filePath, List<Token> tokens, RoutingMode mode) {
        ExtractionResult result = switch (mode) {
            case WAREHOUSE -> dispatcher.run(builder.build(tokens), registry);
            case LEGACY -> legacy.run(tokens);
        };
        result.filePath = filePath;
        result.mode = mode.getLabel();
        return result;
    }

    public ExtractionResult extractFile(Path file) throws IOException {
        return extract(file.toString(), Files.readString(file, StandardCharsets.UTF_8));
    }
}
