package org.dxworks.docframe.collector;

import org.dxworks.docframe.model.Diagnostic;
import org.dxworks.docframe.model.DiagnosticKind;
import org.dxworks.docframe.model.ExtractionResult;
import org.dxworks.docframe.token.Token;
import org.dxworks.docframe.warehouse.StructuralWarning;
import org.dxworks.docframe.warehouse.Warehouse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Single dispatch pass: every token is handed to the collectors routed for its kind, then
 * every collector is finished. A failing collector is contained and reported as a diagnostic.
 */
public class Dispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(Dispatcher.class);
    static final String WAREHOUSE_SOURCE = "warehouse";

    public ExtractionResult run(Warehouse warehouse, CollectorRegistry registry) {
        ExtractionResult result = new ExtractionResult();
        for (StructuralWarning warning : warehouse.warnings()) {
            result.diagnostics.add(new Diagnostic(DiagnosticKind.STRUCTURAL_WARNING, WAREHOUSE_SOURCE,
                    warning.getTokenIndex(), warning.getMessage()));
        }

        List<Collector> collectors = registry.instantiate();
        boolean[] failed = new boolean[collectors.size()];

        for (Token token : warehouse.tokens()) {
            for (int slot : registry.routesFor(token.getKind())) {
                if (failed[slot]) {
                    continue;
                }
                Collector collector = collectors.get(slot);
                try {
                    if (collector.shouldProcess(token, warehouse)) {
                        collector.onToken(token, warehouse);
                    }
                } catch (RuntimeException e) {
                    failed[slot] = true;
                    result.diagnostics.add(Diagnostic.collectorFailure(collector.name(), token.getIndex(), e));
                    LOGGER.warn("Collector '{}' failed at token {}: {}", collector.name(), token.getIndex(), e.toString());
                }
            }
        }

        for (Collector collector : collectors) {
            Object value;
            try {
                value = collector.finish(warehouse);
            } catch (RuntimeException e) {
                result.diagnostics.add(Diagnostic.collectorFailure(collector.name(), null, e));
                LOGGER.warn("Collector '{}' failed to finish: {}", collector.name(), e.toString());
                value = collector.emptyResult();
            }
            result.structure.put(collector.name(), value);
        }
        return result;
    }
}
