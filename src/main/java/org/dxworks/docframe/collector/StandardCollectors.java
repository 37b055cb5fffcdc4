package org.dxworks.docframe.collector;

import org.dxworks.docframe.DocframeConfig;
import org.dxworks.docframe.collector.category.BlockquotesCollector;
import org.dxworks.docframe.collector.category.CodeBlocksCollector;
import org.dxworks.docframe.collector.category.FrontmatterCollector;
import org.dxworks.docframe.collector.category.HeadingsCollector;
import org.dxworks.docframe.collector.category.ImagesCollector;
import org.dxworks.docframe.collector.category.LinksCollector;
import org.dxworks.docframe.collector.category.ListsCollector;
import org.dxworks.docframe.collector.category.MathCollector;
import org.dxworks.docframe.collector.category.ParagraphsCollector;
import org.dxworks.docframe.collector.category.SectionsCollector;
import org.dxworks.docframe.collector.category.TablesCollector;
import org.dxworks.docframe.collector.category.TasklistsCollector;
import org.dxworks.docframe.text.UrlClassifier;

/** Registry of the built-in categories in output order. */
public final class StandardCollectors {

    private StandardCollectors() {
    }

    public static CollectorRegistry registry(DocframeConfig config) {
        UrlClassifier classifier = new UrlClassifier(config.getAllowedSchemes());
        return CollectorRegistry.builder()
                .register(SectionsCollector::new)
                .register(ParagraphsCollector::new)
                .register(ListsCollector::new)
                .register(TablesCollector::new)
                .register(CodeBlocksCollector::new)
                .register(HeadingsCollector::new)
                .register(() -> new LinksCollector(classifier))
                .register(() -> new ImagesCollector(classifier))
                .register(BlockquotesCollector::new)
                .register(FrontmatterCollector::new)
                .register(TasklistsCollector::new)
                .register(MathCollector::new)
                .build();
    }
}
