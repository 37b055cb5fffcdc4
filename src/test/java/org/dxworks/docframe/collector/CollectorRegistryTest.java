package org.dxworks.docframe.collector;

import org.dxworks.docframe.DocframeConfig;
import org.dxworks.docframe.model.Categories;
import org.dxworks.docframe.token.TokenKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class CollectorRegistryTest {

    @Test
    void routesKindsToInterestedSlotsInRegistrationOrder() {
        CollectorRegistry registry = CollectorRegistry.builder()
                .register(() -> new DispatcherTest.RecordingCollector("a", Set.of(TokenKind.TEXT, TokenKind.HR)))
                .register(() -> new DispatcherTest.RecordingCollector("b", Set.of(TokenKind.HR)))
                .build();

        assertArrayEquals(new int[]{0}, registry.routesFor(TokenKind.TEXT));
        assertArrayEquals(new int[]{0, 1}, registry.routesFor(TokenKind.HR));
        assertArrayEquals(new int[]{}, registry.routesFor(TokenKind.TABLE_OPEN));
        assertEquals(List.of("a", "b"), registry.names());
    }

    @Test
    void rejectsDuplicateNames() {
        CollectorRegistry.Builder builder = CollectorRegistry.builder()
                .register(() -> new DispatcherTest.RecordingCollector("same", Set.of(TokenKind.TEXT)));

        assertThrows(IllegalArgumentException.class,
                () -> builder.register(() -> new DispatcherTest.RecordingCollector("same", Set.of(TokenKind.HR))));
    }

    @Test
    void rejectsEmptyInterestAndBlankName() {
        assertThrows(IllegalArgumentException.class, () -> CollectorRegistry.builder()
                .register(() -> new DispatcherTest.RecordingCollector("quiet", Set.of())));
        assertThrows(IllegalArgumentException.class, () -> CollectorRegistry.builder()
                .register(() -> new DispatcherTest.RecordingCollector(" ", Set.of(TokenKind.TEXT))));
        assertThrows(IllegalArgumentException.class, () -> CollectorRegistry.builder()
                .register(() -> null));
    }

    @Test
    void instantiateCreatesNewCollectorsEachTime() {
        CollectorRegistry registry = CollectorRegistry.builder()
                .register(() -> new DispatcherTest.RecordingCollector("a", Set.of(TokenKind.TEXT)))
                .build();

        assertNotSame(registry.instantiate().get(0), registry.instantiate().get(0));
    }

    @Test
    void standardRegistryCoversEveryCategoryInOrder() {
        CollectorRegistry registry = StandardCollectors.registry(DocframeConfig.defaults());

        assertEquals(Categories.ORDER, registry.names());
        assertEquals(12, registry.size());
    }
}
