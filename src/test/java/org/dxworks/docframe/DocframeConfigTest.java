package org.dxworks.docframe;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DocframeConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileGivesDefaults() {
        DocframeConfig config = DocframeConfig.load(tempDir.resolve("absent.yml"), Map.of());

        assertEquals(20000, config.getMaxFileLines());
        assertEquals(RoutingMode.WAREHOUSE, config.getRoutingMode());
        assertEquals(256, config.getMaxNestingDepth());
        assertEquals(Set.of("http", "https", "mailto"), config.getAllowedSchemes());
    }

    @Test
    void readsEveryKeyFromYaml() throws IOException {
        Path file = tempDir.resolve("docframe-config.yml");
        Files.writeString(file, "maxFileLines: 500\n"
                + "routingMode: legacy\n"
                + "maxNestingDepth: 64\n"
                + "allowedSchemes:\n"
                + "  - HTTPS\n"
                + "  - ftp\n");

        DocframeConfig config = DocframeConfig.load(file, Map.of());

        assertEquals(500, config.getMaxFileLines());
        assertEquals(RoutingMode.LEGACY, config.getRoutingMode());
        assertEquals(64, config.getMaxNestingDepth());
        assertEquals(Set.of("https", "ftp"), config.getAllowedSchemes());
    }

    @Test
    void invalidValuesFallBackToDefaults() throws IOException {
        Path file = tempDir.resolve("docframe-config.yml");
        Files.writeString(file, "maxFileLines: -1\nroutingMode: sideways\nmaxNestingDepth: 0\nallowedSchemes: []\n");

        DocframeConfig config = DocframeConfig.load(file, Map.of());

        assertEquals(20000, config.getMaxFileLines());
        assertEquals(RoutingMode.WAREHOUSE, config.getRoutingMode());
        assertEquals(256, config.getMaxNestingDepth());
        assertEquals(Set.of("http", "https", "mailto"), config.getAllowedSchemes());
    }

    @Test
    void unreadableYamlGivesDefaults() throws IOException {
        Path file = tempDir.resolve("docframe-config.yml");
        Files.writeString(file, "maxFileLines: [not, a, number\n");

        DocframeConfig config = DocframeConfig.load(file, Map.of());

        assertEquals(20000, config.getMaxFileLines());
    }

    @Test
    void environmentOverridesRoutingMode() throws IOException {
        Path file = tempDir.resolve("docframe-config.yml");
        Files.writeString(file, "routingMode: warehouse\nmaxFileLines: 42\n");

        DocframeConfig config = DocframeConfig.load(file, Map.of(DocframeConfig.ROUTING_ENV, "LEGACY"));

        assertEquals(RoutingMode.LEGACY, config.getRoutingMode());
        assertEquals(42, config.getMaxFileLines());
    }

    @Test
    void unknownEnvironmentValueIsIgnored() {
        DocframeConfig config = DocframeConfig.load(tempDir.resolve("absent.yml"),
                Map.of(DocframeConfig.ROUTING_ENV, "fast"));

        assertEquals(RoutingMode.WAREHOUSE, config.getRoutingMode());
    }

    @Test
    void routingModeParsing() {
        assertEquals(RoutingMode.LEGACY, RoutingMode.parse(" Legacy ").orElseThrow());
        assertTrue(RoutingMode.parse("").isEmpty());
        assertTrue(RoutingMode.parse(null).isEmpty());
        assertEquals("warehouse", RoutingMode.WAREHOUSE.getLabel());
    }
}
