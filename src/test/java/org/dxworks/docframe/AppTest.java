package org.dxworks.docframe;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AppTest {

    @TempDir
    Path tempDir;

    @Test
    void collectsMarkdownFilesSortedAndWithinLimit() throws IOException {
        Files.writeString(tempDir.resolve("b.md"), "# B\n");
        Files.writeString(tempDir.resolve("a.markdown"), "# A\n");
        Files.writeString(tempDir.resolve("notes.txt"), "not markdown\n");
        Files.writeString(tempDir.resolve("long.md"), "1\n2\n3\n4\n5\n");
        Files.createDirectories(tempDir.resolve("sub"));
        Files.writeString(tempDir.resolve("sub/c.MD"), "# C\n");

        List<Path> files = App.collectMarkdownFiles(tempDir, 3);

        assertEquals(List.of(tempDir.resolve("a.markdown"), tempDir.resolve("b.md"), tempDir.resolve("sub/c.MD")), files);
    }

    @Test
    void singleFileInputIsKept() throws IOException {
        Path file = tempDir.resolve("one.md");
        Files.writeString(file, "# One\n");

        assertEquals(List.of(file), App.collectMarkdownFiles(file, 100));
        assertTrue(App.collectMarkdownFiles(tempDir.resolve("missing.md"), 100).isEmpty());
    }

    @Test
    void markdownExtensions() {
        assertTrue(App.isMarkdown(Paths.get("README.md")));
        assertTrue(App.isMarkdown(Paths.get("guide.Markdown")));
        assertFalse(App.isMarkdown(Paths.get("notes.mdx")));
    }

    @Test
    void parityOverSamplesSucceeds() throws IOException {
        assertEquals(0, App.checkParity(Paths.get(TestUtils.SAMPLES_BASE_PATH)));
    }

    @Test
    void printSectionsRejectsDirectories() throws IOException {
        assertEquals(1, App.printSections(tempDir));
        assertEquals(0, App.printSections(TestUtils.sample("Basic.md")));
    }

    @Test
    void documentRecordsSerializeAsJsonLines() throws IOException {
        StructureExtractor extractor = new StructureExtractor(DocframeConfig.defaults());
        String line = new ObjectMapper().writeValueAsString(extractor.extractFile(TestUtils.sample("Basic.md")));

        JsonNode record = new ObjectMapper().readTree(line);
        assertEquals("document", record.get("kind").asText());
        assertEquals("warehouse", record.get("mode").asText());
        assertEquals(5, record.get("structure").get("sections").size());
        assertTrue(record.get("structure").get("frontmatter").isNull());
        assertFalse(line.contains("\n"));
    }
}
