package org.dxworks.docframe;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class TestUtils {
    public static final String SAMPLES_BASE_PATH = "src/test/resources/samples/markdown/";

    public static final ObjectMapper PRETTY_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static Path sample(String fileName) {
        return Paths.get(SAMPLES_BASE_PATH + fileName);
    }

    public static String readSample(String fileName) {
        try {
            return Files.readString(sample(fileName), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static List<String> sampleNames() {
        try (Stream<Path> files = Files.list(Paths.get(SAMPLES_BASE_PATH))) {
            return files.map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(".md"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
