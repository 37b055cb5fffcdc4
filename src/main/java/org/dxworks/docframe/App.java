package org.dxworks.docframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.docframe.model.ExtractionResult;
import org.dxworks.docframe.parity.ParityChecker;
import org.dxworks.docframe.parity.ParityReport;
import org.dxworks.docframe.warehouse.Warehouse;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        if (args.length == 2 && "--sections".equals(args[0])) {
            System.exit(printSections(Paths.get(args[1])));
        }
        if (args.length == 2 && "--parity".equals(args[0])) {
            System.exit(checkParity(Paths.get(args[1])));
        }
        if (args.length < 2) {
            System.err.println("Usage: java -jar docframe.jar <input-folder> <output-file>");
            System.err.println("       java -jar docframe.jar --sections <markdown-file>");
            System.err.println("       java -jar docframe.jar --parity <input-folder>");
            System.err.println("  <input-folder>: Path to a Markdown file or a directory of Markdown files");
            System.err.println("  <output-file>:  Path to output JSONL file");
            System.err.println("Routing mode: docframe-config.yml 'routingMode' or " + DocframeConfig.ROUTING_ENV + "=warehouse|legacy");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(args[1]);
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        DocframeConfig config = DocframeConfig.load();
        StructureExtractor extractor = new StructureExtractor(config);

        System.out.println("Starting structure extraction...");
        System.out.println("Input: " + input.toAbsolutePath());
        System.out.println("Routing mode: " + config.getRoutingMode().getLabel());

        List<Path> files = collectMarkdownFiles(input, config.getMaxFileLines());
        System.out.println("Found " + files.size() + " Markdown files");

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new HashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("routing_mode", config.getRoutingMode().getLabel());
            runInfo.put("total_files", files.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            files.parallelStream().forEach(file -> {
                int current = progressCounter.incrementAndGet();

                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Extracting: " + file.getFileName());
                }

                try {
                    ExtractionResult result = extractor.extractFile(file);

                    synchronized (writer) {
                        writer.write(MAPPER.writeValueAsString(result));
                        writer.newLine();
                        writer.flush();
                    }

                    successCount.incrementAndGet();
                } catch (Exception e) {
                    Map<String, String> error = new HashMap<>();
                    error.put("kind", "error");
                    error.put("file", file.toString());
                    error.put("error", e.getMessage());

                    try {
                        synchronized (writer) {
                            writer.write(MAPPER.writeValueAsString(error));
                            writer.newLine();
                            writer.flush();
                        }
                    } catch (IOException ioException) {
                        System.err.println("Failed to write error for " + file + ": " + ioException.getMessage());
                    }

                    errorCount.incrementAndGet();
                    synchronized (System.err) {
                        System.err.println("  Error extracting " + file.getFileName() + ": " + e.getMessage());
                    }
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new HashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_extracted", successCount.get());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Extraction complete!");
        System.out.println("Successfully extracted: " + successCount.get() + " files");
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    static int printSections(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            System.err.println("Error: Not a file: " + file);
            return 1;
        }
        StructureExtractor extractor = new StructureExtractor(DocframeConfig.load());
        Warehouse warehouse = extractor.warehouse(Files.readString(file, StandardCharsets.UTF_8));
        System.out.print(warehouse.debugDumpSections());
        return 0;
    }

    static int checkParity(Path input) throws IOException {
        DocframeConfig config = DocframeConfig.load();
        ParityChecker checker = new ParityChecker(new StructureExtractor(config));
        List<Path> files = collectMarkdownFiles(input, config.getMaxFileLines());
        int mismatches = 0;
        for (Path file : files) {
            ParityReport report = checker.check(file.toString(), Files.readString(file, StandardCharsets.UTF_8));
            if (report.isIdentical()) {
                System.out.println("OK       " + file);
            } else {
                mismatches++;
                System.out.println("MISMATCH " + file + " " + report.mismatchedCategories);
            }
        }
        System.out.println(files.size() + " files checked, " + mismatches + " with mismatches");
        return mismatches == 0 ? 0 : 1;
    }

    static List<Path> collectMarkdownFiles(Path input, int maxFileLines) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(App::isMarkdown)
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (isMarkdown(input) && withinMaxLines(input, maxFileLines)) {
                files.add(input);
            }
        }

        return files;
    }

    static boolean isMarkdown(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".md") || name.endsWith(".markdown");
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException | UncheckedIOException e) {
            return true;
        }
    }
}
