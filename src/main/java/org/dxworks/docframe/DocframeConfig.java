package org.dxworks.docframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.docframe.warehouse.WarehouseBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public class DocframeConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocframeConfig.class);

    public static final String ROUTING_ENV = "DOCFRAME_ROUTING";
    private static final String CONFIG_FILE_NAME = "docframe-config.yml";
    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final RoutingMode DEFAULT_ROUTING_MODE = RoutingMode.WAREHOUSE;
    private static final Set<String> DEFAULT_ALLOWED_SCHEMES = Set.of("http", "https", "mailto");

    private final int maxFileLines;
    private final RoutingMode routingMode;
    private final int maxNestingDepth;
    private final Set<String> allowedSchemes;

    private DocframeConfig(int maxFileLines, RoutingMode routingMode, int maxNestingDepth, Set<String> allowedSchemes) {
        this.maxFileLines = maxFileLines;
        this.routingMode = routingMode;
        this.maxNestingDepth = maxNestingDepth;
        this.allowedSchemes = allowedSchemes;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public RoutingMode getRoutingMode() {
        return routingMode;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public Set<String> getAllowedSchemes() {
        return allowedSchemes;
    }

    public static DocframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME), System.getenv());
    }

    public static DocframeConfig load(Path configPath, Map<String, String> env) {
        DocframeConfig fromFile = readFile(configPath);
        String routingOverride = env.get(ROUTING_ENV);
        if (routingOverride == null) {
            return fromFile;
        }
        RoutingMode mode = RoutingMode.parse(routingOverride).orElse(null);
        if (mode == null) {
            LOGGER.warn("Ignoring unknown {} value '{}'", ROUTING_ENV, routingOverride);
            return fromFile;
        }
        return new DocframeConfig(fromFile.maxFileLines, mode, fromFile.maxNestingDepth, fromFile.allowedSchemes);
    }

    private static DocframeConfig readFile(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                int effectiveMaxFileLines = (yamlConfig.maxFileLines != null && yamlConfig.maxFileLines > 0)
                        ? yamlConfig.maxFileLines
                        : DEFAULT_MAX_FILE_LINES;
                RoutingMode effectiveRoutingMode = RoutingMode.parse(yamlConfig.routingMode).orElse(DEFAULT_ROUTING_MODE);
                int effectiveMaxNesting = (yamlConfig.maxNestingDepth != null && yamlConfig.maxNestingDepth > 0)
                        ? yamlConfig.maxNestingDepth
                        : WarehouseBuilder.DEFAULT_MAX_NESTING_DEPTH;
                Set<String> effectiveSchemes = normalizeSchemes(yamlConfig.allowedSchemes);

                return new DocframeConfig(effectiveMaxFileLines, effectiveRoutingMode, effectiveMaxNesting, effectiveSchemes);
            }
        } catch (IOException e) {
            LOGGER.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    private static Set<String> normalizeSchemes(List<String> schemes) {
        if (schemes == null || schemes.isEmpty()) {
            return DEFAULT_ALLOWED_SCHEMES;
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String scheme : schemes) {
            if (scheme != null && !scheme.isBlank()) {
                normalized.add(scheme.trim().toLowerCase(Locale.ROOT));
            }
        }
        return normalized.isEmpty() ? DEFAULT_ALLOWED_SCHEMES : Set.copyOf(normalized);
    }

    public static DocframeConfig defaults() {
        return new DocframeConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_ROUTING_MODE,
                WarehouseBuilder.DEFAULT_MAX_NESTING_DEPTH, DEFAULT_ALLOWED_SCHEMES);
    }

    public static DocframeConfig with(RoutingMode routingMode, Set<String> allowedSchemes) {
        return new DocframeConfig(DEFAULT_MAX_FILE_LINES, routingMode,
                WarehouseBuilder.DEFAULT_MAX_NESTING_DEPTH, normalizeSchemes(List.copyOf(allowedSchemes)));
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public String routingMode;
        public Integer maxNestingDepth;
        public List<String> allowedSchemes;
    }
}
