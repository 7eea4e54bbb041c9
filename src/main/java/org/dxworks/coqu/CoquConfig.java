package org.dxworks.coqu;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.coqu.analyzer.cobol.index.StructuralIndexer;
import org.dxworks.coqu.cache.CacheManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class CoquConfig {

    private static final Logger LOG = LoggerFactory.getLogger(CoquConfig.class);

    static final String CONFIG_FILE_NAME = "coqu-config.yml";

    private static final boolean DEFAULT_CACHE_ENABLED = true;
    private static final int DEFAULT_CACHE_MAX_AGE_DAYS = 30;
    private static final int DEFAULT_CACHE_MAX_SIZE_MB = 500;

    private final List<Path> copybookPaths;
    private final boolean cacheEnabled;
    private final Path cacheDir;
    private final int cacheMaxAgeDays;
    private final int cacheMaxSizeMb;
    private final int indexWindowThresholdChars;
    private final int indexWindowLines;

    private CoquConfig(List<Path> copybookPaths, boolean cacheEnabled, Path cacheDir,
                       int cacheMaxAgeDays, int cacheMaxSizeMb,
                       int indexWindowThresholdChars, int indexWindowLines) {
        this.copybookPaths = List.copyOf(copybookPaths);
        this.cacheEnabled = cacheEnabled;
        this.cacheDir = cacheDir;
        this.cacheMaxAgeDays = cacheMaxAgeDays;
        this.cacheMaxSizeMb = cacheMaxSizeMb;
        this.indexWindowThresholdChars = indexWindowThresholdChars;
        this.indexWindowLines = indexWindowLines;
    }

    public List<Path> getCopybookPaths() {
        return copybookPaths;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public Path getCacheDir() {
        return cacheDir;
    }

    public int getCacheMaxAgeDays() {
        return cacheMaxAgeDays;
    }

    public int getCacheMaxSizeMb() {
        return cacheMaxSizeMb;
    }

    public int getIndexWindowThresholdChars() {
        return indexWindowThresholdChars;
    }

    public int getIndexWindowLines() {
        return indexWindowLines;
    }

    public static CoquConfig defaults() {
        return new CoquConfig(List.of(), DEFAULT_CACHE_ENABLED, CacheManager.defaultCacheDir(),
                DEFAULT_CACHE_MAX_AGE_DAYS, DEFAULT_CACHE_MAX_SIZE_MB,
                StructuralIndexer.DEFAULT_WINDOW_THRESHOLD_CHARS, StructuralIndexer.DEFAULT_WINDOW_LINES);
    }

    /**
     * Reads {@value #CONFIG_FILE_NAME} from the working directory, if there is one.
     */
    public static CoquConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static CoquConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            JsonNode root = yamlMapper.readTree(configPath.toFile());
            if (root != null && root.isObject()) {
                return fromYaml(read(yamlMapper, root, configPath));
            }
        } catch (IOException e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    /**
     * Binds the document key by key, so one badly typed value only loses that value.
     */
    private static YamlConfig read(ObjectMapper mapper, JsonNode root, Path source) {
        YamlConfig yaml = new YamlConfig();
        String[] paths = field(mapper, root, "copybookPaths", String[].class, source);
        if (paths != null) yaml.copybookPaths = Arrays.asList(paths);

        JsonNode cache = section(root, "cache", source);
        if (cache != null) {
            yaml.cache = new YamlCache();
            yaml.cache.enabled = field(mapper, cache, "enabled", Boolean.class, source);
            yaml.cache.dir = field(mapper, cache, "dir", String.class, source);
            yaml.cache.maxAgeDays = field(mapper, cache, "maxAgeDays", Integer.class, source);
            yaml.cache.maxSizeMb = field(mapper, cache, "maxSizeMb", Integer.class, source);
        }

        JsonNode indexer = section(root, "indexer", source);
        if (indexer != null) {
            yaml.indexer = new YamlIndexer();
            yaml.indexer.windowThresholdChars = field(mapper, indexer, "windowThresholdChars", Integer.class, source);
            yaml.indexer.windowLines = field(mapper, indexer, "windowLines", Integer.class, source);
        }
        return yaml;
    }

    private static JsonNode section(JsonNode root, String name, Path source) {
        JsonNode node = root.get(name);
        if (node == null || node.isNull()) return null;
        if (!node.isObject()) {
            LOG.warn("Ignoring '{}' in {}: expected a mapping", name, source);
            return null;
        }
        return node;
    }

    private static <T> T field(ObjectMapper mapper, JsonNode parent, String name, Class<T> type, Path source) {
        JsonNode node = parent.get(name);
        if (node == null || node.isNull()) return null;
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOG.warn("Ignoring '{}' in {}: {}", name, source, e.getMessage());
            return null;
        }
    }

    /**
     * Programmatic configuration with the default cache limits and indexer windows.
     */
    public static CoquConfig with(List<Path> copybookPaths, Path cacheDir, boolean cacheEnabled) {
        CoquConfig d = defaults();
        return new CoquConfig(copybookPaths == null ? List.of() : copybookPaths, cacheEnabled,
                cacheDir == null ? d.cacheDir : cacheDir,
                d.cacheMaxAgeDays, d.cacheMaxSizeMb, d.indexWindowThresholdChars, d.indexWindowLines);
    }

    private static CoquConfig fromYaml(YamlConfig yaml) {
        CoquConfig d = defaults();

        List<Path> copybookPaths = new ArrayList<>();
        if (yaml.copybookPaths != null) {
            for (String p : yaml.copybookPaths) {
                if (p != null && !p.isBlank()) copybookPaths.add(expandHome(p.trim()));
            }
        }

        YamlCache cache = yaml.cache != null ? yaml.cache : new YamlCache();
        YamlIndexer indexer = yaml.indexer != null ? yaml.indexer : new YamlIndexer();

        return new CoquConfig(
                copybookPaths,
                cache.enabled != null ? cache.enabled : d.cacheEnabled,
                cache.dir != null && !cache.dir.isBlank() ? expandHome(cache.dir.trim()) : d.cacheDir,
                positiveOr(cache.maxAgeDays, d.cacheMaxAgeDays),
                positiveOr(cache.maxSizeMb, d.cacheMaxSizeMb),
                positiveOr(indexer.windowThresholdChars, d.indexWindowThresholdChars),
                positiveOr(indexer.windowLines, d.indexWindowLines));
    }

    private static int positiveOr(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }

    private static Path expandHome(String path) {
        if (path.equals("~") || path.startsWith("~/")) {
            return Paths.get(System.getProperty("user.home") + path.substring(1));
        }
        return Paths.get(path);
    }

    private static class YamlConfig {
        public List<String> copybookPaths;
        public YamlCache cache;
        public YamlIndexer indexer;
    }

    private static class YamlCache {
        public Boolean enabled;
        public String dir;
        public Integer maxAgeDays;
        public Integer maxSizeMb;
    }

    private static class YamlIndexer {
        public Integer windowThresholdChars;
        public Integer windowLines;
    }
}
