package org.dxworks.coqu;

import org.dxworks.coqu.analyzer.cobol.COBOLProgramBuilder;
import org.dxworks.coqu.analyzer.cobol.index.StructuralIndexer;
import org.dxworks.coqu.analyzer.cobol.preprocessor.CobolPreprocessor;
import org.dxworks.coqu.analyzer.cobol.preprocessor.PreprocessorResult;
import org.dxworks.coqu.cache.CacheManager;
import org.dxworks.coqu.cache.SourceHasher;
import org.dxworks.coqu.model.cobol.COBOLProgram;
import org.dxworks.coqu.model.cobol.LoadedProgram;
import org.dxworks.coqu.model.index.StructuralIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Loads COBOL programs from disk through preprocessing, indexing and building, with the
 * program cache in front when one is configured.
 */
public class CobolProgramLoader {

    private static final Logger LOG = LoggerFactory.getLogger(CobolProgramLoader.class);

    private final CobolPreprocessor preprocessor;
    private final StructuralIndexer indexer;
    private final COBOLProgramBuilder builder;
    private final CacheManager cache;

    public CobolProgramLoader(CobolPreprocessor preprocessor, StructuralIndexer indexer,
                              COBOLProgramBuilder builder, CacheManager cache) {
        this.preprocessor = preprocessor;
        this.indexer = indexer;
        this.builder = builder;
        this.cache = cache;
    }

    /**
     * Wires the pipeline from configuration and applies the configured cache limits once.
     */
    public static CobolProgramLoader fromConfig(CoquConfig config) {
        CacheManager cache = null;
        if (config.isCacheEnabled()) {
            cache = new CacheManager(config.getCacheDir());
            int expired = cache.cleanupOld(config.getCacheMaxAgeDays());
            int evicted = cache.cleanupBySize(config.getCacheMaxSizeMb());
            if (expired + evicted > 0) {
                LOG.info("Cache cleanup removed {} expired and {} oversize entries", expired, evicted);
            }
        }
        return new CobolProgramLoader(
                new CobolPreprocessor(config.getCopybookPaths()),
                new StructuralIndexer(config.getIndexWindowThresholdChars(), config.getIndexWindowLines()),
                new COBOLProgramBuilder(),
                cache);
    }

    public Optional<CacheManager> getCache() {
        return Optional.ofNullable(cache);
    }

    public List<Path> getCopybookPaths() {
        return preprocessor.getSearchPaths();
    }

    /**
     * Same pipeline and cache, different copybook search paths.
     */
    public CobolProgramLoader withCopybookPaths(List<Path> copybookPaths) {
        return new CobolProgramLoader(new CobolPreprocessor(copybookPaths), indexer, builder, cache);
    }

    /**
     * @throws IOException when {@code file} itself cannot be read
     */
    public LoadedProgram load(Path file) throws IOException {
        return load(file, false);
    }

    /**
     * @param forceReparse skip the cache lookup; the fresh result still replaces the cached one
     * @throws IOException when {@code file} itself cannot be read
     */
    public LoadedProgram load(Path file, boolean forceReparse) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        String hash = SourceHasher.sha256Hex(bytes);
        String source = decode(bytes);
        String name = nameOf(file);

        if (cache != null && !forceReparse) {
            Optional<COBOLProgram> cached = cache.get(hash);
            if (cached.isPresent()) {
                COBOLProgram program = cached.get();
                // line bodies are not persisted; rebuild them from the expanded source
                program.sourceLines = Arrays.asList(preprocessor.preprocess(source, file).getSource().split("\n", -1));
                LOG.debug("Loaded {} from cache ({})", file, hash);
                return new LoadedProgram(name, file, program, Instant.now(), true, 0.0);
            }
        }

        long started = System.nanoTime();
        COBOLProgram program = parse(source, file, hash);
        double parseTimeMs = (System.nanoTime() - started) / 1_000_000.0;

        if (cache != null && !cache.put(hash, program)) {
            LOG.warn("Could not cache {}", file);
        }
        LOG.debug("Parsed {} in {} ms", file, String.format("%.1f", parseTimeMs));
        return new LoadedProgram(name, file, program, Instant.now(), false, parseTimeMs);
    }

    /**
     * Runs the pipeline on in-memory text. The cache is not consulted.
     *
     * @param path where the text came from, used for copybook lookup; may be {@code null}
     */
    public COBOLProgram parse(String source, Path path) {
        String text = source == null ? "" : source;
        return parse(text, path, SourceHasher.sha256Hex(text.getBytes(StandardCharsets.UTF_8)));
    }

    private COBOLProgram parse(String source, Path path, String hash) {
        PreprocessorResult preprocessed = preprocessor.preprocess(source, path);
        for (String warning : preprocessed.getWarnings()) {
            LOG.debug("{}: {}", path, warning);
        }
        for (String error : preprocessed.getErrors()) {
            LOG.warn("{}: {}", path, error);
        }

        StructuralIndex index = indexer.index(preprocessed.getSource());
        return builder.build(preprocessed.getSource(), index, preprocessed.getCopybookRefs(),
                path == null ? null : path.toString(), hash);
    }

    static String decode(byte[] bytes) {
        String text = new String(bytes, StandardCharsets.UTF_8);
        return text.startsWith("\uFEFF") ? text.substring(1) : text;
    }

    private static String nameOf(Path file) {
        String fileName = file.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }
}
