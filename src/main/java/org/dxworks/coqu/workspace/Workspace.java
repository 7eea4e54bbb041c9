package org.dxworks.coqu.workspace;

import org.dxworks.coqu.CobolProgramLoader;
import org.dxworks.coqu.CoquConfig;
import org.dxworks.coqu.cache.CacheManager;
import org.dxworks.coqu.model.cobol.COBOLParagraph;
import org.dxworks.coqu.model.cobol.LoadedProgram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The set of programs loaded for analysis, keyed by upper-case file name without extension.
 *
 * <p>Loading a second file with the same name replaces the first one. Not thread-safe.
 */
public class Workspace implements Iterable<LoadedProgram> {

    private static final Logger LOG = LoggerFactory.getLogger(Workspace.class);

    public static final String DEFAULT_PATTERN = "*.cbl";

    private final Map<String, LoadedProgram> programs = new LinkedHashMap<>();
    private final List<Path> copybookPaths;
    private CobolProgramLoader loader;

    public Workspace(CoquConfig config) {
        this(CobolProgramLoader.fromConfig(config));
    }

    public Workspace(CobolProgramLoader loader) {
        this.loader = loader;
        this.copybookPaths = new ArrayList<>(loader.getCopybookPaths());
    }

    public List<Path> getCopybookPaths() {
        return Collections.unmodifiableList(copybookPaths);
    }

    /**
     * Adds a copybook search directory for programs loaded from now on.
     *
     * @return {@code false} when {@code path} is not a directory or is already searched
     */
    public boolean addCopybookPath(Path path) {
        if (path == null || !Files.isDirectory(path) || copybookPaths.contains(path)) {
            return false;
        }
        copybookPaths.add(path);
        loader = loader.withCopybookPaths(copybookPaths);
        return true;
    }

    public CopybookCatalog copybooks() {
        return new CopybookCatalog(copybookPaths);
    }

    public Optional<CacheManager> getCache() {
        return loader.getCache();
    }

    public LoadedProgram load(Path path) throws IOException {
        return load(path, false);
    }

    /**
     * Loads {@code path} unless the same file is already loaded under its name.
     *
     * @param forceReparse parse again even when loaded or cached
     */
    public LoadedProgram load(Path path, boolean forceReparse) throws IOException {
        Path file = path.toAbsolutePath().normalize();
        String key = keyOf(file);

        LoadedProgram existing = programs.get(key);
        if (existing != null && !forceReparse && existing.getPath().equals(file)) {
            return existing;
        }

        LoadedProgram loaded = loader.load(file, forceReparse);
        programs.put(key, loaded);
        return loaded;
    }

    public List<LoadedProgram> loadDirectory(Path directory) throws IOException {
        return loadDirectory(directory, DEFAULT_PATTERN, false);
    }

    /**
     * Loads every file in {@code directory} whose name matches the glob {@code pattern}, in path order.
     * Files that cannot be read are logged and skipped.
     *
     * @throws IOException when the directory itself cannot be listed
     */
    public List<LoadedProgram> loadDirectory(Path directory, String pattern, boolean recursive) throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }

        PathMatcher matcher = directory.getFileSystem().getPathMatcher("glob:" + pattern);
        List<Path> files;
        try (Stream<Path> listing = recursive ? Files.walk(directory) : Files.list(directory)) {
            files = listing.filter(Files::isRegularFile)
                    .filter(file -> matcher.matches(file.getFileName()))
                    .sorted()
                    .collect(Collectors.toList());
        }

        List<LoadedProgram> loaded = new ArrayList<>();
        for (Path file : files) {
            try {
                loaded.add(load(file));
            } catch (IOException e) {
                LOG.warn("Skipping {}: {}", file, e.getMessage());
            }
        }
        LOG.debug("Loaded {} of {} files from {}", loaded.size(), files.size(), directory);
        return loaded;
    }

    public boolean unload(String name) {
        return programs.remove(upper(name)) != null;
    }

    /**
     * @return how many programs were unloaded
     */
    public int unloadAll() {
        int count = programs.size();
        programs.clear();
        return count;
    }

    public Optional<LoadedProgram> reload(String name) throws IOException {
        LoadedProgram existing = programs.get(upper(name));
        if (existing == null) {
            return Optional.empty();
        }
        return Optional.of(load(existing.getPath(), true));
    }

    /**
     * Parses every loaded program again. Programs whose file is gone are dropped.
     */
    public List<LoadedProgram> reloadAll() {
        List<Path> paths = programs.values().stream().map(LoadedProgram::getPath).collect(Collectors.toList());
        programs.clear();

        List<LoadedProgram> reloaded = new ArrayList<>();
        for (Path path : paths) {
            try {
                reloaded.add(load(path, true));
            } catch (IOException e) {
                LOG.warn("Dropping {} from the workspace: {}", path, e.getMessage());
            }
        }
        return reloaded;
    }

    public Optional<LoadedProgram> get(String name) {
        return Optional.ofNullable(programs.get(upper(name)));
    }

    public boolean contains(String name) {
        return programs.containsKey(upper(name));
    }

    public int size() {
        return programs.size();
    }

    public List<String> listPrograms() {
        return new ArrayList<>(programs.keySet());
    }

    @Override
    public Iterator<LoadedProgram> iterator() {
        return Collections.unmodifiableCollection(programs.values()).iterator();
    }

    public WorkspaceStats stats() {
        long totalLines = 0;
        int cached = 0;
        for (LoadedProgram program : programs.values()) {
            totalLines += program.getProgram().lines;
            if (program.isFromCache()) cached++;
        }
        return new WorkspaceStats(programs.size(), totalLines, cached, copybookPaths.size());
    }

    public Optional<LoadedProgram> findProgramById(String programId) {
        for (LoadedProgram program : programs.values()) {
            if (program.getProgramId().equalsIgnoreCase(programId)) {
                return Optional.of(program);
            }
        }
        return Optional.empty();
    }

    /**
     * Paragraphs, across all loaded programs, that CALL {@code programId}.
     */
    public List<CallSite> findCallers(String programId) {
        String target = upper(programId);
        List<CallSite> callers = new ArrayList<>();
        for (Map.Entry<String, LoadedProgram> entry : programs.entrySet()) {
            for (COBOLParagraph paragraph : entry.getValue().getProgram().allParagraphs()) {
                if (paragraph.calls.stream().anyMatch(call -> upper(call).equals(target))) {
                    callers.add(new CallSite(entry.getKey(), paragraph.name));
                }
            }
        }
        return callers;
    }

    /**
     * PROGRAM-ID of each loaded program mapped to the sorted programs it CALLs.
     */
    public Map<String, List<String>> callGraph() {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        for (LoadedProgram program : programs.values()) {
            TreeSet<String> calls = new TreeSet<>();
            for (COBOLParagraph paragraph : program.getProgram().allParagraphs()) {
                for (String call : paragraph.calls) {
                    calls.add(upper(call));
                }
            }
            graph.put(program.getProgramId(), new ArrayList<>(calls));
        }
        return graph;
    }

    private static String keyOf(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return upper(dot > 0 ? fileName.substring(0, dot) : fileName);
    }

    private static String upper(String name) {
        return name.toUpperCase(Locale.ROOT);
    }
}
