package org.dxworks.coqu.analyzer.cobol.preprocessor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Resolves COPY names to copybook files.
 *
 * - Looks in the including file's directory first, then in the search paths, in order.
 * - In each directory, tries every known extension with the lower, upper and as-written name.
 * - When none of those exists, falls back to a case-insensitive listing of the directory; duplicate
 *   names in one directory are logged and the shortest path wins.
 *
 * Directory listings are kept for the lifetime of the resolver, so one instance serves one
 * preprocessing run.
 */
public final class CobolCopybookResolver {

    private static final Logger LOG = LoggerFactory.getLogger(CobolCopybookResolver.class);

    static final List<String> EXTENSIONS = List.of(
            ".cpy", ".copy", ".cbl", ".cob", ".CPY", ".COPY", ".CBL", ".COB", "");

    private static final Set<String> KNOWN_EXTENSIONS = Set.of("cpy", "copy", "cbl", "cob");

    private final List<Path> searchPaths;
    private final Map<Path, Map<String, Path>> listings = new HashMap<>();

    public CobolCopybookResolver(List<Path> searchPaths) {
        this.searchPaths = searchPaths == null ? List.of() : List.copyOf(searchPaths);
    }

    public List<Path> getSearchPaths() {
        return searchPaths;
    }

    /**
     * @param name        copybook name as written in the COPY statement, quotes allowed
     * @param includingFile file holding the COPY statement, or {@code null} for in-memory sources
     */
    public Optional<Path> resolve(String name, Path includingFile) {
        String token = normalizeCopybookToken(name);
        if (token.isEmpty()) return Optional.empty();

        List<Path> directories = directoriesFor(includingFile);
        Set<String> variants = new LinkedHashSet<>(List.of(
                token.toLowerCase(Locale.ROOT), token.toUpperCase(Locale.ROOT), token));

        for (Path dir : directories) {
            for (String ext : EXTENSIONS) {
                for (String variant : variants) {
                    Path candidate = dir.resolve(variant + ext);
                    if (Files.isRegularFile(candidate)) {
                        return Optional.of(candidate);
                    }
                }
            }
        }

        for (Path dir : directories) {
            Path hit = listing(dir).get(token.toLowerCase(Locale.ROOT));
            if (hit != null) {
                LOG.debug("Copybook {} resolved case-insensitively to {}", name, hit);
                return Optional.of(hit);
            }
        }
        return Optional.empty();
    }

    private List<Path> directoriesFor(Path includingFile) {
        List<Path> directories = new ArrayList<>();
        if (includingFile != null) {
            Path parent = includingFile.toAbsolutePath().getParent();
            if (parent != null) directories.add(parent);
        }
        directories.addAll(searchPaths);
        return directories.stream()
                .filter(Objects::nonNull)
                .filter(Files::isDirectory)
                .distinct()
                .collect(Collectors.toList());
    }

    private Map<String, Path> listing(Path dir) {
        return listings.computeIfAbsent(dir.toAbsolutePath().normalize(), CobolCopybookResolver::indexDirectory);
    }

    private static Map<String, Path> indexDirectory(Path dir) {
        Map<String, List<Path>> candidatesByKey = new HashMap<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(Files::isRegularFile).forEach(file -> {
                String fileName = file.getFileName().toString();
                String extension = extensionOf(fileName);
                if (!extension.isEmpty() && !KNOWN_EXTENSIONS.contains(extension.toLowerCase(Locale.ROOT))) {
                    return;
                }
                String key = normalizeCopybookToken(stripExtension(fileName)).toLowerCase(Locale.ROOT);
                candidatesByKey.computeIfAbsent(key, k -> new ArrayList<>()).add(file);
            });
        } catch (IOException e) {
            LOG.warn("Could not list copybook directory {}: {}", dir, e.getMessage());
            return Collections.emptyMap();
        }

        logDuplicates(dir, candidatesByKey);

        Map<String, Path> index = new HashMap<>();
        for (Map.Entry<String, List<Path>> e : candidatesByKey.entrySet()) {
            index.put(e.getKey(), pickWinner(e.getValue()));
        }
        return index;
    }

    private static void logDuplicates(Path dir, Map<String, List<Path>> candidatesByKey) {
        Map<String, List<Path>> dupes = new TreeMap<>();
        for (Map.Entry<String, List<Path>> e : candidatesByKey.entrySet()) {
            if (e.getValue().size() > 1) {
                dupes.put(e.getKey(), e.getValue());
            }
        }
        if (dupes.isEmpty() || !LOG.isWarnEnabled()) {
            return;
        }
        for (Map.Entry<String, List<Path>> e : dupes.entrySet()) {
            LOG.warn("Duplicate copybook name '{}' in {}: {}", e.getKey(), dir, e.getValue());
        }
    }

    /**
     * Shortest absolute path first, then the lexicographically smallest.
     */
    static Path pickWinner(List<Path> candidates) {
        Collection<Path> unique = candidates.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toMap(
                        p -> p.toAbsolutePath().toString(),
                        p -> p,
                        (a, b) -> a,
                        LinkedHashMap::new
                ))
                .values();

        return unique.stream()
                .min(Comparator
                        .comparingInt((Path p) -> p.toAbsolutePath().toString().length())
                        .thenComparing(p -> p.toAbsolutePath().toString()))
                .orElseThrow(() -> new IllegalArgumentException("No copybook candidates"));
    }

    static String normalizeCopybookToken(String token) {
        if (token == null) return "";
        String t = stripQuotes(token.trim());

        // Trailing punctuation left over from the statement
        t = t.replaceAll("[.;,]+$", "");

        t = t.replace('\\', '/');
        int slash = t.lastIndexOf('/');
        if (slash >= 0 && slash + 1 < t.length()) {
            t = t.substring(slash + 1);
        }
        return t;
    }

    private static String stripQuotes(String t) {
        if (t.length() >= 2
                && ((t.startsWith("\"") && t.endsWith("\"")) || (t.startsWith("'") && t.endsWith("'")))) {
            return t.substring(1, t.length() - 1).trim();
        }
        return t;
    }

    private static String stripExtension(String fileName) {
        int lastDot = fileName.lastIndexOf('.');
        if (lastDot <= 0) return fileName;
        return fileName.substring(0, lastDot);
    }

    private static String extensionOf(String fileName) {
        int lastDot = fileName.lastIndexOf('.');
        if (lastDot <= 0) return "";
        return fileName.substring(lastDot + 1);
    }
}
