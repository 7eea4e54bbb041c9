package org.dxworks.coqu.workspace;

import org.dxworks.coqu.analyzer.cobol.preprocessor.CobolCopybookResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Copybook lookups for a set of search paths: file details, directory listings and
 * the tree of COPY statements below a copybook.
 */
public class CopybookCatalog {

    private static final Logger LOG = LoggerFactory.getLogger(CopybookCatalog.class);

    private static final Pattern COPY_PATTERN = Pattern.compile(
            "(?<![A-Z0-9-])COPY\\s+['\"]?([A-Z][A-Z0-9-]*)", Pattern.CASE_INSENSITIVE);

    private static final Set<String> COPYBOOK_EXTENSIONS = Set.of("cpy", "copy", "cbl", "cob");

    private final CobolCopybookResolver resolver;

    public CopybookCatalog(List<Path> searchPaths) {
        this.resolver = new CobolCopybookResolver(searchPaths);
    }

    public Optional<Path> resolve(String name, Path includingFile) {
        return resolver.resolve(name, includingFile);
    }

    public Optional<CopybookInfo> info(String name, Path includingFile) {
        return resolve(name, includingFile).flatMap(file -> read(name, file));
    }

    /**
     * Every file in {@code directory} with a copybook extension, ordered by file name.
     */
    public List<CopybookInfo> findAllInDirectory(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            return List.of();
        }

        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing.filter(Files::isRegularFile)
                    .filter(CopybookCatalog::hasCopybookExtension)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            LOG.warn("Could not list copybooks in {}: {}", directory, e.getMessage());
            return List.of();
        }

        List<CopybookInfo> result = new ArrayList<>();
        for (Path file : files) {
            read(stem(file), file).ifPresent(result::add);
        }
        return result;
    }

    /**
     * Resolves {@code name} and, recursively, every copybook it copies. A name that is already
     * on the path from the root is reported as circular and not expanded again.
     */
    public CopybookDependency dependencyTree(String name, Path includingFile) {
        return dependencyTree(name, includingFile, new HashSet<>());
    }

    private CopybookDependency dependencyTree(String name, Path includingFile, Set<String> ancestors) {
        String upper = name.toUpperCase(Locale.ROOT);
        if (ancestors.contains(upper)) {
            return CopybookDependency.circular(upper);
        }

        Optional<CopybookInfo> info = info(name, includingFile);
        if (info.isEmpty()) {
            return CopybookDependency.unresolved(upper);
        }

        Set<String> path = new HashSet<>(ancestors);
        path.add(upper);
        List<CopybookDependency> nested = new ArrayList<>();
        for (String ref : info.get().getNestedRefs()) {
            nested.add(dependencyTree(ref, info.get().getPath(), path));
        }
        return CopybookDependency.resolved(info.get(), nested);
    }

    private static Optional<CopybookInfo> read(String name, Path file) {
        try {
            String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            int lines = (int) content.chars().filter(c -> c == '\n').count() + 1;
            return Optional.of(new CopybookInfo(name.toUpperCase(Locale.ROOT), file, Files.size(file), lines,
                    nestedRefs(content)));
        } catch (IOException e) {
            LOG.warn("Could not read copybook {} at {}: {}", name, file, e.getMessage());
            return Optional.empty();
        }
    }

    static List<String> nestedRefs(String content) {
        Set<String> refs = new LinkedHashSet<>();
        for (String line : content.split("\r\n|\r|\n")) {
            String code = codeOf(line);
            Matcher m = COPY_PATTERN.matcher(code);
            while (m.find()) {
                refs.add(m.group(1).toUpperCase(Locale.ROOT));
            }
        }
        return new ArrayList<>(refs);
    }

    // drops comment lines and inline *> comments
    private static String codeOf(String line) {
        if (line.length() > 6 && (line.charAt(6) == '*' || line.charAt(6) == '/')) return "";
        String trimmed = line.trim();
        if (trimmed.startsWith("*")) return "";
        int inline = line.indexOf("*>");
        return inline >= 0 ? line.substring(0, inline) : line;
    }

    private static boolean hasCopybookExtension(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 && COPYBOOK_EXTENSIONS.contains(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private static String stem(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
