package org.dxworks.coqu.analyzer.cobol.preprocessor;

import org.dxworks.coqu.analyzer.cobol.LineIndex;
import org.dxworks.coqu.model.cobol.CopybookRef;
import org.dxworks.coqu.model.cobol.CopybookStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Layout normalization and COPY expansion ahead of indexing.
 *
 * <p>The instance only holds the default search paths; everything a run accumulates
 * (visited copybooks, file contents, warnings) lives in a per-call {@link Run}, so one
 * preprocessor can be shared.
 *
 * <p>Each resolved file is inlined at most once per call. A later COPY of a file that was
 * already visited, including the source file itself, is reported as circular and left as written.
 */
public class CobolPreprocessor {

    private static final Logger LOG = LoggerFactory.getLogger(CobolPreprocessor.class);

    private static final Pattern COPY_PATTERN = Pattern.compile(
            "(?<![A-Z0-9-])COPY\\s+['\"]?([A-Z][A-Z0-9-]*)['\"]?"
                    + "(?:\\s+(?:OF|IN)\\s+([A-Z][A-Z0-9-]*))?"
                    + "(?:\\s+REPLACING\\s+(.+?))?"
                    + "\\s*\\.",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private final List<Path> searchPaths;

    public CobolPreprocessor() {
        this(List.of());
    }

    public CobolPreprocessor(List<Path> searchPaths) {
        this.searchPaths = searchPaths == null ? List.of() : List.copyOf(searchPaths);
    }

    public List<Path> getSearchPaths() {
        return searchPaths;
    }

    public PreprocessorResult preprocess(String source) {
        return preprocess(source, null, List.of());
    }

    public PreprocessorResult preprocess(String source, Path sourcePath) {
        return preprocess(source, sourcePath, List.of());
    }

    /**
     * Normalizes the layout of {@code source} and inlines every COPY that resolves.
     *
     * @param sourcePath  file the source was read from; its directory is searched first. May be {@code null}.
     * @param extraPaths  searched after the preprocessor's own search paths
     */
    public PreprocessorResult preprocess(String source, Path sourcePath, List<Path> extraPaths) {
        String original = source == null ? "" : source;
        String text = original.replace("\r\n", "\n").replace('\r', '\n');

        SourceFormat format = SourceFormatDetector.detect(text);
        String normalized = SourceFormatDetector.normalize(text, format);
        boolean rewritten = !normalized.equals(text);

        List<Path> paths = new ArrayList<>(searchPaths);
        if (extraPaths != null) paths.addAll(extraPaths);
        Run run = new Run(new CobolCopybookResolver(paths));

        String expanded;
        try {
            if (sourcePath != null) run.visited.add(key(sourcePath));
            expanded = run.expand(normalized, sourcePath);
        } catch (RuntimeException e) {
            LOG.warn("Preprocessing {} failed, continuing with the normalized source", sourcePath, e);
            run.errors.add("Preprocessing failed: " + e);
            expanded = normalized;
        }

        LOG.debug("Preprocessed {}: format {}, {} copybook refs, {} warnings",
                sourcePath == null ? "<memory>" : sourcePath, format.getTag(), run.refs.size(), run.warnings.size());
        return new PreprocessorResult(expanded, original, run.refs, run.warnings, run.errors, format, rewritten);
    }

    private static Path key(Path path) {
        return path.toAbsolutePath().normalize();
    }

    /**
     * True when the COPY keyword sits on a comment line or after an inline comment marker.
     */
    static boolean isCommentedOut(String text, int lineStart, int copyStart) {
        String before = text.substring(lineStart, copyStart);
        if (before.contains("*>")) return true;
        if (before.length() >= 7) {
            char indicator = before.charAt(6);
            if (indicator == '*' || indicator == '/') return true;
        }
        String trimmed = before.trim();
        return trimmed.startsWith("*") || trimmed.startsWith("/");
    }

    private static final class Splice {
        final int start;
        final int end;
        final String replacement;

        Splice(int start, int end, String replacement) {
            this.start = start;
            this.end = end;
            this.replacement = replacement;
        }
    }

    private static final class Run {
        private final CobolCopybookResolver resolver;
        private final Map<Path, String> contents = new HashMap<>();
        private final Set<Path> visited = new HashSet<>();
        private final List<CopybookRef> refs = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private final List<String> errors = new ArrayList<>();

        Run(CobolCopybookResolver resolver) {
            this.resolver = resolver;
        }

        /**
         * Inlines the COPY statements of {@code text} in source order.
         */
        String expand(String text, Path owner) {
            LineIndex lines = LineIndex.of(text);
            List<Splice> splices = new ArrayList<>();

            Matcher m = COPY_PATTERN.matcher(text);
            while (m.find()) {
                int line = lines.lineOf(m.start());
                int lineStart = lines.startOf(line);
                if (isCommentedOut(text, lineStart, m.start())) continue;

                String replacing = m.group(3) == null ? null : m.group(3).trim();
                String library = m.group(2) == null ? null : m.group(2).toUpperCase(Locale.ROOT);
                CopybookRef ref = new CopybookRef(m.group(1).toUpperCase(Locale.ROOT), line, library, replacing);
                refs.add(ref);

                Optional<Path> resolved = resolver.resolve(m.group(1), owner);
                if (resolved.isEmpty()) {
                    warnings.add("Copybook '" + ref.name + "' not found in search paths (referenced at line " + line + ")");
                    continue;
                }
                ref.markResolved(resolved.get());

                String body = inline(ref, resolved.get());
                if (body == null) continue;

                boolean ownLine = text.substring(lineStart, m.start()).isBlank();
                int start = ownLine ? lineStart : m.start();
                int periodLine = lines.lineOf(m.end() - 1);
                String rest = text.substring(m.end(), lines.endOf(periodLine)).replace("\n", "");

                StringBuilder replacement = new StringBuilder();
                if (!ownLine) replacement.append('\n');
                replacement.append("      * COPY ").append(ref.name)
                        .append(" - BEGIN (from ").append(resolved.get().getFileName()).append(")\n")
                        .append(body).append('\n')
                        .append("      * COPY ").append(ref.name).append(" - END");
                if (!rest.isBlank()) replacement.append('\n');
                splices.add(new Splice(start, m.end(), replacement.toString()));
            }

            if (splices.isEmpty()) return text;
            StringBuilder out = new StringBuilder(text);
            for (int i = splices.size() - 1; i >= 0; i--) {
                Splice splice = splices.get(i);
                out.replace(splice.start, splice.end, splice.replacement);
            }
            return out.toString();
        }

        /**
         * Body to splice in for one resolved reference, or {@code null} when it must stay as written.
         */
        private String inline(CopybookRef ref, Path file) {
            Path key = key(file);
            if (!visited.add(key)) {
                warnings.add("Circular copybook reference detected: " + ref.name);
                return null;
            }

            String content;
            try {
                content = read(key);
            } catch (IOException e) {
                ref.status = CopybookStatus.ERROR;
                warnings.add("Error reading copybook '" + ref.name + "': " + e.getMessage());
                LOG.warn("Could not read copybook {} from {}: {}", ref.name, key, e.getMessage());
                return null;
            }

            if (ref.replacing != null) {
                content = ReplacingClause.parse(ref.replacing).apply(content);
            }
            content = SourceFormatDetector.normalize(content, SourceFormatDetector.detect(content));

            content = expand(content, file);

            if (content.endsWith("\n")) {
                content = content.substring(0, content.length() - 1);
            }
            return content;
        }

        private String read(Path key) throws IOException {
            String cached = contents.get(key);
            if (cached != null) return cached;
            String content = new String(Files.readAllBytes(key), StandardCharsets.UTF_8)
                    .replace("\r\n", "\n").replace('\r', '\n');
            contents.put(key, content);
            return content;
        }
    }
}
