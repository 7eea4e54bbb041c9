package org.dxworks.coqu.analyzer.cobol.index;

import org.dxworks.coqu.analyzer.cobol.LineIndex;
import org.dxworks.coqu.model.index.EntryCategory;
import org.dxworks.coqu.model.index.IndexEntry;
import org.dxworks.coqu.model.index.StatementEntry;
import org.dxworks.coqu.model.index.StructuralIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-based structural indexer for COBOL sources of any size.
 *
 * <p>No grammar is involved: each category is found by its own pattern, all of them sharing an
 * optional {@link #PREFIX} that absorbs the legacy column conventions:
 * <ul>
 *   <li>6-digit sequence numbers ({@code 000100})</li>
 *   <li>6 to 8 blank columns</li>
 *   <li>short version markers with an optional area letter ({@code 1.1}, {@code 07.141}, {@code 7.682A})</li>
 * </ul>
 * The whitespace after a marker is mandatory; that is what separates the marker from code.
 *
 * <p>Sources above {@code windowThresholdChars} are scanned in windows of {@code windowLines}
 * lines, reporting progress after each window. Smaller sources get one pass per category.
 * Missing or garbled structure yields fewer entries, never an exception.
 */
public class StructuralIndexer {

    private static final Logger LOG = LoggerFactory.getLogger(StructuralIndexer.class);

    public static final int DEFAULT_WINDOW_THRESHOLD_CHARS = 500_000;
    public static final int DEFAULT_WINDOW_LINES = 10_000;

    static final String PREFIX = "^(?:[\\d.]{1,6}[A-B]?\\s+|\\s{6,8})?";

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.MULTILINE;

    private static final Pattern DIVISION_PATTERN = Pattern.compile(
            PREFIX + "\\s*(IDENTIFICATION|ID|ENVIRONMENT|DATA|PROCEDURE)\\s+DIVISION", FLAGS);

    private static final Pattern SECTION_PATTERN = Pattern.compile(
            PREFIX + "\\s*([A-Z0-9][A-Z0-9-]*)\\s+SECTION\\b", FLAGS);

    // Name directly after the prefix, alone on its line and closed by a period
    private static final Pattern PARAGRAPH_PATTERN = Pattern.compile(
            PREFIX + "([A-Z0-9][A-Z0-9-]{0,29})\\s*\\.(?=[ \\t]*$)", FLAGS);

    private static final Pattern COPY_PATTERN = Pattern.compile(
            PREFIX + "\\s*COPY\\s+['\"]?([A-Z][A-Z0-9-]*)['\"]?", FLAGS);

    private static final Pattern LEVEL_01_PATTERN = Pattern.compile(
            PREFIX + "\\s*01\\s+([A-Z][A-Z0-9-]*)", FLAGS);

    private static final Pattern DATA_ITEM_PATTERN = Pattern.compile(
            PREFIX + "\\s*(0?[1-9]|[1-4][0-9]|66|77|88)\\s+([A-Z][A-Z0-9-]*)", FLAGS);

    private static final Pattern PROGRAM_ID_PATTERN = Pattern.compile(
            PREFIX + "\\s*(PROGRAM-ID)\\s*[.\\s]+['\"]?([A-Z][A-Z0-9-]*)", FLAGS);

    private static final Map<String, Pattern> ID_ENTRY_PATTERNS = patterns(
            "AUTHOR", "\\s*(AUTHOR)\\s*[.\\s]+",
            "DATE-WRITTEN", "\\s*(DATE-WRITTEN)\\s*[.\\s]+",
            "DATE-COMPILED", "\\s*(DATE-COMPILED)\\s*[.\\s]+");

    private static final Pattern FILE_CONTROL_PATTERN = Pattern.compile(
            PREFIX + "\\s*(FILE-CONTROL)\\s*\\.?", FLAGS);

    private static final Map<String, Pattern> FILE_NAME_PATTERNS = patterns(
            "SELECT", "\\s*(SELECT)\\s+(?:OPTIONAL\\s+)?([A-Z][A-Z0-9-]*)",
            "FD", "\\s*(FD)\\s+([A-Z][A-Z0-9-]*)",
            "SD", "\\s*(SD)\\s+([A-Z][A-Z0-9-]*)");

    private static final Map<String, Pattern> SELECT_CLAUSE_PATTERNS = patterns(
            "ORGANIZATION", "\\s+(ORGANIZATION)(?=\\s)",
            "ACCESS", "\\s+(ACCESS\\s+MODE)(?=\\s)",
            "RECORD-KEY", "\\s+(RECORD\\s+KEY)(?=\\s)",
            "ALTERNATE-KEY", "\\s+(ALTERNATE\\s+RECORD\\s+KEY)(?=\\s)",
            "FILE-STATUS", "\\s+(FILE\\s+STATUS)(?=\\s)",
            "ASSIGN", "\\s+(ASSIGN)(?=\\s)",
            "RELATIVE-KEY", "\\s+(RELATIVE\\s+KEY)(?=\\s)");

    private static final Map<String, Pattern> STATEMENT_PATTERNS = patterns(
            "MOVE", "\\s+(MOVE)(?=\\s)",
            "PERFORM", "\\s+(PERFORM)(?=\\s)",
            "CALL", "\\s+(CALL)(?=\\s)",
            "IF", "\\s+(IF)(?=\\s)",
            "EVALUATE", "\\s+(EVALUATE)(?=\\s)",
            "READ", "\\s+(READ)(?=\\s)",
            "WRITE", "\\s+(WRITE)(?=\\s)",
            "OPEN", "\\s+(OPEN)(?=\\s)",
            "CLOSE", "\\s+(CLOSE)(?=\\s)",
            "DISPLAY", "\\s+(DISPLAY)(?=\\s)",
            "ACCEPT", "\\s+(ACCEPT)(?=\\s)",
            "COMPUTE", "\\s+(COMPUTE)(?=\\s)",
            "ADD", "\\s+(ADD)(?=\\s)",
            "SUBTRACT", "\\s+(SUBTRACT)(?=\\s)",
            "MULTIPLY", "\\s+(MULTIPLY)(?=\\s)",
            "DIVIDE", "\\s+(DIVIDE)(?=\\s)",
            "STRING", "\\s+(STRING)(?=\\s)",
            "UNSTRING", "\\s+(UNSTRING)(?=\\s)",
            "INSPECT", "\\s+(INSPECT)(?=\\s)",
            "INITIALIZE", "\\s+(INITIALIZE)(?=\\s)",
            "SET", "\\s+(SET)(?=\\s)",
            "STOP", "\\s+(STOP)(?=\\s)",
            "GO", "\\s+(GO\\s+TO)(?=\\s)",
            "EXIT", "\\s+(EXIT)\\b",
            "CONTINUE", "\\s+(CONTINUE)\\b",
            "RETURN", "\\s+(RETURN)(?=\\s)",
            "SEARCH", "\\s+(SEARCH)(?=\\s)",
            "SORT", "\\s+(SORT)(?=\\s)",
            "MERGE", "\\s+(MERGE)(?=\\s)",
            "START", "\\s+(START)(?=\\s)",
            "DELETE", "\\s+(DELETE)(?=\\s)",
            "REWRITE", "\\s+(REWRITE)(?=\\s)");

    private static final Map<String, Pattern> END_STATEMENT_PATTERNS = patterns(
            "END-IF", "\\s+(END-IF)\\b",
            "END-READ", "\\s+(END-READ)\\b",
            "END-WRITE", "\\s+(END-WRITE)\\b",
            "END-PERFORM", "\\s+(END-PERFORM)\\b",
            "END-EVALUATE", "\\s+(END-EVALUATE)\\b",
            "END-CALL", "\\s+(END-CALL)\\b",
            "END-SEARCH", "\\s+(END-SEARCH)\\b",
            "END-STRING", "\\s+(END-STRING)\\b",
            "END-UNSTRING", "\\s+(END-UNSTRING)\\b",
            "END-COMPUTE", "\\s+(END-COMPUTE)\\b",
            "END-ADD", "\\s+(END-ADD)\\b",
            "END-SUBTRACT", "\\s+(END-SUBTRACT)\\b",
            "END-MULTIPLY", "\\s+(END-MULTIPLY)\\b",
            "END-DIVIDE", "\\s+(END-DIVIDE)\\b",
            "AT-END", "\\s+(AT\\s+END)(?=\\s)",
            "NOT-AT-END", "\\s+(NOT\\s+AT\\s+END)(?=\\s)",
            "INVALID-KEY", "\\s+(INVALID\\s+KEY)(?=\\s)",
            "NOT-INVALID-KEY", "\\s+(NOT\\s+INVALID\\s+KEY)(?=\\s)",
            "WHEN", "\\s+(WHEN)(?=\\s)",
            "ELSE", "\\s+(ELSE)(?=[ \\t]*$)",
            "THEN", "\\s+(THEN)(?=[ \\t]*$)");

    // EXEC SQL INCLUDE may sit in the DATA DIVISION, so this one is never scoped or windowed
    private static final Pattern EXEC_PATTERN = Pattern.compile(
            PREFIX + "\\s*(EXEC\\s+(SQL|CICS)\\b.*?END-EXEC)", FLAGS | Pattern.DOTALL);

    private static final Set<String> PARAGRAPH_KEYWORDS = Set.of("DIVISION", "SECTION", "END", "EXIT");

    // A level number followed by a clause keyword is an unnamed FILLER
    private static final Set<String> DATA_CLAUSE_WORDS = Set.of(
            "PIC", "PICTURE", "VALUE", "VALUES", "USAGE", "OCCURS", "REDEFINES", "COMP", "COMP-3");

    private static final String[] STAGES = {
            "divisions", "sections", "paragraphs", "copybooks", "data items",
            "identification", "file control", "statements", "exec blocks"
    };

    private final int windowThresholdChars;
    private final int windowLines;

    public StructuralIndexer() {
        this(DEFAULT_WINDOW_THRESHOLD_CHARS, DEFAULT_WINDOW_LINES);
    }

    public StructuralIndexer(int windowThresholdChars, int windowLines) {
        this.windowThresholdChars = windowThresholdChars > 0 ? windowThresholdChars : DEFAULT_WINDOW_THRESHOLD_CHARS;
        this.windowLines = windowLines > 0 ? windowLines : DEFAULT_WINDOW_LINES;
    }

    public StructuralIndex index(String source) {
        return index(source, IndexProgressListener.NONE);
    }

    public StructuralIndex index(String source, IndexProgressListener listener) {
        long started = System.nanoTime();
        String text = normalizeLineEndings(source == null ? "" : source);
        Scan scan = new Scan(text, listener == null ? IndexProgressListener.NONE : listener);
        StructuralIndex index = scan.run();
        if (LOG.isDebugEnabled()) {
            LOG.debug("Indexed {} lines ({}) in {} ms: {} divisions, {} sections, {} paragraphs, {} statements",
                    index.getTotalLines(), scan.windowed ? "windowed" : "single pass",
                    (System.nanoTime() - started) / 1_000_000,
                    index.getDivisions().size(), index.getSections().size(),
                    index.getParagraphs().size(), index.getStatements().size());
        }
        return index;
    }

    static String normalizeLineEndings(String source) {
        if (source.indexOf('\r') < 0) return source;
        return source.replace("\r\n", "\n").replace('\r', '\n');
    }

    private static Map<String, Pattern> patterns(String... keysAndBodies) {
        Map<String, Pattern> result = new LinkedHashMap<>();
        for (int i = 0; i < keysAndBodies.length; i += 2) {
            result.put(keysAndBodies[i], Pattern.compile(PREFIX + keysAndBodies[i + 1], FLAGS));
        }
        return result;
    }

    @FunctionalInterface
    private interface MatchSink {
        void accept(int patternIndex, Matcher matcher);
    }

    /**
     * State of one {@link #index} call.
     */
    private final class Scan {
        private final String text;
        private final LineIndex lines;
        private final IndexProgressListener listener;
        private final boolean windowed;

        private final List<IndexEntry> divisions = new ArrayList<>();
        private final List<IndexEntry> sections = new ArrayList<>();
        private final List<IndexEntry> paragraphs = new ArrayList<>();
        private final List<IndexEntry> copybooks = new ArrayList<>();
        private final List<IndexEntry> level01 = new ArrayList<>();
        private final List<IndexEntry> dataItems = new ArrayList<>();
        private final List<IndexEntry> idEntries = new ArrayList<>();
        private final List<IndexEntry> fileEntries = new ArrayList<>();
        private final List<StatementEntry> statements = new ArrayList<>();
        private final List<StatementEntry> execStatements = new ArrayList<>();

        private int stage;

        Scan(String text, IndexProgressListener listener) {
            this.text = text;
            this.lines = LineIndex.of(text);
            this.listener = listener;
            this.windowed = text.length() > windowThresholdChars;
        }

        StructuralIndex run() {
            int end = text.length();

            scanStage(List.of(DIVISION_PATTERN), 0, end, (i, m) -> divisions.add(IndexEntry.pending(
                    upper(m.group(1)) + " DIVISION", EntryCategory.DIVISION, lineOfGroup(m, 1))));
            divisions.sort(Comparator.comparingInt(IndexEntry::getLineStart));

            scanStage(List.of(SECTION_PATTERN), 0, end, (i, m) -> sections.add(IndexEntry.pending(
                    upper(m.group(1)) + " SECTION", EntryCategory.SECTION, lineOfGroup(m, 1))));

            IndexEntry procedure = divisions.stream()
                    .filter(d -> d.getName().startsWith("PROCEDURE"))
                    .findFirst()
                    .orElse(null);
            int procOffset = procedure == null ? -1 : lines.startOf(procedure.getLineStart());

            if (procOffset >= 0) {
                scanStage(List.of(PARAGRAPH_PATTERN), procOffset, end, (i, m) -> {
                    String name = upper(m.group(1));
                    if (name.endsWith("SECTION") || PARAGRAPH_KEYWORDS.contains(name)) return;
                    paragraphs.add(IndexEntry.pending(name, EntryCategory.PARAGRAPH, lineOfGroup(m, 1)));
                });
            } else {
                skipStage();
            }

            scanStage(List.of(COPY_PATTERN), 0, end, (i, m) -> copybooks.add(IndexEntry.pending(
                    upper(m.group(1)), EntryCategory.COPYBOOK, lineOfGroup(m, 1))));

            scanStage(List.of(LEVEL_01_PATTERN, DATA_ITEM_PATTERN), 0, end, (i, m) -> {
                if (i == 0) {
                    level01.add(IndexEntry.pending(dataName(m.group(1)), EntryCategory.DATA_ITEM, lineOfGroup(m, 1)));
                } else {
                    String level = String.format(Locale.ROOT, "%02d", Integer.parseInt(m.group(1)));
                    dataItems.add(IndexEntry.pending(level + " " + dataName(m.group(2)),
                            EntryCategory.DATA_ITEM, lineOfGroup(m, 1)));
                }
            });

            List<String> idKeys = new ArrayList<>(ID_ENTRY_PATTERNS.keySet());
            List<Pattern> idPatterns = new ArrayList<>();
            idPatterns.add(PROGRAM_ID_PATTERN);
            idPatterns.addAll(ID_ENTRY_PATTERNS.values());
            scanStage(idPatterns, 0, end, (i, m) -> {
                String name = i == 0 ? "PROGRAM-ID " + upper(m.group(2)) : idKeys.get(i - 1);
                idEntries.add(IndexEntry.pending(name, EntryCategory.ID_ENTRY, lineOfGroup(m, 1)));
            });

            List<String> fileKeys = new ArrayList<>(FILE_NAME_PATTERNS.keySet());
            List<String> clauseKeys = new ArrayList<>(SELECT_CLAUSE_PATTERNS.keySet());
            List<Pattern> filePatterns = new ArrayList<>();
            filePatterns.add(FILE_CONTROL_PATTERN);
            filePatterns.addAll(FILE_NAME_PATTERNS.values());
            filePatterns.addAll(SELECT_CLAUSE_PATTERNS.values());
            int fileScopeEnd = procOffset >= 0 ? procOffset : end;
            scanStage(filePatterns, 0, fileScopeEnd, (i, m) -> {
                int line = lineOfGroup(m, 1);
                if (i == 0) {
                    fileEntries.add(IndexEntry.pending("FILE-CONTROL", EntryCategory.FILE_ENTRY, line));
                } else if (i <= fileKeys.size()) {
                    fileEntries.add(IndexEntry.pending(fileKeys.get(i - 1) + " " + upper(m.group(2)),
                            EntryCategory.FILE_ENTRY, line));
                } else {
                    fileEntries.add(IndexEntry.pending(clauseKeys.get(i - 1 - fileKeys.size()),
                            EntryCategory.FILE_CLAUSE, line));
                }
            });

            List<IndexEntry> finalDivisions = finalizeDivisions();
            List<IndexEntry> finalSections = finalizeSections(finalDivisions);
            List<IndexEntry> finalParagraphs = finalizeParagraphs(finalDivisions, finalSections);

            if (procOffset >= 0) {
                int[] paraStarts = finalParagraphs.stream().mapToInt(IndexEntry::getLineStart).toArray();
                List<String> keys = new ArrayList<>(STATEMENT_PATTERNS.keySet());
                keys.addAll(END_STATEMENT_PATTERNS.keySet());
                List<Pattern> statementPatterns = new ArrayList<>(STATEMENT_PATTERNS.values());
                statementPatterns.addAll(END_STATEMENT_PATTERNS.values());
                scanStage(statementPatterns, procOffset, end, (i, m) -> {
                    int line = lineOfGroup(m, 1);
                    statements.add(new StatementEntry(keys.get(i), line, line,
                            containingParagraph(finalParagraphs, paraStarts, line)));
                });
                statements.sort(Comparator.comparingInt(StatementEntry::getLineStart));
            } else {
                skipStage();
            }

            int[] paraStarts = finalParagraphs.stream().mapToInt(IndexEntry::getLineStart).toArray();
            Matcher exec = EXEC_PATTERN.matcher(text);
            while (exec.find()) {
                int start = lineOfGroup(exec, 1);
                int stop = lines.lineOf(exec.end(1) - 1);
                execStatements.add(new StatementEntry("EXEC-" + upper(exec.group(2)), start, stop,
                        containingParagraph(finalParagraphs, paraStarts, start)));
            }
            execStatements.sort(Comparator.comparingInt(StatementEntry::getLineStart));
            listener.onProgress(STAGES[STAGES.length - 1], 100);

            return new StructuralIndex(
                    lines.lineCount(),
                    finalDivisions,
                    finalSections,
                    finalParagraphs,
                    singleLine(copybooks),
                    singleLine(level01),
                    singleLine(dataItems),
                    singleLine(idEntries),
                    singleLine(fileEntries),
                    statements,
                    execStatements);
        }

        /**
         * Runs every pattern over [from, to), window by window when the source is large,
         * and reports progress after each window.
         */
        private void scanStage(List<Pattern> patterns, int from, int to, MatchSink sink) {
            String stageName = STAGES[stage];
            if (!windowed) {
                scanRegion(patterns, from, to, sink);
                listener.onProgress(stageName, percent(stage, 1, 1));
                stage++;
                return;
            }
            int windowCount = Math.max(1, (lines.lineCount() + windowLines - 1) / windowLines);
            for (int w = 0; w < windowCount; w++) {
                int windowStart = Math.max(from, lines.startOf(w * windowLines + 1));
                int windowEnd = Math.min(to, lines.startOf((w + 1) * windowLines + 1));
                if (w == windowCount - 1) {
                    windowEnd = to;
                }
                if (windowStart < windowEnd) {
                    scanRegion(patterns, windowStart, windowEnd, sink);
                }
                listener.onProgress(stageName, percent(stage, w + 1, windowCount));
            }
            stage++;
        }

        private void scanRegion(List<Pattern> patterns, int from, int to, MatchSink sink) {
            for (int i = 0; i < patterns.size(); i++) {
                Matcher matcher = patterns.get(i).matcher(text);
                matcher.region(from, to);
                while (matcher.find()) {
                    sink.accept(i, matcher);
                }
            }
        }

        private void skipStage() {
            listener.onProgress(STAGES[stage], percent(stage, 1, 1));
            stage++;
        }

        private int percent(int stageIndex, int done, int total) {
            // the last stage (exec blocks) reports 100 on its own
            double perStage = 100.0 / STAGES.length;
            return (int) Math.min(99, Math.floor(stageIndex * perStage + perStage * done / total));
        }

        private int lineOfGroup(Matcher m, int group) {
            return lines.lineOf(m.start(group));
        }

        private List<IndexEntry> finalizeDivisions() {
            List<IndexEntry> result = new ArrayList<>(divisions.size());
            for (int i = 0; i < divisions.size(); i++) {
                int end = i + 1 < divisions.size()
                        ? divisions.get(i + 1).getLineStart() - 1
                        : lines.lineCount();
                result.add(divisions.get(i).withLineEnd(end));
            }
            return result;
        }

        private List<IndexEntry> finalizeSections(List<IndexEntry> finalDivisions) {
            sections.sort(Comparator.comparingInt(IndexEntry::getLineStart));
            List<IndexEntry> result = new ArrayList<>(sections.size());
            for (int i = 0; i < sections.size(); i++) {
                IndexEntry section = sections.get(i);
                int containerEnd = enclosingEnd(finalDivisions, section.getLineStart(), lines.lineCount());
                int end = containerEnd;
                if (i + 1 < sections.size() && sections.get(i + 1).getLineStart() <= containerEnd) {
                    end = sections.get(i + 1).getLineStart() - 1;
                }
                result.add(section.withLineEnd(end));
            }
            return result;
        }

        private List<IndexEntry> finalizeParagraphs(List<IndexEntry> finalDivisions, List<IndexEntry> finalSections) {
            paragraphs.sort(Comparator.comparingInt(IndexEntry::getLineStart));
            IndexEntry procedure = finalDivisions.stream()
                    .filter(d -> d.getName().startsWith("PROCEDURE"))
                    .findFirst()
                    .orElse(null);
            int procedureEnd = procedure == null ? lines.lineCount() : procedure.getLineEnd();
            List<IndexEntry> procedureSections = new ArrayList<>();
            if (procedure != null) {
                for (IndexEntry section : finalSections) {
                    if (procedure.contains(section.getLineStart())) procedureSections.add(section);
                }
            }

            List<IndexEntry> result = new ArrayList<>(paragraphs.size());
            for (int i = 0; i < paragraphs.size(); i++) {
                IndexEntry paragraph = paragraphs.get(i);
                int containerEnd = enclosingEnd(procedureSections, paragraph.getLineStart(), procedureEnd);
                int end = containerEnd;
                if (i + 1 < paragraphs.size() && paragraphs.get(i + 1).getLineStart() <= containerEnd) {
                    end = paragraphs.get(i + 1).getLineStart() - 1;
                }
                result.add(paragraph.withLineEnd(end));
            }
            return result;
        }
    }

    /**
     * End line of the container holding {@code line}, or {@code fallback} when none does.
     */
    private static int enclosingEnd(List<IndexEntry> containers, int line, int fallback) {
        for (IndexEntry container : containers) {
            if (container.contains(line)) return container.getLineEnd();
        }
        return fallback;
    }

    private static String containingParagraph(List<IndexEntry> paragraphs, int[] starts, int line) {
        int pos = Arrays.binarySearch(starts, line);
        if (pos < 0) {
            pos = -pos - 2;
        } else {
            // several paragraphs can never share a line, but keep the last one if they do
            while (pos + 1 < starts.length && starts[pos + 1] == line) pos++;
        }
        return pos >= 0 ? paragraphs.get(pos).getName() : "";
    }

    private static List<IndexEntry> singleLine(List<IndexEntry> entries) {
        entries.sort(Comparator.comparingInt(IndexEntry::getLineStart));
        List<IndexEntry> result = new ArrayList<>(entries.size());
        for (IndexEntry entry : entries) {
            result.add(entry.withLineEnd(entry.getLineStart()));
        }
        return result;
    }

    private static String dataName(String raw) {
        String name = upper(raw);
        return DATA_CLAUSE_WORDS.contains(name) ? "FILLER" : name;
    }

    private static String upper(String s) {
        return s.toUpperCase(Locale.ROOT);
    }
}
