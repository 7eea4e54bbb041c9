package org.dxworks.coqu.analyzer.cobol.chunk;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex extraction of control and data flow from a fragment of procedure code, typically one
 * paragraph. Holds no state; one instance may serve any number of threads.
 */
public class ChunkAnalyzer {

    private static final String PARAGRAPH_NAME = "([A-Z0-9][A-Z0-9-]{0,29})";

    // END-PERFORM, END-CALL: the verb must not follow a hyphen
    private static final String VERB = "(?<![A-Z0-9-])";

    private static final Pattern PERFORM_SIMPLE = Pattern.compile(
            VERB + "PERFORM\\s+" + PARAGRAPH_NAME + "\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern PERFORM_THRU = Pattern.compile(
            VERB + "PERFORM\\s+" + PARAGRAPH_NAME + "\\s+(?:THRU|THROUGH)\\s+" + PARAGRAPH_NAME + "\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern CALL_LITERAL = Pattern.compile(
            VERB + "CALL\\s+['\"]([A-Z][A-Z0-9-]*)['\"]", Pattern.CASE_INSENSITIVE);

    private static final Pattern CALL_IDENTIFIER = Pattern.compile(
            VERB + "CALL\\s+([A-Z][A-Z0-9-]+)\\b(?!\\s*['\"])", Pattern.CASE_INSENSITIVE);

    private static final Pattern MOVE_PATTERN = Pattern.compile(
            VERB + "MOVE\\s+(?:CORR(?:ESPONDING)?\\s+)?('[^']*'|\"[^\"]*\"|\\S+)\\s+TO\\s+([A-Z][A-Z0-9-]*)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern GOTO_PATTERN = Pattern.compile(
            VERB + "GO\\s+TO\\s+" + PARAGRAPH_NAME + "\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern DATA_REF_PATTERN = Pattern.compile(
            "\\b([A-Z][A-Z0-9-]*(?:-[A-Z0-9]+)+)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern NUMERIC = Pattern.compile("\\d+");

    static final Set<String> PERFORM_KEYWORDS = Set.of(
            "UNTIL", "VARYING", "TIMES", "WITH", "TEST", "BEFORE", "AFTER",
            "THRU", "THROUGH", "END-PERFORM");

    static final Set<String> CALL_KEYWORDS = Set.of("USING", "BY", "REFERENCE", "CONTENT", "VALUE");

    static final Set<String> COBOL_KEYWORDS = Set.of(
            "IDENTIFICATION", "DIVISION", "PROGRAM-ID", "ENVIRONMENT", "DATA",
            "PROCEDURE", "WORKING-STORAGE", "SECTION", "LINKAGE", "FILE",
            "MOVE", "TO", "FROM", "PERFORM", "CALL", "USING", "BY", "REFERENCE",
            "CONTENT", "VALUE", "IF", "ELSE", "END-IF", "EVALUATE", "WHEN",
            "END-EVALUATE", "DISPLAY", "ACCEPT", "COMPUTE", "ADD", "SUBTRACT",
            "MULTIPLY", "DIVIDE", "STRING", "UNSTRING", "INSPECT", "REPLACING",
            "READ", "WRITE", "REWRITE", "DELETE", "START", "OPEN", "CLOSE",
            "INPUT", "OUTPUT", "I-O", "EXTEND", "GO", "STOP", "RUN", "EXIT",
            "CONTINUE", "INITIALIZE", "SET", "TRUE", "FALSE", "SPACES", "ZEROS",
            "HIGH-VALUES", "LOW-VALUES", "CORRESPONDING", "CORR", "NOT", "AND",
            "OR", "GREATER", "LESS", "EQUAL", "THAN", "PIC", "PICTURE", "OCCURS",
            "TIMES", "INDEXED", "REDEFINES", "FILLER", "COPY",
            "END-PERFORM", "END-READ", "END-WRITE", "END-CALL", "END-SEARCH", "END-STRING",
            "END-UNSTRING", "END-COMPUTE", "END-ADD", "END-SUBTRACT", "END-MULTIPLY", "END-DIVIDE",
            "END-EXEC", "END-RETURN", "END-REWRITE", "END-START", "END-DELETE", "NOT-AT-END");

    public ChunkAnalysis analyze(String chunk) {
        if (chunk == null || chunk.isBlank()) {
            return ChunkAnalysis.empty();
        }
        String upper = chunk.toUpperCase(Locale.ROOT);

        Set<String> performs = extractPerforms(upper);
        performs.addAll(extractGotos(upper));

        return new ChunkAnalysis(
                new ArrayList<>(performs),
                extractCalls(upper),
                extractMoves(upper),
                extractDataRefs(upper));
    }

    /**
     * Analyzes the inclusive 1-based line range of {@code sourceLines}, clamped to the lines present.
     */
    public ChunkAnalysis analyzeRange(List<String> sourceLines, int lineStart, int lineEnd) {
        return analyze(chunk(sourceLines, lineStart, lineEnd));
    }

    public static String chunk(List<String> sourceLines, int lineStart, int lineEnd) {
        if (sourceLines == null || sourceLines.isEmpty()) return "";
        int from = Math.max(0, lineStart - 1);
        int to = Math.min(sourceLines.size(), lineEnd);
        if (from >= to) return "";
        return String.join("\n", sourceLines.subList(from, to));
    }

    private Set<String> extractPerforms(String chunk) {
        Set<String> performs = new LinkedHashSet<>();
        Set<String> thruTargets = new LinkedHashSet<>();

        Matcher thru = PERFORM_THRU.matcher(chunk);
        while (thru.find()) {
            for (int group = 1; group <= 2; group++) {
                String target = thru.group(group);
                if (isPerformTarget(target)) {
                    performs.add(target);
                    thruTargets.add(target);
                }
            }
        }

        Matcher simple = PERFORM_SIMPLE.matcher(chunk);
        while (simple.find()) {
            String target = simple.group(1);
            if (isPerformTarget(target) && !thruTargets.contains(target)) {
                performs.add(target);
            }
        }
        return performs;
    }

    private static boolean isPerformTarget(String target) {
        // PERFORM 3 TIMES
        return !PERFORM_KEYWORDS.contains(target) && !NUMERIC.matcher(target).matches();
    }

    private List<String> extractGotos(String chunk) {
        List<String> gotos = new ArrayList<>();
        Matcher m = GOTO_PATTERN.matcher(chunk);
        while (m.find()) {
            String target = m.group(1);
            if (!NUMERIC.matcher(target).matches() && !gotos.contains(target)) {
                gotos.add(target);
            }
        }
        return gotos;
    }

    private List<String> extractCalls(String chunk) {
        // static calls first, then dynamic ones
        Set<String> calls = new LinkedHashSet<>();
        Matcher literal = CALL_LITERAL.matcher(chunk);
        while (literal.find()) {
            calls.add(literal.group(1));
        }
        Matcher identifier = CALL_IDENTIFIER.matcher(chunk);
        while (identifier.find()) {
            String target = identifier.group(1);
            if (!CALL_KEYWORDS.contains(target)) {
                calls.add(target);
            }
        }
        return new ArrayList<>(calls);
    }

    private List<MoveOperation> extractMoves(String chunk) {
        List<MoveOperation> moves = new ArrayList<>();
        Matcher m = MOVE_PATTERN.matcher(chunk);
        while (m.find()) {
            moves.add(new MoveOperation(m.group(1), m.group(2)));
        }
        return moves;
    }

    private List<String> extractDataRefs(String chunk) {
        Set<String> refs = new LinkedHashSet<>();
        Matcher m = DATA_REF_PATTERN.matcher(chunk);
        while (m.find()) {
            String name = m.group(1);
            if (!COBOL_KEYWORDS.contains(name)) {
                refs.add(name);
            }
        }
        return new ArrayList<>(refs);
    }
}
