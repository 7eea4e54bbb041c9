package org.dxworks.coqu.analyzer.cobol;

import org.dxworks.coqu.analyzer.cobol.chunk.ChunkAnalysis;
import org.dxworks.coqu.analyzer.cobol.chunk.ChunkAnalyzer;
import org.dxworks.coqu.analyzer.cobol.chunk.MoveOperation;
import org.dxworks.coqu.model.cobol.COBOLComment;
import org.dxworks.coqu.model.cobol.COBOLDataItem;
import org.dxworks.coqu.model.cobol.COBOLDivision;
import org.dxworks.coqu.model.cobol.COBOLParagraph;
import org.dxworks.coqu.model.cobol.COBOLProgram;
import org.dxworks.coqu.model.cobol.COBOLSection;
import org.dxworks.coqu.model.cobol.COBOLStatement;
import org.dxworks.coqu.model.cobol.CopybookRef;
import org.dxworks.coqu.model.index.IndexEntry;
import org.dxworks.coqu.model.index.StatementEntry;
import org.dxworks.coqu.model.index.StructuralIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a {@link StructuralIndex} and the source it was built from into a {@link COBOLProgram}.
 */
public class COBOLProgramBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(COBOLProgramBuilder.class);

    public static final String UNKNOWN_PROGRAM_ID = "UNKNOWN";

    private static final int INDICATOR_COLUMN = 6;
    private static final int MAX_CLAUSE_LINES = 10;

    private static final Pattern QUOTED = Pattern.compile("'[^']*'|\"[^\"]*\"");
    private static final Pattern PICTURE = Pattern.compile(
            "\\bPIC(?:TURE)?\\s+(?:IS\\s+)?(\\S+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern USAGE = Pattern.compile(
            "\\bUSAGE\\s+(?:IS\\s+)?([A-Z][A-Z0-9-]*)", Pattern.CASE_INSENSITIVE);
    private static final Pattern BARE_USAGE = Pattern.compile(
            "(?<![A-Z0-9-])(COMP(?:UTATIONAL)?(?:-[0-9X])?|BINARY|PACKED-DECIMAL|POINTER|INDEX)(?![A-Z0-9-])",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern VALUE = Pattern.compile(
            "\\bVALUES?\\s+(?:IS\\s+|ARE\\s+)?('[^']*'|\"[^\"]*\"|[^\\s.]+(?:\\.[0-9]+)?)", Pattern.CASE_INSENSITIVE);
    private static final Pattern OCCURS = Pattern.compile("\\bOCCURS\\s+(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern REDEFINES = Pattern.compile(
            "\\bREDEFINES\\s+([A-Z][A-Z0-9-]*)", Pattern.CASE_INSENSITIVE);

    private final ChunkAnalyzer chunkAnalyzer;

    public COBOLProgramBuilder() {
        this(new ChunkAnalyzer());
    }

    public COBOLProgramBuilder(ChunkAnalyzer chunkAnalyzer) {
        this.chunkAnalyzer = chunkAnalyzer;
    }

    /**
     * @param source       the preprocessed source the index was built from
     * @param copybookRefs COPY statements met while preprocessing
     */
    public COBOLProgram build(String source, StructuralIndex index, List<CopybookRef> copybookRefs,
                              String sourcePath, String sourceHash) {
        long started = System.nanoTime();
        String text = source == null ? "" : source.replace("\r\n", "\n").replace('\r', '\n');
        List<String> lines = Arrays.asList(text.split("\n", -1));

        COBOLProgram program = new COBOLProgram();
        program.programId = programId(index);
        program.sourcePath = sourcePath;
        program.sourceHash = sourceHash;
        program.lines = index.getTotalLines();
        program.index = index;
        program.sourceLines = lines;
        if (copybookRefs != null) program.copybookRefs.addAll(copybookRefs);

        for (IndexEntry entry : index.getDivisions()) {
            COBOLDivision division = new COBOLDivision();
            division.name = entry.getName();
            division.lineStart = entry.getLineStart();
            division.lineEnd = entry.getLineEnd();
            program.divisions.add(division);
        }

        for (IndexEntry entry : index.getSections()) {
            COBOLDivision division = divisionAt(program, entry.getLineStart());
            if (division == null) {
                LOG.debug("Section {} at line {} lies outside every division", entry.getName(), entry.getLineStart());
                continue;
            }
            COBOLSection section = new COBOLSection();
            section.name = entry.getName();
            section.lineStart = entry.getLineStart();
            section.lineEnd = entry.getLineEnd();
            division.sections.add(section);
        }

        program.division("PROCEDURE").ifPresent(procedure -> addParagraphs(procedure, index, lines));
        program.division("DATA").ifPresent(data -> addDataItems(data, index, lines));
        program.comments.addAll(comments(lines));

        LOG.debug("Built program {} in {} ms", program.programId, (System.nanoTime() - started) / 1_000_000);
        return program;
    }

    static String programId(StructuralIndex index) {
        for (IndexEntry entry : index.getIdentificationEntries()) {
            if (entry.getName().startsWith("PROGRAM-ID ")) {
                return entry.getName().substring("PROGRAM-ID ".length());
            }
        }
        return UNKNOWN_PROGRAM_ID;
    }

    private static COBOLDivision divisionAt(COBOLProgram program, int line) {
        for (COBOLDivision division : program.divisions) {
            if (division.contains(line)) return division;
        }
        return null;
    }

    private void addParagraphs(COBOLDivision procedure, StructuralIndex index, List<String> lines) {
        List<StatementEntry> statements = new ArrayList<>(index.getStatements());
        statements.addAll(index.getExecStatements());
        statements.sort(Comparator.comparingInt(StatementEntry::getLineStart));

        // paragraphs, statements and sections are all ordered by line, so one cursor each suffices
        int nextStatement = 0;
        int nextSection = 0;
        List<COBOLSection> sections = procedure.sections;

        for (IndexEntry entry : index.getParagraphs()) {
            COBOLParagraph paragraph = new COBOLParagraph();
            paragraph.name = entry.getName();
            paragraph.lineStart = entry.getLineStart();
            paragraph.lineEnd = entry.getLineEnd();

            while (nextStatement < statements.size()
                    && statements.get(nextStatement).getLineStart() < paragraph.lineStart) {
                nextStatement++;
            }
            while (nextStatement < statements.size()
                    && statements.get(nextStatement).getLineStart() <= paragraph.lineEnd) {
                paragraph.statements.add(toStatement(statements.get(nextStatement), lines));
                nextStatement++;
            }

            ChunkAnalysis analysis = chunkAnalyzer.analyzeRange(lines, paragraph.lineStart, paragraph.lineEnd);
            paragraph.performs.addAll(analysis.getPerforms());
            paragraph.calls.addAll(analysis.getCalls());

            while (nextSection < sections.size() && sections.get(nextSection).lineEnd < paragraph.lineStart) {
                nextSection++;
            }
            COBOLSection owner = nextSection < sections.size() && sections.get(nextSection).lineStart <= paragraph.lineStart
                    ? sections.get(nextSection)
                    : null;
            if (owner != null) {
                owner.paragraphs.add(paragraph);
            } else {
                procedure.paragraphs.add(paragraph);
            }
        }
    }

    private COBOLStatement toStatement(StatementEntry entry, List<String> lines) {
        COBOLStatement statement = new COBOLStatement();
        statement.type = entry.getType();
        statement.lineStart = entry.getLineStart();
        statement.lineEnd = entry.getLineEnd();

        String line = entry.getLineStart() <= lines.size() ? lines.get(entry.getLineStart() - 1) : "";
        switch (statement.type) {
            case "PERFORM":
            case "GO":
                statement.target = first(chunkAnalyzer.analyze(line).getPerforms());
                break;
            case "CALL":
                statement.target = first(chunkAnalyzer.analyze(line).getCalls());
                break;
            case "MOVE":
                List<MoveOperation> moves = chunkAnalyzer.analyze(line).getMoves();
                if (!moves.isEmpty()) {
                    statement.target = moves.get(0).getTarget();
                    statement.arguments.add(moves.get(0).getSource());
                }
                break;
            default:
                break;
        }
        return statement;
    }

    private static String first(List<String> names) {
        return names.isEmpty() ? null : names.get(0);
    }

    private void addDataItems(COBOLDivision data, StructuralIndex index, List<String> lines) {
        List<IndexEntry> entries = index.getDataItems();
        for (COBOLSection section : data.sections) {
            Deque<COBOLDataItem> hierarchy = new ArrayDeque<>();
            COBOLDataItem previous = null;

            for (int i = 0; i < entries.size(); i++) {
                IndexEntry entry = entries.get(i);
                int line = entry.getLineStart();
                if (line < section.lineStart || line > section.lineEnd) continue;

                int nextItemLine = i + 1 < entries.size() ? entries.get(i + 1).getLineStart() : Integer.MAX_VALUE;
                COBOLDataItem item = toDataItem(entry, lines, Math.min(nextItemLine - 1, section.lineEnd));
                if (item == null) continue;

                if (item.level == 88) {
                    // condition names belong to the item right above them
                    if (previous != null) {
                        previous.children.add(item);
                    } else {
                        section.dataItems.add(item);
                    }
                    continue;
                }
                if (item.level == 66) {
                    COBOLDataItem record = hierarchy.peekLast();
                    if (record != null) {
                        record.children.add(item);
                    } else {
                        section.dataItems.add(item);
                    }
                    continue;
                }
                if (item.level == 1 || item.level == 77) {
                    hierarchy.clear();
                }

                while (!hierarchy.isEmpty() && item.level <= hierarchy.peek().level) {
                    hierarchy.pop();
                }
                if (hierarchy.isEmpty()) {
                    section.dataItems.add(item);
                } else {
                    hierarchy.peek().children.add(item);
                }
                if (item.level != 77) {
                    hierarchy.push(item);
                }
                previous = item;
            }
        }
    }

    private static COBOLDataItem toDataItem(IndexEntry entry, List<String> lines, int lastLine) {
        String[] levelAndName = entry.getName().split(" ", 2);
        Integer level = parseInteger(levelAndName[0]);
        if (level == null || levelAndName.length < 2) {
            return null;
        }

        COBOLDataItem item = new COBOLDataItem();
        item.level = level;
        item.name = levelAndName[1];
        item.lineStart = entry.getLineStart();
        item.lineEnd = entry.getLineStart();

        // clauses run until the terminating period, possibly over several lines
        StringBuilder clauses = new StringBuilder();
        int limit = Math.min(Math.min(lastLine, lines.size()), entry.getLineStart() + MAX_CLAUSE_LINES - 1);
        for (int line = entry.getLineStart(); line <= limit; line++) {
            String text = codeOf(lines.get(line - 1));
            clauses.append(' ').append(text);
            item.lineEnd = line;
            if (QUOTED.matcher(text).replaceAll("''").trim().endsWith(".")) break;
        }
        String raw = clauses.toString();
        String unquoted = QUOTED.matcher(raw).replaceAll("''");

        Matcher picture = PICTURE.matcher(unquoted);
        if (picture.find()) {
            String pic = picture.group(1);
            item.picture = pic.endsWith(".") ? pic.substring(0, pic.length() - 1) : pic;
        }

        Matcher usage = USAGE.matcher(unquoted);
        if (usage.find()) {
            item.usage = usage.group(1).toUpperCase(Locale.ROOT);
        } else {
            Matcher bare = BARE_USAGE.matcher(unquoted);
            if (bare.find()) item.usage = bare.group(1).toUpperCase(Locale.ROOT);
        }

        Matcher value = VALUE.matcher(raw);
        if (value.find()) {
            item.value = value.group(1);
        }

        Matcher occurs = OCCURS.matcher(unquoted);
        if (occurs.find()) {
            item.occurs = parseInteger(occurs.group(1));
        }

        Matcher redefines = REDEFINES.matcher(unquoted);
        if (redefines.find()) {
            item.redefines = redefines.group(1).toUpperCase(Locale.ROOT);
        }
        return item;
    }

    /**
     * Comment lines (indicator {@code *} or {@code /}) and inline {@code *>} comments.
     */
    static List<COBOLComment> comments(List<String> lines) {
        List<COBOLComment> comments = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) continue;

            if (line.length() > INDICATOR_COLUMN && line.substring(0, INDICATOR_COLUMN).isBlank()
                    && (line.charAt(INDICATOR_COLUMN) == '*' || line.charAt(INDICATOR_COLUMN) == '/')) {
                comments.add(new COBOLComment(line.substring(INDICATOR_COLUMN + 1).trim(), i + 1, false));
                continue;
            }
            if (line.trim().startsWith("*>")) {
                comments.add(new COBOLComment(line.trim().substring(2).trim(), i + 1, false));
                continue;
            }
            int marker = inlineCommentStart(line);
            if (marker >= 0) {
                comments.add(new COBOLComment(line.substring(marker + 2).trim(), i + 1, true));
            }
        }
        return comments;
    }

    private static int inlineCommentStart(String line) {
        char quote = 0;
        for (int i = 0; i + 1 < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '*' && line.charAt(i + 1) == '>') {
                return i;
            }
        }
        return -1;
    }

    private static String codeOf(String line) {
        int marker = inlineCommentStart(line);
        return marker >= 0 ? line.substring(0, marker) : line;
    }

    private static Integer parseInteger(String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
