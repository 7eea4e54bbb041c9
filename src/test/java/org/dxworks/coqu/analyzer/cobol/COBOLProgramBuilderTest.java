package org.dxworks.coqu.analyzer.cobol;

import org.dxworks.coqu.TestUtils;
import org.dxworks.coqu.analyzer.cobol.index.StructuralIndexer;
import org.dxworks.coqu.model.cobol.COBOLComment;
import org.dxworks.coqu.model.cobol.COBOLDataItem;
import org.dxworks.coqu.model.cobol.COBOLDivision;
import org.dxworks.coqu.model.cobol.COBOLParagraph;
import org.dxworks.coqu.model.cobol.COBOLProgram;
import org.dxworks.coqu.model.cobol.COBOLSection;
import org.dxworks.coqu.model.cobol.COBOLStatement;
import org.dxworks.coqu.model.index.EntryCategory;
import org.dxworks.coqu.model.index.IndexEntry;
import org.dxworks.coqu.model.index.StatementEntry;
import org.dxworks.coqu.model.index.StructuralIndex;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class COBOLProgramBuilderTest {

    private static COBOLProgram build(String... lines) {
        String source = String.join("\n", lines);
        return new COBOLProgramBuilder().build(source, new StructuralIndexer().index(source), List.of(), null, "00");
    }

    @Test
    void buildsDivisionsSectionsAndParagraphs() throws Exception {
        COBOLProgram program = TestUtils.buildSample("basic-program.cbl");

        assertEquals("BASICPGM", program.programId);
        assertEquals(28, program.lines);
        assertEquals(List.of("IDENTIFICATION DIVISION", "ENVIRONMENT DIVISION", "DATA DIVISION", "PROCEDURE DIVISION"),
                program.divisions.stream().map(d -> d.name).collect(Collectors.toList()));
        assertEquals(List.of("INPUT-OUTPUT SECTION", "FILE SECTION", "WORKING-STORAGE SECTION"),
                program.allSections().stream().map(s -> s.name).collect(Collectors.toList()));

        COBOLParagraph main = program.paragraph("main-para").orElseThrow();
        assertEquals(19, main.lineStart);
        assertEquals(22, main.lineEnd);
        assertEquals(List.of("READ-PARA"), main.performs);
        assertEquals(List.of("PERFORM", "DISPLAY", "STOP"),
                main.statements.stream().map(s -> s.type).collect(Collectors.toList()));
        assertEquals("READ-PARA", main.statements.get(0).target);

        COBOLParagraph read = program.paragraph("READ-PARA").orElseThrow();
        assertEquals(List.of("READ", "AT-END", "END-READ", "ADD"),
                read.statements.stream().map(s -> s.type).collect(Collectors.toList()));
    }

    @Test
    void dataItemsFormARecordHierarchy() throws Exception {
        COBOLProgram program = TestUtils.buildSample("basic-program.cbl");

        List<COBOLDataItem> records = program.workingStorageItems(null);
        assertEquals(1, records.size());

        COBOLDataItem counters = records.get(0);
        assertEquals("WS-COUNTERS", counters.name);
        assertEquals(1, counters.level);
        assertNull(counters.picture);
        assertEquals(List.of("WS-COUNT", "WS-EOF"),
                counters.children.stream().map(c -> c.name).collect(Collectors.toList()));

        COBOLDataItem count = counters.children.get(0);
        assertEquals("9(4)", count.picture);
        assertEquals("0", count.value);

        COBOLDataItem eof = counters.children.get(1);
        assertEquals("X", eof.picture);
        assertEquals("'N'", eof.value);
        assertEquals(1, eof.children.size());
        assertEquals(88, eof.children.get(0).level);
        assertEquals("'Y'", eof.children.get(0).value);

        COBOLSection fileSection = program.division("DATA").orElseThrow().sections.get(0);
        assertEquals("CUST-REC", fileSection.dataItems.get(0).name);
        assertEquals("X(80)", fileSection.dataItems.get(0).picture);
    }

    @Test
    void clausesLevelsAndCommentsAreRead() {
        COBOLProgram program = build(
                "       IDENTIFICATION DIVISION.",
                "       PROGRAM-ID. DATADEMO.",
                "      * Working storage layout",
                "       DATA DIVISION.",
                "       WORKING-STORAGE SECTION.",
                "       77  WS-TOTAL          PIC S9(7)V99 COMP-3 VALUE ZERO.",
                "       01  WS-TABLE.",
                "           05  WS-ENTRY      OCCURS 10 TIMES.",
                "               10  WS-CODE   PIC X(3).",
                "               10  WS-AMOUNT PIC 9(5)V99",
                "                   USAGE IS DISPLAY.",
                "       01  WS-ALT REDEFINES WS-TABLE PIC X(100).",
                "       66  WS-ALIAS RENAMES WS-ALT.",
                "       PROCEDURE DIVISION.",
                "       MAIN-PARA.",
                "      *    main loop",
                "           MOVE 'A' TO WS-CODE *> first code",
                "           CALL 'AUDIT' USING WS-TOTAL",
                "           GOBACK.");

        List<COBOLDataItem> roots = program.workingStorageItems(null);
        assertEquals(List.of("WS-TOTAL", "WS-TABLE", "WS-ALT"),
                roots.stream().map(i -> i.name).collect(Collectors.toList()));
        assertEquals(List.of("WS-TABLE", "WS-ALT"),
                program.workingStorageItems(1).stream().map(i -> i.name).collect(Collectors.toList()));

        COBOLDataItem total = roots.get(0);
        assertEquals(77, total.level);
        assertEquals("S9(7)V99", total.picture);
        assertEquals("COMP-3", total.usage);
        assertEquals("ZERO", total.value);

        COBOLDataItem entry = roots.get(1).children.get(0);
        assertEquals(Integer.valueOf(10), entry.occurs);
        COBOLDataItem amount = entry.children.get(1);
        assertEquals("WS-AMOUNT", amount.name);
        assertEquals("9(5)V99", amount.picture);
        assertEquals("DISPLAY", amount.usage);
        assertEquals(10, amount.lineStart);
        assertEquals(11, amount.lineEnd);

        COBOLDataItem alt = roots.get(2);
        assertEquals("WS-TABLE", alt.redefines);
        assertEquals("WS-ALIAS", alt.children.get(0).name);

        assertEquals(List.of(
                new COBOLComment("Working storage layout", 3, false),
                new COBOLComment("main loop", 16, false),
                new COBOLComment("first code", 17, true)), program.comments);

        COBOLParagraph main = program.paragraph("MAIN-PARA").orElseThrow();
        assertEquals(List.of("AUDIT"), main.calls);
        COBOLStatement move = main.statements.get(0);
        assertEquals("MOVE", move.type);
        assertEquals("WS-CODE", move.target);
        assertEquals(List.of("'A'"), move.arguments);
        assertEquals("AUDIT", main.statements.get(1).target);
    }

    @Test
    void paragraphsBelongToTheirProcedureSection() {
        COBOLProgram program = build(
                "       IDENTIFICATION DIVISION.",
                "       PROGRAM-ID. SECTS.",
                "       PROCEDURE DIVISION.",
                "       FIRST-PART SECTION.",
                "       P1.",
                "           DISPLAY 'A'.",
                "       SECOND-PART SECTION.",
                "       P2.",
                "           DISPLAY 'B'.",
                "       P3.",
                "           STOP RUN.");

        COBOLDivision procedure = program.division("PROCEDURE").orElseThrow();
        assertTrue(procedure.paragraphs.isEmpty());
        assertEquals(List.of("P1"), procedure.sections.get(0).paragraphs.stream().map(p -> p.name).collect(Collectors.toList()));
        assertEquals(List.of("P2", "P3"), procedure.sections.get(1).paragraphs.stream().map(p -> p.name).collect(Collectors.toList()));
        assertEquals(List.of("P1", "P2", "P3"), program.allParagraphs().stream().map(p -> p.name).collect(Collectors.toList()));
    }

    @Test
    void execBlocksAndThruTargetsAppearAsStatements() {
        COBOLProgram program = build(
                "       PROCEDURE DIVISION.",
                "       LOOKUP.",
                "           EXEC SQL",
                "             SELECT 1 INTO :X FROM T",
                "           END-EXEC",
                "           PERFORM 100-NEXT THRU 100-EXIT.");

        COBOLParagraph lookup = program.paragraph("LOOKUP").orElseThrow();
        assertEquals("EXEC-SQL", lookup.statements.get(0).type);
        assertEquals(3, lookup.statements.get(0).lineStart);
        assertEquals(5, lookup.statements.get(0).lineEnd);
        assertEquals("100-NEXT", lookup.statements.get(1).target);
        assertEquals(List.of("100-NEXT", "100-EXIT"), lookup.performs);
        assertEquals(COBOLProgramBuilder.UNKNOWN_PROGRAM_ID, program.programId);
    }

    @Test
    void paragraphsBeforeTheFirstSectionStayOnTheDivision() {
        COBOLProgram program = build(
                "       PROCEDURE DIVISION.",
                "       ENTRY-PARA.",
                "           PERFORM WORK-PARA.",
                "       WORK SECTION.",
                "       WORK-PARA.",
                "           DISPLAY 'W'.",
                "       WORK-EXIT.",
                "           EXIT.");

        COBOLDivision procedure = program.division("PROCEDURE").orElseThrow();
        assertEquals(List.of("ENTRY-PARA"), procedure.paragraphs.stream().map(p -> p.name).collect(Collectors.toList()));
        assertEquals(List.of("WORK-PARA", "WORK-EXIT"),
                procedure.sections.get(0).paragraphs.stream().map(p -> p.name).collect(Collectors.toList()));
        assertEquals(List.of("PERFORM"), program.paragraph("ENTRY-PARA").orElseThrow().statements.stream()
                .map(st -> st.type).collect(Collectors.toList()));
        assertEquals(List.of("DISPLAY"), program.paragraph("WORK-PARA").orElseThrow().statements.stream()
                .map(st -> st.type).collect(Collectors.toList()));
    }

    @Test
    void buildTimeGrowsWithTheSizeOfTheProgram() {
        int paragraphs = 20_000;
        int movesPerParagraph = 10;
        int linesPerParagraph = movesPerParagraph + 1;
        int totalLines = 1 + paragraphs * linesPerParagraph;

        List<String> lines = new ArrayList<>();
        List<IndexEntry> paragraphEntries = new ArrayList<>();
        List<StatementEntry> statements = new ArrayList<>();
        lines.add("       PROCEDURE DIVISION.");
        for (int p = 0; p < paragraphs; p++) {
            String name = "P-" + p;
            int start = lines.size() + 1;
            lines.add("       " + name + ".");
            for (int m = 0; m < movesPerParagraph; m++) {
                lines.add("           MOVE WS-A-" + m + " TO WS-B-" + m);
                statements.add(new StatementEntry("MOVE", lines.size(), lines.size(), name));
            }
            paragraphEntries.add(new IndexEntry(name, EntryCategory.PARAGRAPH, start, start + movesPerParagraph));
        }
        StructuralIndex index = new StructuralIndex(totalLines,
                List.of(new IndexEntry("PROCEDURE DIVISION", EntryCategory.DIVISION, 1, totalLines)),
                List.of(), paragraphEntries, List.of(), List.of(), List.of(), List.of(), List.of(),
                statements, List.of());
        String source = String.join("\n", lines);

        COBOLProgram program = assertTimeoutPreemptively(Duration.ofSeconds(10),
                () -> new COBOLProgramBuilder().build(source, index, List.of(), null, "00"));

        List<COBOLParagraph> built = program.allParagraphs();
        assertEquals(paragraphs, built.size());
        COBOLParagraph last = built.get(paragraphs - 1);
        assertEquals("P-19999", last.name);
        assertEquals(movesPerParagraph, last.statements.size());
        assertEquals("WS-B-9", last.statements.get(movesPerParagraph - 1).target);
    }

    @Test
    void bodyReturnsTheSourceOfALineRange() throws Exception {
        COBOLProgram program = TestUtils.buildSample("basic-program.cbl");
        COBOLParagraph main = program.paragraph("MAIN-PARA").orElseThrow();

        assertEquals(String.join("\n",
                "       MAIN-PARA.",
                "           PERFORM READ-PARA UNTIL END-OF-FILE",
                "           DISPLAY WS-COUNT",
                "           STOP RUN."), program.body(main.lineStart, main.lineEnd));
        assertEquals("", program.body(30, 40));
    }
}
