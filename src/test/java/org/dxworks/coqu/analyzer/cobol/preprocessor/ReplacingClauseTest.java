package org.dxworks.coqu.analyzer.cobol.preprocessor;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ReplacingClauseTest {

    @Test
    void pseudoTextReplacesRawSubstrings() {
        ReplacingClause clause = ReplacingClause.parse("==:PFX:== BY ==ORDER==");

        assertEquals("       01  ORDER-REC.\n           05  ORDER-ID PIC 9.",
                clause.apply("       01  :PFX:-REC.\n           05  :PFX:-ID PIC 9."));
    }

    @Test
    void wordPairsReplaceWholeWordsIgnoringCase() {
        ReplacingClause clause = ReplacingClause.parse("OLD-NAME BY NEW-NAME");

        assertEquals("01 NEW-NAME.\n05 OLD-NAME-ID PIC 9.\nMOVE 1 TO NEW-NAME",
                clause.apply("01 OLD-NAME.\n05 OLD-NAME-ID PIC 9.\nMOVE 1 TO old-name"));
    }

    @Test
    void parsedClauseCanBeAppliedRepeatedly() {
        ReplacingClause clause = ReplacingClause.parse("WS-AMT BY WS-TOTAL");

        assertEquals("05 WS-TOTAL PIC 9.", clause.apply("05 WS-AMT PIC 9."));
        assertEquals("MOVE 0 TO WS-TOTAL", clause.apply("MOVE 0 TO WS-AMT"));
    }

    @Test
    void pseudoTextAndWordPairsCanBeMixed() {
        ReplacingClause clause = ReplacingClause.parse("==(TAG)== BY ==CUST==\n    LEADING-REC BY CUST-REC");

        assertFalse(clause.isEmpty());
        assertEquals("01 CUST-REC. 05 CUST-KEY PIC X.", clause.apply("01 LEADING-REC. 05 (TAG)-KEY PIC X."));
    }

    @Test
    void pseudoTextMayReplaceWithNothing() {
        assertEquals("05 FIELD PIC X.", ReplacingClause.parse("==WS-== BY ====").apply("05 WS-FIELD PIC X."));
    }

    @Test
    void blankClauseReplacesNothing() {
        assertTrue(ReplacingClause.parse(null).isEmpty());
        assertTrue(ReplacingClause.parse("   ").isEmpty());
        assertEquals("01 A.", ReplacingClause.parse("").apply("01 A."));
    }
}
