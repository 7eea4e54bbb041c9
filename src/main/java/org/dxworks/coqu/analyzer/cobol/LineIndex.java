package org.dxworks.coqu.analyzer.cobol;

import java.util.Arrays;

/**
 * Line-start offset table over a source text.
 * Positions are converted to 1-based line numbers with a binary search, so a scan
 * producing hundreds of thousands of matches does not pay a linear cost per match.
 */
public final class LineIndex {

    private final int[] offsets;
    private final int length;

    private LineIndex(int[] offsets, int length) {
        this.offsets = offsets;
        this.length = length;
    }

    /**
     * Builds the table for text whose line endings are already {@code \n}.
     */
    public static LineIndex of(String text) {
        int count = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') count++;
        }
        int[] offsets = new int[count];
        int line = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                offsets[line++] = i + 1;
            }
        }
        return new LineIndex(offsets, text.length());
    }

    public int lineCount() {
        return offsets.length;
    }

    /**
     * Returns the 1-based line containing the character at {@code position}.
     * Positions outside the text are clamped to the first or last line.
     */
    public int lineOf(int position) {
        if (position <= 0) return 1;
        if (position >= length) return offsets.length;
        int found = Arrays.binarySearch(offsets, position);
        if (found >= 0) {
            return found + 1;
        }
        // insertion point is the first offset greater than position
        return -found - 1;
    }

    /**
     * Like {@link #lineOf(int)}, but a position sitting on a newline is attributed to the
     * following line. Needed for matches whose leading whitespace starts on a blank line.
     */
    public int lineOfSkippingNewline(String text, int position) {
        if (position >= 0 && position < text.length() && text.charAt(position) == '\n') {
            return lineOf(position + 1);
        }
        return lineOf(position);
    }

    /**
     * Returns the character offset at which the given 1-based line starts.
     */
    public int startOf(int line) {
        if (line <= 1) return 0;
        if (line > offsets.length) return length;
        return offsets[line - 1];
    }

    /**
     * Returns the offset just past the given 1-based line, newline included.
     */
    public int endOf(int line) {
        if (line >= offsets.length) return length;
        return offsets[line];
    }
}
