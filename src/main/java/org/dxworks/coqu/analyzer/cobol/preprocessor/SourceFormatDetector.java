package org.dxworks.coqu.analyzer.cobol.preprocessor;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies a source by its per-line prefixes and rewrites those prefixes as blank columns.
 */
public final class SourceFormatDetector {

    static final int SAMPLE_LINES = 20;
    private static final int PREFIX_COLUMNS = 6;
    private static final String BLANK_PREFIX = " ".repeat(PREFIX_COLUMNS);

    private static final Pattern PANVALET_MARKER = Pattern.compile("^(\\d{1,2}\\.\\d{1,4}[AB]?)(?=\\s|$)");
    private static final Pattern SEQUENCE_NUMBER = Pattern.compile("^\\d{6}");

    private SourceFormatDetector() {
    }

    /**
     * Looks at the first {@value #SAMPLE_LINES} non-blank lines. A format wins only with a strict
     * majority of them; otherwise the source is treated as {@link SourceFormat#STANDARD}.
     */
    public static SourceFormat detect(String source) {
        if (source == null || source.isEmpty()) return SourceFormat.STANDARD;

        int sampled = 0;
        int panvalet = 0;
        int sequence = 0;
        for (String line : source.split("\n", -1)) {
            if (line.isBlank()) continue;
            if (PANVALET_MARKER.matcher(line).find()) {
                panvalet++;
            } else if (SEQUENCE_NUMBER.matcher(line).find()) {
                sequence++;
            }
            if (++sampled == SAMPLE_LINES) break;
        }

        if (panvalet * 2 > sampled) return SourceFormat.PANVALET;
        if (sequence * 2 > sampled) return SourceFormat.SEQUENCE;
        return SourceFormat.STANDARD;
    }

    /**
     * Blanks the prefix of every line carrying one, keeping the indicator column and the rest of
     * the line in place. Lines without a prefix are left alone, so mixed sources survive.
     */
    public static String normalize(String source, SourceFormat format) {
        if (source == null || format == SourceFormat.STANDARD) return source;

        String[] lines = source.split("\n", -1);
        StringBuilder out = new StringBuilder(source.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) out.append('\n');
            out.append(normalizeLine(lines[i], format));
        }
        return out.toString();
    }

    static String normalizeLine(String line, SourceFormat format) {
        int prefixLength;
        if (format == SourceFormat.SEQUENCE) {
            if (!SEQUENCE_NUMBER.matcher(line).find()) return line;
            prefixLength = PREFIX_COLUMNS;
        } else {
            Matcher marker = PANVALET_MARKER.matcher(line);
            if (!marker.find()) return line;
            prefixLength = marker.end(1);
        }
        if (prefixLength <= PREFIX_COLUMNS) {
            return " ".repeat(prefixLength) + line.substring(prefixLength);
        }
        // markers wider than the sequence area push the code right; pull it back to column 7
        return BLANK_PREFIX + line.substring(prefixLength);
    }
}
