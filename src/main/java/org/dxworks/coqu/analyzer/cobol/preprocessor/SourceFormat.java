package org.dxworks.coqu.analyzer.cobol.preprocessor;

/**
 * Per-line prefix convention of a COBOL source.
 */
public enum SourceFormat {
    /** Blank columns 1-6, or free text; nothing to rewrite. */
    STANDARD("standard"),
    /** Six-digit sequence numbers in columns 1-6. */
    SEQUENCE("sequence"),
    /** Version markers such as {@code 1.1}, {@code 07.141} or {@code 7.682A}. */
    PANVALET("panvalet");

    private final String tag;

    SourceFormat(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
