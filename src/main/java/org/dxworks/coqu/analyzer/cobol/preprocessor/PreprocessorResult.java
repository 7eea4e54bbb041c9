package org.dxworks.coqu.analyzer.cobol.preprocessor;

import org.dxworks.coqu.model.cobol.CopybookRef;

import java.util.List;

/**
 * Outcome of one preprocessing run. Warnings and errors are collected here instead of thrown.
 */
public final class PreprocessorResult {

    private final String source;
    private final String originalSource;
    private final List<CopybookRef> copybookRefs;
    private final List<String> warnings;
    private final List<String> errors;
    private final SourceFormat detectedFormat;
    private final boolean normalized;

    public PreprocessorResult(String source, String originalSource, List<CopybookRef> copybookRefs,
                              List<String> warnings, List<String> errors,
                              SourceFormat detectedFormat, boolean normalized) {
        this.source = source;
        this.originalSource = originalSource;
        this.copybookRefs = List.copyOf(copybookRefs);
        this.warnings = List.copyOf(warnings);
        this.errors = List.copyOf(errors);
        this.detectedFormat = detectedFormat;
        this.normalized = normalized;
    }

    /** Normalized source with resolved copybooks inlined. */
    public String getSource() {
        return source;
    }

    public String getOriginalSource() {
        return originalSource;
    }

    /** Every COPY met, nested ones included, in the order they were processed. */
    public List<CopybookRef> getCopybookRefs() {
        return copybookRefs;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public List<String> getErrors() {
        return errors;
    }

    public SourceFormat getDetectedFormat() {
        return detectedFormat;
    }

    /** True when line prefixes were rewritten. */
    public boolean isNormalized() {
        return normalized;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
