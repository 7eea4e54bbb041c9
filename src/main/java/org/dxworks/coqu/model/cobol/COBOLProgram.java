package org.dxworks.coqu.model.cobol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.dxworks.coqu.model.index.StructuralIndex;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Program tree built from the structural index; this is what the cache persists.
 */
public class COBOLProgram {
    public String programId;
    public String sourcePath;
    public String sourceHash;
    public int lines;

    public List<COBOLDivision> divisions = new ArrayList<>();
    public List<CopybookRef> copybookRefs = new ArrayList<>();
    public List<COBOLComment> comments = new ArrayList<>();
    public StructuralIndex index;

    // Preprocessed source, kept for body extraction; never persisted
    @JsonIgnore
    public List<String> sourceLines;

    /**
     * Finds a division by exact name or by a fragment of it ("PROCEDURE" finds "PROCEDURE DIVISION").
     */
    public Optional<COBOLDivision> division(String name) {
        String wanted = name.toUpperCase(Locale.ROOT);
        for (COBOLDivision div : divisions) {
            String divName = div.name.toUpperCase(Locale.ROOT);
            if (divName.equals(wanted) || divName.contains(wanted)) {
                return Optional.of(div);
            }
        }
        return Optional.empty();
    }

    public List<COBOLSection> allSections() {
        List<COBOLSection> result = new ArrayList<>();
        for (COBOLDivision div : divisions) {
            result.addAll(div.sections);
        }
        return result;
    }

    public List<COBOLParagraph> allParagraphs() {
        List<COBOLParagraph> result = new ArrayList<>();
        division("PROCEDURE").ifPresent(proc -> {
            result.addAll(proc.paragraphs);
            for (COBOLSection section : proc.sections) {
                result.addAll(section.paragraphs);
            }
        });
        result.sort((a, b) -> Integer.compare(a.lineStart, b.lineStart));
        return result;
    }

    public Optional<COBOLParagraph> paragraph(String name) {
        String wanted = name.toUpperCase(Locale.ROOT);
        return allParagraphs().stream()
                .filter(p -> p.name.toUpperCase(Locale.ROOT).equals(wanted))
                .findFirst();
    }

    /**
     * WORKING-STORAGE records, optionally restricted to one level.
     */
    public List<COBOLDataItem> workingStorageItems(Integer level) {
        List<COBOLDataItem> result = new ArrayList<>();
        division("DATA").ifPresent(data -> {
            for (COBOLSection section : data.sections) {
                if (!section.name.toUpperCase(Locale.ROOT).contains("WORKING-STORAGE")) continue;
                for (COBOLDataItem item : section.dataItems) {
                    if (level == null || item.level == level) {
                        result.add(item);
                    }
                }
            }
        });
        return result;
    }

    /**
     * Source text of an inclusive 1-based line range; empty when the source was not retained.
     */
    public String body(int lineStart, int lineEnd) {
        if (sourceLines == null || sourceLines.isEmpty()) return "";
        int from = Math.max(0, lineStart - 1);
        int to = Math.min(sourceLines.size(), lineEnd);
        if (from >= to) return "";
        return String.join("\n", sourceLines.subList(from, to));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof COBOLProgram)) return false;
        COBOLProgram that = (COBOLProgram) o;
        return lines == that.lines
                && Objects.equals(programId, that.programId)
                && Objects.equals(sourcePath, that.sourcePath)
                && Objects.equals(sourceHash, that.sourceHash)
                && Objects.equals(divisions, that.divisions)
                && Objects.equals(copybookRefs, that.copybookRefs)
                && Objects.equals(comments, that.comments)
                && Objects.equals(index, that.index);
    }

    @Override
    public int hashCode() {
        return Objects.hash(programId, sourcePath, sourceHash, lines, divisions, copybookRefs, comments, index);
    }

    @Override
    public String toString() {
        return programId + " (" + lines + " lines)";
    }
}
