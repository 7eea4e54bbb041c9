package org.dxworks.coqu.model.cobol;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class COBOLDivision {
    public String name;
    public int lineStart;
    public int lineEnd;
    public List<COBOLSection> sections = new ArrayList<>();
    // PROCEDURE DIVISION paragraphs that sit outside any section
    public List<COBOLParagraph> paragraphs = new ArrayList<>();

    public boolean contains(int line) {
        return line >= lineStart && line <= lineEnd;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof COBOLDivision)) return false;
        COBOLDivision that = (COBOLDivision) o;
        return lineStart == that.lineStart
                && lineEnd == that.lineEnd
                && Objects.equals(name, that.name)
                && Objects.equals(sections, that.sections)
                && Objects.equals(paragraphs, that.paragraphs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, lineStart, lineEnd, sections, paragraphs);
    }
}
