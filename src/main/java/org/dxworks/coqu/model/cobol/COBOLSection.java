package org.dxworks.coqu.model.cobol;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class COBOLSection {
    public String name;
    public int lineStart;
    public int lineEnd;
    public List<COBOLParagraph> paragraphs = new ArrayList<>();
    public List<COBOLDataItem> dataItems = new ArrayList<>();

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof COBOLSection)) return false;
        COBOLSection that = (COBOLSection) o;
        return lineStart == that.lineStart
                && lineEnd == that.lineEnd
                && Objects.equals(name, that.name)
                && Objects.equals(paragraphs, that.paragraphs)
                && Objects.equals(dataItems, that.dataItems);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, lineStart, lineEnd, paragraphs, dataItems);
    }
}
