package org.dxworks.coqu.model.cobol;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class COBOLParagraph {
    public String name;
    public int lineStart;
    public int lineEnd;
    public List<COBOLStatement> statements = new ArrayList<>();
    public List<String> performs = new ArrayList<>();
    public List<String> calls = new ArrayList<>();

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof COBOLParagraph)) return false;
        COBOLParagraph that = (COBOLParagraph) o;
        return lineStart == that.lineStart
                && lineEnd == that.lineEnd
                && Objects.equals(name, that.name)
                && Objects.equals(statements, that.statements)
                && Objects.equals(performs, that.performs)
                && Objects.equals(calls, that.calls);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, lineStart, lineEnd, statements, performs, calls);
    }
}
