package org.dxworks.coqu.model.index;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A statement keyword (MOVE, PERFORM, END-IF, EXEC-SQL, ...) and the paragraph it sits in.
 */
@JsonPropertyOrder({"type", "lineStart", "lineEnd", "paragraph"})
public final class StatementEntry {

    private final String type;
    private final int lineStart;
    private final int lineEnd;
    private final String paragraph;

    @JsonCreator
    public StatementEntry(@JsonProperty("type") String type,
                          @JsonProperty("lineStart") int lineStart,
                          @JsonProperty("lineEnd") int lineEnd,
                          @JsonProperty("paragraph") String paragraph) {
        this.type = Objects.requireNonNull(type, "type");
        this.lineStart = lineStart;
        this.lineEnd = lineEnd;
        this.paragraph = paragraph == null ? "" : paragraph;
    }

    public String getType() {
        return type;
    }

    public int getLineStart() {
        return lineStart;
    }

    public int getLineEnd() {
        return lineEnd;
    }

    /** Containing paragraph name, empty when the statement precedes every paragraph. */
    public String getParagraph() {
        return paragraph;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StatementEntry)) return false;
        StatementEntry that = (StatementEntry) o;
        return lineStart == that.lineStart
                && lineEnd == that.lineEnd
                && type.equals(that.type)
                && paragraph.equals(that.paragraph);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, lineStart, lineEnd, paragraph);
    }

    @Override
    public String toString() {
        return type + " at line " + lineStart;
    }
}
