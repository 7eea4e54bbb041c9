package org.dxworks.coqu.model.index;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A named structural element located by line range.
 * A {@code lineEnd} of 0 means the range has not been finalized yet.
 */
@JsonPropertyOrder({"name", "category", "lineStart", "lineEnd"})
public final class IndexEntry {

    private final String name;
    private final EntryCategory category;
    private final int lineStart;
    private final int lineEnd;

    @JsonCreator
    public IndexEntry(@JsonProperty("name") String name,
                      @JsonProperty("category") EntryCategory category,
                      @JsonProperty("lineStart") int lineStart,
                      @JsonProperty("lineEnd") int lineEnd) {
        this.name = Objects.requireNonNull(name, "name");
        this.category = Objects.requireNonNull(category, "category");
        this.lineStart = lineStart;
        this.lineEnd = lineEnd;
    }

    public static IndexEntry pending(String name, EntryCategory category, int lineStart) {
        return new IndexEntry(name, category, lineStart, 0);
    }

    public IndexEntry withLineEnd(int end) {
        return new IndexEntry(name, category, lineStart, Math.max(end, lineStart));
    }

    public String getName() {
        return name;
    }

    public EntryCategory getCategory() {
        return category;
    }

    public int getLineStart() {
        return lineStart;
    }

    public int getLineEnd() {
        return lineEnd;
    }

    public boolean contains(int line) {
        return line >= lineStart && line <= lineEnd;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IndexEntry)) return false;
        IndexEntry that = (IndexEntry) o;
        return lineStart == that.lineStart
                && lineEnd == that.lineEnd
                && name.equals(that.name)
                && category == that.category;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, category, lineStart, lineEnd);
    }

    @Override
    public String toString() {
        return category.getTag() + ": " + name + " (lines " + lineStart + "-" + lineEnd + ")";
    }
}
