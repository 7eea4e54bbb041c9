package org.dxworks.coqu.workspace;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * A copybook file on disk and the COPY statements it contains.
 */
public final class CopybookInfo {

    private final String name;
    private final Path path;
    private final long sizeBytes;
    private final int lines;
    private final List<String> nestedRefs;

    public CopybookInfo(String name, Path path, long sizeBytes, int lines, List<String> nestedRefs) {
        this.name = name;
        this.path = path;
        this.sizeBytes = sizeBytes;
        this.lines = lines;
        this.nestedRefs = List.copyOf(nestedRefs);
    }

    public String getName() {
        return name;
    }

    public Path getPath() {
        return path;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public int getLines() {
        return lines;
    }

    /** Names copied by this copybook, upper case, in order of first appearance. */
    public List<String> getNestedRefs() {
        return nestedRefs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CopybookInfo)) return false;
        CopybookInfo that = (CopybookInfo) o;
        return sizeBytes == that.sizeBytes && lines == that.lines && name.equals(that.name)
                && path.equals(that.path) && nestedRefs.equals(that.nestedRefs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, path, sizeBytes, lines, nestedRefs);
    }

    @Override
    public String toString() {
        return name + " (" + path + ", " + lines + " lines)";
    }
}
