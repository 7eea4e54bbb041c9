package org.dxworks.coqu.workspace;

import java.nio.file.Path;
import java.util.List;

/**
 * One node of a copybook dependency tree.
 */
public final class CopybookDependency {

    public enum Kind {
        RESOLVED,
        UNRESOLVED,
        // already on the path from the root
        CIRCULAR
    }

    private final String name;
    private final Kind kind;
    private final Path path;
    private final int lines;
    private final List<CopybookDependency> nested;

    private CopybookDependency(String name, Kind kind, Path path, int lines, List<CopybookDependency> nested) {
        this.name = name;
        this.kind = kind;
        this.path = path;
        this.lines = lines;
        this.nested = List.copyOf(nested);
    }

    static CopybookDependency resolved(CopybookInfo info, List<CopybookDependency> nested) {
        return new CopybookDependency(info.getName(), Kind.RESOLVED, info.getPath(), info.getLines(), nested);
    }

    static CopybookDependency unresolved(String name) {
        return new CopybookDependency(name, Kind.UNRESOLVED, null, 0, List.of());
    }

    static CopybookDependency circular(String name) {
        return new CopybookDependency(name, Kind.CIRCULAR, null, 0, List.of());
    }

    public String getName() {
        return name;
    }

    public Kind getKind() {
        return kind;
    }

    /** {@code null} unless resolved. */
    public Path getPath() {
        return path;
    }

    public int getLines() {
        return lines;
    }

    public List<CopybookDependency> getNested() {
        return nested;
    }

    @Override
    public String toString() {
        return name + " " + kind + (nested.isEmpty() ? "" : " " + nested);
    }
}
