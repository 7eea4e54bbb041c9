package org.dxworks.coqu.model.cobol;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.Optional;

/**
 * A COPY statement found while preprocessing.
 * Starts out {@link CopybookStatus#UNRESOLVED} and is updated as resolution and inlining proceed.
 */
public class CopybookRef {
    public String name;
    public int line;
    public String library;
    public String resolvedPath;
    public String replacing;
    public CopybookStatus status = CopybookStatus.UNRESOLVED;

    public CopybookRef() {
    }

    public CopybookRef(String name, int line, String library, String replacing) {
        this.name = name;
        this.line = line;
        this.library = library;
        this.replacing = replacing;
    }

    public Optional<Path> resolvedFile() {
        return resolvedPath == null ? Optional.empty() : Optional.of(Paths.get(resolvedPath));
    }

    public void markResolved(Path path) {
        this.resolvedPath = path.toString();
        this.status = CopybookStatus.RESOLVED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CopybookRef)) return false;
        CopybookRef that = (CopybookRef) o;
        return line == that.line
                && Objects.equals(name, that.name)
                && Objects.equals(library, that.library)
                && Objects.equals(resolvedPath, that.resolvedPath)
                && Objects.equals(replacing, that.replacing)
                && status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, line, library, resolvedPath, replacing, status);
    }

    @Override
    public String toString() {
        return "COPY " + name + " (line " + line + ", " + status.tag() + ")";
    }
}
