package org.dxworks.coqu.model.cobol;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A program as handed back by the loader, with where it came from and what it cost.
 */
public final class LoadedProgram {

    private final String name;
    private final Path path;
    private final COBOLProgram program;
    private final Instant loadedAt;
    private final boolean fromCache;
    private final double parseTimeMs;

    public LoadedProgram(String name, Path path, COBOLProgram program, Instant loadedAt,
                         boolean fromCache, double parseTimeMs) {
        this.name = name;
        this.path = path;
        this.program = program;
        this.loadedAt = loadedAt;
        this.fromCache = fromCache;
        this.parseTimeMs = parseTimeMs;
    }

    /** File name without extension. */
    public String getName() {
        return name;
    }

    public Path getPath() {
        return path;
    }

    public COBOLProgram getProgram() {
        return program;
    }

    public Instant getLoadedAt() {
        return loadedAt;
    }

    public boolean isFromCache() {
        return fromCache;
    }

    /** Zero when served from the cache. */
    public double getParseTimeMs() {
        return parseTimeMs;
    }

    public String getProgramId() {
        return program.programId;
    }

    public String getSourceHash() {
        return program.sourceHash;
    }

    @Override
    public String toString() {
        String cached = fromCache ? " (cached)" : "";
        return name + ": " + program.programId + " (" + program.lines + " lines)" + cached;
    }
}
