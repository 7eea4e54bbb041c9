package org.dxworks.coqu.workspace;

public final class WorkspaceStats {

    private final int programCount;
    private final long totalLines;
    private final int cachedCount;
    private final int copybookPathCount;

    public WorkspaceStats(int programCount, long totalLines, int cachedCount, int copybookPathCount) {
        this.programCount = programCount;
        this.totalLines = totalLines;
        this.cachedCount = cachedCount;
        this.copybookPathCount = copybookPathCount;
    }

    public int getProgramCount() {
        return programCount;
    }

    public long getTotalLines() {
        return totalLines;
    }

    /** Programs that were served from the cache when they were last loaded. */
    public int getCachedCount() {
        return cachedCount;
    }

    public int getCopybookPathCount() {
        return copybookPathCount;
    }

    @Override
    public String toString() {
        return programCount + " programs, " + totalLines + " lines, " + cachedCount + " from cache, "
                + copybookPathCount + " copybook paths";
    }
}
