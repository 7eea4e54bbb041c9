package org.dxworks.coqu.cache;

/**
 * Counters of one {@link CacheManager} plus what is currently on disk.
 */
public final class CacheStats {

    private final long hits;
    private final long misses;
    private final long saves;
    private final int fileCount;
    private final long totalSizeBytes;

    public CacheStats(long hits, long misses, long saves, int fileCount, long totalSizeBytes) {
        this.hits = hits;
        this.misses = misses;
        this.saves = saves;
        this.fileCount = fileCount;
        this.totalSizeBytes = totalSizeBytes;
    }

    public long getHits() {
        return hits;
    }

    public long getMisses() {
        return misses;
    }

    public long getSaves() {
        return saves;
    }

    public int getFileCount() {
        return fileCount;
    }

    public long getTotalSizeBytes() {
        return totalSizeBytes;
    }

    public double getTotalSizeMb() {
        return Math.round(totalSizeBytes / (1024.0 * 1024.0) * 100.0) / 100.0;
    }

    /** Percentage of lookups that hit, one decimal; 0 before the first lookup. */
    public double getHitRate() {
        long total = hits + misses;
        if (total == 0) return 0.0;
        return Math.round(hits * 1000.0 / total) / 10.0;
    }

    @Override
    public String toString() {
        return "CacheStats{hits=" + hits + ", misses=" + misses + ", saves=" + saves
                + ", files=" + fileCount + ", bytes=" + totalSizeBytes + "}";
    }
}
