package org.dxworks.coqu.cache;

import java.time.Instant;

/**
 * One cache file as found on disk.
 */
public final class CachedEntry {

    private final String hash;
    private final long sizeBytes;
    private final Instant modified;

    public CachedEntry(String hash, long sizeBytes, Instant modified) {
        this.hash = hash;
        this.sizeBytes = sizeBytes;
        this.modified = modified;
    }

    public String getHash() {
        return hash;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public Instant getModified() {
        return modified;
    }

    @Override
    public String toString() {
        return hash + " (" + sizeBytes + " bytes, " + modified + ")";
    }
}
