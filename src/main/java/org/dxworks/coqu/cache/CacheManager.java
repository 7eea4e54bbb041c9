package org.dxworks.coqu.cache;

import org.dxworks.coqu.model.cobol.COBOLProgram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Content-addressed program cache: one {@code <sha256>.coqu} file per distinct source.
 *
 * <p>A file that cannot be read back is a miss and is deleted. No operation throws; failures
 * are logged and reported through return values.
 */
public class CacheManager {

    private static final Logger LOG = LoggerFactory.getLogger(CacheManager.class);

    public static final String EXTENSION = ".coqu";

    private static final Pattern HEX_KEY = Pattern.compile("[0-9a-fA-F]+");

    private final Path cacheDir;
    private final ProgramSerializer serializer;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong saves = new AtomicLong();

    public CacheManager() {
        this(defaultCacheDir());
    }

    public CacheManager(Path cacheDir) {
        this(cacheDir, new ProgramSerializer());
    }

    CacheManager(Path cacheDir, ProgramSerializer serializer) {
        this.cacheDir = cacheDir;
        this.serializer = serializer;
        try {
            Files.createDirectories(cacheDir);
        } catch (IOException e) {
            LOG.warn("Could not create cache directory {}: {}", cacheDir, e.getMessage());
        }
    }

    public static Path defaultCacheDir() {
        return Paths.get(System.getProperty("user.home"), ".cache", "coqu");
    }

    public Path getCacheDir() {
        return cacheDir;
    }

    public Optional<COBOLProgram> get(String sourceHash) {
        if (!isValidKey(sourceHash)) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        Path file = pathFor(sourceHash);
        if (!Files.isRegularFile(file)) {
            misses.incrementAndGet();
            return Optional.empty();
        }

        Optional<COBOLProgram> program = serializer.load(file);
        if (program.isPresent()) {
            hits.incrementAndGet();
        } else {
            misses.incrementAndGet();
            LOG.debug("Dropping unreadable cache entry {}", file);
            delete(file);
        }
        return program;
    }

    public boolean put(String sourceHash, COBOLProgram program) {
        if (!isValidKey(sourceHash) || program == null) {
            return false;
        }
        boolean saved = serializer.save(program, pathFor(sourceHash));
        if (saved) {
            saves.incrementAndGet();
        }
        return saved;
    }

    public boolean remove(String sourceHash) {
        if (!isValidKey(sourceHash)) {
            return false;
        }
        return delete(pathFor(sourceHash));
    }

    /**
     * @return number of cache files deleted
     */
    public int clear() {
        int count = 0;
        for (Path file : cacheFiles()) {
            if (delete(file)) count++;
        }
        return count;
    }

    /**
     * Deletes entries last written more than {@code maxAgeDays} ago.
     *
     * @return number of cache files deleted
     */
    public int cleanupOld(int maxAgeDays) {
        Instant cutoff = Instant.now().minus(Duration.ofDays(maxAgeDays));
        int count = 0;
        for (CachedEntry entry : listCached()) {
            if (entry.getModified().isBefore(cutoff) && delete(pathFor(entry.getHash()))) {
                count++;
            }
        }
        return count;
    }

    /**
     * Deletes the oldest entries until the cache holds at most {@code maxSizeMb} megabytes.
     *
     * @return number of cache files deleted
     */
    public int cleanupBySize(long maxSizeMb) {
        long maxBytes = maxSizeMb * 1024L * 1024L;
        List<CachedEntry> oldestFirst = new ArrayList<>(listCached());
        oldestFirst.sort(Comparator.comparing(CachedEntry::getModified));

        long total = oldestFirst.stream().mapToLong(CachedEntry::getSizeBytes).sum();
        int count = 0;
        for (CachedEntry entry : oldestFirst) {
            if (total <= maxBytes) break;
            if (delete(pathFor(entry.getHash()))) {
                total -= entry.getSizeBytes();
                count++;
            }
        }
        return count;
    }

    public CacheStats stats() {
        List<CachedEntry> entries = listCached();
        long totalBytes = entries.stream().mapToLong(CachedEntry::getSizeBytes).sum();
        return new CacheStats(hits.get(), misses.get(), saves.get(), entries.size(), totalBytes);
    }

    /**
     * Cache files on disk, newest first.
     */
    public List<CachedEntry> listCached() {
        List<CachedEntry> entries = new ArrayList<>();
        for (Path file : cacheFiles()) {
            try {
                BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
                entries.add(new CachedEntry(hashOf(file), attrs.size(), attrs.lastModifiedTime().toInstant()));
            } catch (IOException e) {
                LOG.debug("Skipping cache file {}: {}", file, e.getMessage());
            }
        }
        entries.sort(Comparator.comparing(CachedEntry::getModified).reversed());
        return entries;
    }

    Path pathFor(String sourceHash) {
        return cacheDir.resolve(sourceHash + EXTENSION);
    }

    static boolean isValidKey(String sourceHash) {
        return sourceHash != null && HEX_KEY.matcher(sourceHash).matches();
    }

    private List<Path> cacheFiles() {
        if (!Files.isDirectory(cacheDir)) return List.of();
        try (Stream<Path> files = Files.list(cacheDir)) {
            return files
                    .filter(p -> p.getFileName().toString().endsWith(EXTENSION))
                    .filter(Files::isRegularFile)
                    .collect(Collectors.toList());
        } catch (IOException e) {
            LOG.warn("Could not list cache directory {}: {}", cacheDir, e.getMessage());
            return List.of();
        }
    }

    private static String hashOf(Path file) {
        String name = file.getFileName().toString();
        return name.substring(0, name.length() - EXTENSION.length());
    }

    private static boolean delete(Path file) {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Could not delete cache file {}: {}", file, e.getMessage());
            return false;
        }
    }
}
