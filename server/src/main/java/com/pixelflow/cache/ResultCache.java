package com.pixelflow.cache;

import com.pixelflow.server.error.CacheException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Size-bounded, least-recently-used cache persisted to a directory: a SQLite
 * index plus one payload file per entry. Failures while reading or writing an
 * entry degrade to a miss or a skipped write, they never reach the caller.
 */
public class ResultCache<V> {

    private static final Logger logger = LoggerFactory.getLogger(ResultCache.class);

    public static final String INDEX_FILE_NAME = "cache_index.db";
    public static final String PAYLOAD_SUFFIX = ".cache";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path directory;
    private final CacheIndexDao indexDao;
    private final PayloadCodec<V> codec;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    // Guarded by lock
    private final Map<String, CacheEntry> entries = new HashMap<>();
    private long sizeBytes;
    private long sizeLimitBytes;
    private long lastTimestamp;

    public ResultCache(Path directory, long sizeLimitBytes, PayloadCodec<V> codec) {
        this.directory = directory;
        this.codec = codec;
        this.sizeLimitBytes = sizeLimitBytes;
        String dbPath = directory.resolve(INDEX_FILE_NAME).toString();
        try {
            Files.createDirectories(directory);
            SqliteInitializer.initialize(dbPath);
        } catch (IOException | SQLException e) {
            throw new CacheException("Failed to open cache at " + directory, e);
        }
        this.indexDao = new CacheIndexDao(dbPath);
        reconcile();
        logger.info("Opened result cache at {} with {} entries ({} of {} bytes)",
                directory, entries.size(), sizeBytes, sizeLimitBytes);
    }

    public Optional<V> get(String key) {
        lock.writeLock().lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            Path file = directory.resolve(entry.getFileName());
            V value;
            try {
                value = codec.decode(Files.readAllBytes(file));
            } catch (IOException | RuntimeException e) {
                logger.warn("Dropping unreadable cache entry {}: {}", key, e.getMessage());
                removeEntry(entry);
                return Optional.empty();
            }

            long now = nextTimestamp();
            entries.put(key, entry.withLastAccessedAt(now));
            try {
                indexDao.touch(key, now);
            } catch (SQLException e) {
                logger.warn("Failed to record access time for cache entry {}", key, e);
            }
            return Optional.ofNullable(value);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Stores {@code value}, evicting least recently used entries as needed.
     *
     * @return false when the write was skipped because the payload is too large
     *         or could not be persisted
     */
    public boolean put(String key, V value) {
        byte[] payload;
        try {
            payload = codec.encode(value);
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to serialize cache entry {}, skipping write", key, e);
            return false;
        }

        lock.writeLock().lock();
        try {
            if (payload.length > sizeLimitBytes / 4) {
                logger.debug("Cache entry {} is {} bytes, over a quarter of the {} byte limit, skipping",
                        key, payload.length, sizeLimitBytes);
                return false;
            }

            CacheEntry previous = entries.get(key);
            if (previous != null) {
                removeEntry(previous);
            }
            evictUntil(sizeLimitBytes - payload.length);

            String fileName = fileNameFor(key);
            Path target = directory.resolve(fileName);
            try {
                writeAtomically(target, payload);
            } catch (IOException e) {
                logger.warn("Failed to write cache payload for {}, skipping", key, e);
                return false;
            }

            long now = nextTimestamp();
            CacheEntry entry = new CacheEntry(key, fileName, payload.length, now, now);
            try {
                indexDao.upsert(entry);
            } catch (SQLException e) {
                logger.warn("Failed to index cache entry {}, skipping", key, e);
                deleteQuietly(target);
                return false;
            }
            entries.put(key, entry);
            sizeBytes += payload.length;
            logger.debug("Cached {} ({} bytes, total {} of {})", key, payload.length, sizeBytes, sizeLimitBytes);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean containsKey(String key) {
        lock.readLock().lock();
        try {
            return entries.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean remove(String key) {
        lock.writeLock().lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                return false;
            }
            removeEntry(entry);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            try {
                indexDao.deleteAll();
            } catch (SQLException e) {
                throw new CacheException("Failed to clear cache index", e);
            }
            for (CacheEntry entry : entries.values()) {
                deleteQuietly(directory.resolve(entry.getFileName()));
            }
            int removed = entries.size();
            entries.clear();
            sizeBytes = 0;
            logger.info("Cleared {} cache entries", removed);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public long getSizeBytes() {
        lock.readLock().lock();
        try {
            return sizeBytes;
        } finally {
            lock.readLock().unlock();
        }
    }

    public long getSizeLimitBytes() {
        lock.readLock().lock();
        try {
            return sizeLimitBytes;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void setSizeLimitBytes(long limit) {
        lock.writeLock().lock();
        try {
            sizeLimitBytes = limit;
            evictUntil(limit);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int getCount() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Path getDirectory() {
        return directory;
    }

    // Caller holds the write lock
    private void evictUntil(long budget) {
        if (sizeBytes <= budget) {
            return;
        }
        List<CacheEntry> byAge = new ArrayList<>(entries.values());
        byAge.sort(Comparator.comparingLong(CacheEntry::getLastAccessedAt).thenComparing(CacheEntry::getKey));
        int evicted = 0;
        for (CacheEntry entry : byAge) {
            if (sizeBytes <= budget) {
                break;
            }
            removeEntry(entry);
            evicted++;
        }
        logger.info("Evicted {} cache entries, {} of {} bytes in use", evicted, sizeBytes, sizeLimitBytes);
    }

    // Caller holds the write lock
    private void removeEntry(CacheEntry entry) {
        entries.remove(entry.getKey());
        sizeBytes -= entry.getPayloadSize();
        try {
            indexDao.delete(entry.getKey());
        } catch (SQLException e) {
            logger.warn("Failed to remove cache index row {}", entry.getKey(), e);
        }
        deleteQuietly(directory.resolve(entry.getFileName()));
    }

    /**
     * Loads the index, dropping rows whose payload is gone and deleting payload
     * files no row refers to.
     */
    private void reconcile() {
        List<CacheEntry> indexed;
        try {
            indexed = indexDao.findAllByAccessOrder();
        } catch (SQLException e) {
            throw new CacheException("Failed to read cache index", e);
        }
        Set<String> liveFiles = new HashSet<>();
        int dropped = 0;
        for (CacheEntry entry : indexed) {
            if (Files.isRegularFile(directory.resolve(entry.getFileName()))) {
                entries.put(entry.getKey(), entry);
                sizeBytes += entry.getPayloadSize();
                lastTimestamp = Math.max(lastTimestamp, entry.getLastAccessedAt());
                liveFiles.add(entry.getFileName());
            } else {
                try {
                    indexDao.delete(entry.getKey());
                } catch (SQLException e) {
                    logger.warn("Failed to drop orphaned index row {}", entry.getKey(), e);
                }
                dropped++;
            }
        }

        int swept = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                boolean payload = name.endsWith(PAYLOAD_SUFFIX) && !liveFiles.contains(name);
                if (payload || name.endsWith(TEMP_SUFFIX)) {
                    deleteQuietly(file);
                    swept++;
                }
            }
        } catch (IOException e) {
            logger.warn("Failed to sweep cache directory {}", directory, e);
        }
        if (dropped > 0 || swept > 0) {
            logger.info("Cache reconciliation dropped {} stale index rows and {} unindexed files", dropped, swept);
        }
    }

    private long nextTimestamp() {
        lastTimestamp = Math.max(System.currentTimeMillis(), lastTimestamp + 1);
        return lastTimestamp;
    }

    private void writeAtomically(Path target, byte[] payload) throws IOException {
        Path temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
        Files.write(temp, payload);
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("Failed to delete cache file {}", file, e);
        }
    }

    static String fileNameFor(String key) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(key.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash) + PAYLOAD_SUFFIX;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
