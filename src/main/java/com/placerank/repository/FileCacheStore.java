package com.placerank.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.placerank.exception.CacheCorruptionException;
import com.placerank.model.CacheEntry;
import com.placerank.model.CacheKey;
import com.placerank.model.Place;
import com.placerank.model.dto.CacheStatistics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * File-based cache store with gzip-compressed JSON records.
 * File pattern: {namespace}_{sha256(key)}.json.gz
 *
 * Records are written to a temp file and moved into place, so a concurrent reader sees either
 * the previous record or the new one. Decoded entries are memoized in a bounded Caffeine cache;
 * validity is always checked against the store clock, never against the memo's own expiry.
 */
@Slf4j
public class FileCacheStore implements CacheStore {

    private static final String FILE_SUFFIX = ".json.gz";
    private static final String TEMP_SUFFIX = ".tmp";
    private static final Pattern NAMESPACE = Pattern.compile("^([a-z]+):.*");

    private final Path directory;
    private final Duration defaultTtl;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Cache<String, CacheEntry> memo;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public FileCacheStore(Path directory, Duration defaultTtl, int memoMaxSize,
                          ObjectMapper objectMapper, Clock clock) {
        if (defaultTtl == null || defaultTtl.isZero() || defaultTtl.isNegative()) {
            throw new IllegalArgumentException("Cache ttl must be positive: " + defaultTtl);
        }
        this.directory = directory;
        this.defaultTtl = defaultTtl;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.memo = Caffeine.newBuilder()
                .maximumSize(memoMaxSize)
                .expireAfterWrite(defaultTtl)
                .build();

        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create cache directory " + directory, e);
        }

        log.info("Initialized file cache store: directory={}, ttl={}", directory.toAbsolutePath(), defaultTtl);
    }

    @Override
    public Optional<CacheEntry> get(CacheKey key) {
        Instant now = clock.instant();

        CacheEntry entry = memo.getIfPresent(key.value());
        if (entry == null) {
            entry = read(key).orElse(null);
            if (entry != null) {
                memo.put(key.value(), entry);
            }
        }

        if (entry == null) {
            misses.incrementAndGet();
            log.debug("Cache miss: {}", key);
            return Optional.empty();
        }

        if (!entry.isValidAt(now)) {
            misses.incrementAndGet();
            log.debug("Cache miss (stale, age={}): {}", entry.age(now), key);
            return Optional.empty();
        }

        hits.incrementAndGet();
        log.debug("Cache hit: {}, places={}", key, entry.payload().size());
        return Optional.of(entry);
    }

    @Override
    public void put(CacheKey key, List<Place> payload) {
        put(key, payload, defaultTtl);
    }

    @Override
    public void put(CacheKey key, List<Place> payload, Duration ttl) {
        List<Place> capped = payload.stream()
                .map(Place::withPhotoCap)
                .toList();
        CacheEntry entry = new CacheEntry(key, capped, clock.instant(), ttl);

        try {
            byte[] compressed = compress(CacheRecord.from(entry));
            writeAtomically(fileFor(key), compressed);
            memo.put(key.value(), entry);

            log.debug("Stored cache record: key={}, places={}, ttl={}, size={}B",
                    key, capped.size(), ttl, compressed.length);

        } catch (IOException e) {
            log.error("Error storing cache record: key={}", key, e);
            // Don't throw - cache failures shouldn't break requests
        }
    }

    @Override
    public int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;

        for (Path file : recordFiles()) {
            boolean expired;
            try {
                expired = !decode(Files.readAllBytes(file)).toEntry().isValidAt(now);
            } catch (NoSuchFileException e) {
                continue;
            } catch (IOException | CacheCorruptionException e) {
                log.warn("Removing unreadable cache record {}", file.getFileName());
                expired = true;
            }

            if (expired && delete(file)) {
                removed++;
            }
        }

        memo.asMap().values().removeIf(entry -> !entry.isValidAt(now));

        if (removed > 0) {
            log.info("Purged {} expired cache records", removed);
        }
        return removed;
    }

    @Override
    public int clear() {
        int removed = 0;
        for (Path file : recordFiles()) {
            if (delete(file)) {
                removed++;
            }
        }
        memo.invalidateAll();
        log.info("Cleared {} cache records", removed);
        return removed;
    }

    @Override
    public CacheStatistics stats() {
        List<Path> files = recordFiles();
        long totalSize = 0;
        for (Path file : files) {
            try {
                totalSize += Files.size(file);
            } catch (IOException e) {
                log.debug("Cache record vanished while sizing: {}", file.getFileName());
            }
        }

        long hitCount = hits.get();
        long missCount = misses.get();
        long lookups = hitCount + missCount;

        return CacheStatistics.builder()
                .hitCount(hitCount)
                .missCount(missCount)
                .entryCount(files.size())
                .hitRate(lookups > 0 ? (double) hitCount / lookups : 0.0)
                .totalSizeBytes(totalSize)
                .ttlSeconds(defaultTtl.toSeconds())
                .cacheDirectory(directory.toAbsolutePath().toString())
                .build();
    }

    @Override
    public Duration defaultTtl() {
        return defaultTtl;
    }

    /**
     * Read and decode the record for a key, if one exists and is readable.
     */
    private Optional<CacheEntry> read(CacheKey key) {
        Path file = fileFor(key);
        if (!Files.exists(file)) {
            return Optional.empty();
        }

        try {
            CacheRecord record = decode(Files.readAllBytes(file));
            if (!key.value().equals(record.key())) {
                log.warn("Cache record {} holds key {} instead of {}", file.getFileName(), record.key(), key);
                return Optional.empty();
            }
            return Optional.of(record.toEntry());

        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException | CacheCorruptionException e) {
            log.warn("Ignoring unreadable cache record {} for key {}: {}",
                    file.getFileName(), key, e.getMessage());
            return Optional.empty();
        }
    }

    private Path fileFor(CacheKey key) {
        var matcher = NAMESPACE.matcher(key.value());
        String namespace = matcher.matches() ? matcher.group(1) : "entry";
        return directory.resolve(namespace + "_" + DigestUtils.sha256Hex(key.value()) + FILE_SUFFIX);
    }

    private List<Path> recordFiles() {
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(file -> file.getFileName().toString().endsWith(FILE_SUFFIX))
                    .toList();
        } catch (IOException e) {
            log.error("Error listing cache directory {}", directory, e);
            return List.of();
        }
    }

    private boolean delete(Path file) {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete cache record {}", file.getFileName(), e);
            return false;
        }
    }

    private void writeAtomically(Path target, byte[] content) throws IOException {
        Path temp = Files.createTempFile(directory, "record-", TEMP_SUFFIX);
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * Serialize and compress a record using GZIP.
     */
    private byte[] compress(CacheRecord record) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (GZIPOutputStream gzipOut = new GZIPOutputStream(baos)) {
            gzipOut.write(objectMapper.writeValueAsBytes(record));
        }
        return baos.toByteArray();
    }

    /**
     * Decompress and deserialize a record.
     */
    private CacheRecord decode(byte[] compressed) {
        try (GZIPInputStream gzipIn = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            CacheRecord record = objectMapper.readValue(gzipIn.readAllBytes(), CacheRecord.class);
            if (record == null || record.key() == null || record.payload() == null) {
                throw new CacheCorruptionException("Incomplete cache record", null);
            }
            return record;
        } catch (IOException e) {
            throw new CacheCorruptionException("Cannot decode cache record", e);
        }
    }
}
