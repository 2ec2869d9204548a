package com.placerank.repository;

import com.placerank.config.JacksonConfiguration;
import com.placerank.model.CacheEntry;
import com.placerank.model.CacheKey;
import com.placerank.model.Place;
import com.placerank.model.dto.CacheStatistics;
import com.placerank.support.MutableClock;
import com.placerank.support.TestPlaces;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FileCacheStore.
 */
class FileCacheStoreTest {

    private static final Duration TTL = Duration.ofHours(1);
    private static final CacheKey KEY = new CacheKey("search:abc");

    @TempDir
    Path directory;

    private MutableClock clock;
    private FileCacheStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        store = newStore();
    }

    private FileCacheStore newStore() {
        return new FileCacheStore(directory, TTL, 100, JacksonConfiguration.createObjectMapper(), clock);
    }

    @Test
    void testPutThenGet() {
        List<Place> places = TestPlaces.numbered(3);
        store.put(KEY, places);

        Optional<CacheEntry> entry = store.get(KEY);

        assertTrue(entry.isPresent());
        assertEquals(places, entry.get().payload());
        assertEquals(TTL, entry.get().ttl());
        assertEquals(TTL, store.defaultTtl());
        assertEquals(clock.instant(), entry.get().storedAt());
    }

    @Test
    void testMissingKey() {
        assertTrue(store.get(new CacheKey("search:missing")).isEmpty());
    }

    @Test
    void testRecordSurvivesRestart() {
        store.put(KEY, TestPlaces.numbered(2));

        FileCacheStore reopened = newStore();

        Optional<CacheEntry> entry = reopened.get(KEY);
        assertTrue(entry.isPresent());
        assertEquals(2, entry.get().payload().size());
        assertEquals("p1", entry.get().payload().get(0).getId());
    }

    @Test
    void testStaleEntryNotReturnedButKept() throws IOException {
        store.put(KEY, TestPlaces.numbered(1));

        clock.advance(TTL.minusSeconds(1));
        assertTrue(store.get(KEY).isPresent());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(store.get(KEY).isEmpty(), "entry at exactly ttl is stale");
        assertEquals(1, countRecords(), "stale entries stay on disk until purged");

        assertTrue(newStore().get(KEY).isEmpty(), "a fresh memo never revives a stale record");
    }

    @Test
    void testCustomTtl() {
        store.put(KEY, TestPlaces.numbered(1), Duration.ofMinutes(5));

        clock.advance(Duration.ofMinutes(6));

        assertTrue(store.get(KEY).isEmpty());
    }

    @Test
    void testEmptyPayloadIsCached() {
        store.put(KEY, List.of());

        Optional<CacheEntry> entry = store.get(KEY);

        assertTrue(entry.isPresent());
        assertTrue(entry.get().isEmpty());
    }

    @Test
    void testLastWriterWins() throws IOException {
        store.put(KEY, TestPlaces.numbered(1));
        store.put(KEY, TestPlaces.numbered(4));

        assertEquals(4, newStore().get(KEY).orElseThrow().payload().size());
        assertEquals(1, countRecords());
    }

    @Test
    void testCorruptedRecordIsMiss() throws IOException {
        store.put(KEY, TestPlaces.numbered(2));
        try (Stream<Path> files = Files.list(directory)) {
            Path record = files.findFirst().orElseThrow();
            Files.write(record, "definitely not gzip".getBytes());
        }

        assertTrue(newStore().get(KEY).isEmpty());
    }

    @Test
    void testPhotoReferencesCapped() {
        Place place = TestPlaces.place("p1", "Museo del Oro").toBuilder()
                .photoReferences(List.of("a", "b", "c", "d", "e", "f", "g"))
                .build();

        store.put(KEY, List.of(place));

        assertEquals(Place.MAX_PHOTOS, newStore().get(KEY).orElseThrow().payload().get(0).getPhotoReferences().size());
    }

    @Test
    void testPurgeExpired() throws IOException {
        CacheKey shortLived = new CacheKey("details:p1");
        store.put(KEY, TestPlaces.numbered(1));
        store.put(shortLived, TestPlaces.numbered(1), Duration.ofMinutes(1));
        Files.write(directory.resolve("search_broken.json.gz"), new byte[]{1, 2, 3});

        clock.advance(Duration.ofMinutes(2));
        int removed = store.purgeExpired();

        assertEquals(2, removed);
        assertEquals(1, countRecords());
        assertTrue(store.get(KEY).isPresent());
        assertTrue(store.get(shortLived).isEmpty());
    }

    @Test
    void testClear() throws IOException {
        store.put(KEY, TestPlaces.numbered(1));
        store.put(new CacheKey("details:p1"), TestPlaces.numbered(1));

        assertEquals(2, store.clear());
        assertEquals(0, countRecords());
        assertTrue(store.get(KEY).isEmpty());
    }

    @Test
    void testStats() {
        store.put(KEY, TestPlaces.numbered(2));
        store.get(KEY);
        store.get(KEY);
        store.get(new CacheKey("search:other"));

        CacheStatistics stats = store.stats();

        assertEquals(2, stats.getHitCount());
        assertEquals(1, stats.getMissCount());
        assertEquals(1, stats.getEntryCount());
        assertEquals(2.0 / 3, stats.getHitRate(), 1e-9);
        assertTrue(stats.getTotalSizeBytes() > 0);
        assertEquals(3600, stats.getTtlSeconds());
    }

    @Test
    void testRejectsNonPositiveTtl() {
        assertThrows(IllegalArgumentException.class, () ->
                new FileCacheStore(directory, Duration.ZERO, 10, JacksonConfiguration.createObjectMapper(), clock));
    }

    private long countRecords() throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(file -> file.toString().endsWith(".json.gz")).count();
        }
    }
}
