package io.github.vevoly.jscopedcache.core.store;

import io.github.vevoly.jscopedcache.api.structure.StoreStats;
import io.github.vevoly.jscopedcache.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TtlStoreTest {

    private MutableClock clock;
    private TtlStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(0L);
        store = new TtlStore(clock, 3);
    }

    @Test
    void entryIsLiveUpToTtlAndGoneAfter() {
        store.set("k", "v", 5);

        clock.advanceSeconds(5);
        assertEquals(Optional.of("v"), store.get("k"));

        clock.advanceSeconds(1);
        assertEquals(Optional.empty(), store.get("k"));
    }

    @Test
    void expiryBoundaryIsStrict() {
        store.set("k", "v", 5);
        clock.advanceMillis(5000);
        assertTrue(store.get("k").isPresent());
        clock.advanceMillis(1);
        assertFalse(store.get("k").isPresent());
    }

    @Test
    void zeroTtlNeverStoresAndRemovesPrevious() {
        store.set("k", "old", 60);
        store.set("k", "new", 0);

        assertFalse(store.get("k").isPresent());
        assertTrue(store.keys().isEmpty());
    }

    @Test
    void nullValueIsNotStored() {
        store.set("k", null, 60);
        assertFalse(store.get("k").isPresent());
    }

    @Test
    void rejectsInvalidConstruction() {
        assertThrows(IllegalArgumentException.class, () -> new TtlStore(clock, 0));
        assertThrows(IllegalArgumentException.class, () -> new TtlStore(null, 10));
    }

    @Test
    void neverExceedsCapacityAndEvictsOldestInsertion() {
        store.set("a", 1, 60);
        store.set("b", 2, 60);
        store.set("c", 3, 60);
        // reading does not change eviction order
        store.get("a");

        store.set("d", 4, 60);

        assertEquals(Set.of("b", "c", "d"), store.keys());
        assertEquals(3, store.stats().getSize());
    }

    @Test
    void replacingKeyMovesItToYoungestPosition() {
        store.set("a", 1, 60);
        store.set("b", 2, 60);
        store.set("c", 3, 60);

        store.set("a", 10, 60);
        store.set("d", 4, 60);

        assertEquals(List.of("c", "a", "d"), List.copyOf(store.keys()));
        assertEquals(Optional.of(10), store.get("a"));
    }

    @Test
    void evictionPrefersExpiredEntries() {
        store.set("a", 1, 60);
        store.set("short", 2, 1);
        store.set("c", 3, 60);
        clock.advanceSeconds(2);

        store.set("d", 4, 60);

        assertEquals(Set.of("a", "c", "d"), store.keys());
    }

    @Test
    void deleteByPrefixRemovesMatchingKeysOnly() {
        store.set("dashboard:u1:s1", 1, 60);
        store.set("dashboard:u1:s1:q", 2, 60);
        store.set("mensajes:u1:s1", 3, 60);

        assertEquals(2, store.deleteByPrefix("dashboard:"));
        assertEquals(Set.of("mensajes:u1:s1"), store.keys());
    }

    @Test
    void deleteReportsWhetherLiveEntryWasRemoved() {
        store.set("k", "v", 60);
        assertTrue(store.delete("k"));
        assertFalse(store.delete("k"));
    }

    @Test
    void flushAllIsIdempotent() {
        store.set("a", 1, 60);
        store.flushAll();
        store.flushAll();
        assertTrue(store.keys().isEmpty());
        assertEquals(0, store.stats().getSize());
    }

    @Test
    void countsHitsAndMissesOnlyOnGet() {
        store.set("k", "v", 60);
        store.get("k");
        store.get("missing");
        store.keys();
        store.stats();

        StoreStats stats = store.stats();
        assertEquals(1, stats.getHitCount());
        assertEquals(1, stats.getMissCount());
        assertEquals(1, stats.getSize());
    }

    @Test
    void sweepRemovesOnlyExpiredEntries() {
        store.set("short", 1, 1);
        store.set("long", 2, 60);
        clock.advanceSeconds(2);

        assertEquals(1, store.sweepExpired());
        assertEquals(Set.of("long"), store.keys());
    }

    @Test
    void statsSizeIgnoresExpiredEntries() {
        store.set("short", 1, 1);
        store.set("long", 2, 60);
        clock.advanceSeconds(2);

        assertEquals(1, store.stats().getSize());
    }

    @Test
    void hugeTtlDoesNotOverflowIntoImmediateExpiry() {
        store.set("forever", "v", Long.MAX_VALUE / 10);
        clock.advanceSeconds(365L * 24 * 3600);

        assertEquals(Optional.of("v"), store.get("forever"));
        assertEquals(Set.of("forever"), store.keys());
    }

    @Test
    void concurrentMutationsKeepCapacityAndSizeConsistent() throws Exception {
        int maxEntries = 50;
        int threads = 8;
        TtlStore shared = new TtlStore(clock, maxEntries);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                int worker = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 5000; i++) {
                        shared.set("w" + worker + ":" + i, i, i % 2 == 0 ? 1 : 60);
                        if (i % 100 == 0) {
                            shared.deleteByPrefix("w" + ((worker + 1) % threads) + ":");
                        }
                        if (i % 250 == 0) {
                            shared.sweepExpired();
                        }
                        if (i % 500 == 0) {
                            assertTrue(shared.keys().size() <= maxEntries);
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            clock.advanceSeconds(2);
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        Set<String> keys = shared.keys();
        assertTrue(keys.size() <= maxEntries);
        assertEquals(keys.size(), shared.stats().getSize());
    }
}
