package io.github.vevoly.jscopedcache.core;

import io.github.vevoly.jscopedcache.api.ScopedCacheHandle;
import io.github.vevoly.jscopedcache.api.constants.CacheTypes;
import io.github.vevoly.jscopedcache.api.structure.CacheStatsReport;
import io.github.vevoly.jscopedcache.core.internal.ScopedCacheImpl;
import io.github.vevoly.jscopedcache.core.properties.ScopedCacheRootProperties;
import io.github.vevoly.jscopedcache.core.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ScopedCacheFactoryTest {

    @Test
    void readThroughInvalidateAndReportEndToEnd() {
        ScopedCacheRootProperties properties = new ScopedCacheRootProperties();
        properties.setSweepInterval(Duration.ZERO);
        MutableClock clock = new MutableClock(0L);
        AtomicInteger loads = new AtomicInteger();

        try (ScopedCacheHandle cache = ScopedCacheFactory.open(properties, clock)) {
            String key = cache.buildKey(CacheTypes.DASHBOARD, "u1", "s1");

            cache.fetch(key, CacheTypes.DASHBOARD, loads::incrementAndGet);
            cache.fetch(key, CacheTypes.DASHBOARD, loads::incrementAndGet);
            assertEquals(1, loads.get());

            assertEquals(1, cache.invalidate(CacheTypes.DASHBOARD, "u1", "s1", List.of()));
            cache.fetch(key, CacheTypes.DASHBOARD, loads::incrementAndGet);
            assertEquals(2, loads.get());

            CacheStatsReport report = cache.report();
            assertEquals(1, report.getTotalKeys());
            assertEquals(1, report.getHits());
            assertEquals(2, report.getMisses());
            assertEquals(500, report.getMaxEntries());
        }
    }

    @Test
    void dashboardEntriesExpireWithTheirPolicy() {
        ScopedCacheRootProperties properties = new ScopedCacheRootProperties();
        properties.setSweepInterval(Duration.ZERO);
        MutableClock clock = new MutableClock(0L);

        try (ScopedCacheHandle cache = ScopedCacheFactory.open(properties, clock)) {
            String key = cache.buildKey(CacheTypes.DASHBOARD, "u1", "s1");
            cache.fetch(key, CacheTypes.DASHBOARD, () -> "stats");

            clock.advanceSeconds(180);
            assertTrue(cache.keys().contains(key));
            clock.advanceSeconds(1);
            assertFalse(cache.keys().contains(key));
            assertEquals(180, cache.policyOf(CacheTypes.DASHBOARD).getTtlSeconds());
        }
    }

    @Test
    void flushAllIsIdempotent() {
        ScopedCacheRootProperties properties = new ScopedCacheRootProperties();
        properties.setSweepInterval(Duration.ZERO);

        try (ScopedCacheHandle cache = ScopedCacheFactory.open(properties, new MutableClock(0L))) {
            cache.fetch("mensajes:u1:s1", CacheTypes.MESSAGES, () -> "m");
            cache.flushAll();
            cache.flushAll();

            assertTrue(cache.keys().isEmpty());
            assertEquals(0, cache.report().getTotalKeys());
        }
    }

    @Test
    void closeStopsTheSweeper() {
        ScopedCacheRootProperties properties = new ScopedCacheRootProperties();
        properties.setSweepInterval(Duration.ofSeconds(30));

        ScopedCacheHandle cache = ScopedCacheFactory.open(properties, new MutableClock(0L));
        assertTrue(((ScopedCacheImpl) cache).isSweeperRunning());

        cache.close();
        assertFalse(((ScopedCacheImpl) cache).isSweeperRunning());
        cache.close();
    }

    @Test
    void invalidConfigurationFailsToOpen() {
        ScopedCacheRootProperties properties = new ScopedCacheRootProperties();
        properties.setMaxEntries(-1);

        assertThrows(IllegalStateException.class, () -> ScopedCacheFactory.open(properties, new MutableClock(0L)));
    }
}
