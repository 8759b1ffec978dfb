package io.github.vevoly.jscopedcache.core.internal;

import io.github.vevoly.jscopedcache.api.structure.CacheStatsReport;
import io.github.vevoly.jscopedcache.core.store.TtlStore;
import io.github.vevoly.jscopedcache.core.support.MutableClock;
import io.github.vevoly.jscopedcache.core.support.TestPolicies;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StatsReporterTest {

    private TtlStore store;
    private StatsReporter reporter;

    @BeforeEach
    void setUp() {
        store = new TtlStore(new MutableClock(0L), 50);
        reporter = new StatsReporter(store, TestPolicies.resolver(
                TestPolicies.withType(TestPolicies.properties(50, true), "custom", Duration.ofSeconds(10))));
    }

    @Test
    void emptyStoreReportsZeroHitRate() {
        CacheStatsReport report = reporter.report();

        assertEquals(0, report.getTotalKeys());
        assertEquals(0d, report.getHitRatePercent());
        assertTrue(report.getPerTypeKeyCount().isEmpty());
        assertEquals(50, report.getMaxEntries());
    }

    @Test
    void oneHitAndOneMissIsFiftyPercent() {
        store.set("dashboard:u1:s1", "v", 60);
        store.get("dashboard:u1:s1");
        store.get("dashboard:u2:s1");

        CacheStatsReport report = reporter.report();

        assertEquals(1, report.getHits());
        assertEquals(1, report.getMisses());
        assertEquals(50d, report.getHitRatePercent());
    }

    @Test
    void groupsLiveKeysByType() {
        store.set("dashboard:u1:s1", 1, 60);
        store.set("dashboard:u2:s1", 2, 60);
        store.set("mensajes:u1:s1", 3, 60);

        CacheStatsReport report = reporter.report();

        assertEquals(3, report.getTotalKeys());
        assertEquals(Map.of("dashboard", 2, "mensajes", 1), report.getPerTypeKeyCount());
    }

    @Test
    void listsBuiltInAndConfiguredTypesSorted() {
        CacheStatsReport report = reporter.report();

        assertTrue(report.getConfiguredTypes().contains("custom"));
        assertTrue(report.getConfiguredTypes().contains("escuela"));
        assertEquals(22, report.getConfiguredTypes().size());
        assertEquals("acudientes", report.getConfiguredTypes().get(0));
    }

    @Test
    void hitRateIsNotRounded() {
        assertEquals(100d / 3, StatsReporter.hitRatePercent(1, 2), 1e-9);
        assertEquals(50d, StatsReporter.hitRatePercent(1, 1));
        assertEquals(100d, StatsReporter.hitRatePercent(3, 0));
    }
}
