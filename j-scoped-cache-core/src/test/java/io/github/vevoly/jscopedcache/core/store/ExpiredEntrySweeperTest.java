package io.github.vevoly.jscopedcache.core.store;

import io.github.vevoly.jscopedcache.core.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ExpiredEntrySweeperTest {

    @Test
    void sweepOnceRemovesExpiredEntries() {
        MutableClock clock = new MutableClock(0L);
        TtlStore store = new TtlStore(clock, 10);
        store.set("a", 1, 1);
        store.set("b", 2, 60);
        clock.advanceSeconds(2);

        ExpiredEntrySweeper sweeper = new ExpiredEntrySweeper(store, Duration.ofSeconds(60));

        assertEquals(1, sweeper.sweepOnce());
        assertEquals(1, store.stats().getSize());
    }

    @Test
    void sweepFailureIsContained() {
        TtlStore failing = new TtlStore(new MutableClock(0L), 10) {
            @Override
            public int sweepExpired() {
                throw new IllegalStateException("boom");
            }
        };
        ExpiredEntrySweeper sweeper = new ExpiredEntrySweeper(failing, Duration.ofSeconds(60));

        assertEquals(-1, sweeper.sweepOnce());
    }

    @Test
    void zeroIntervalDisablesSweeper() {
        ExpiredEntrySweeper sweeper = new ExpiredEntrySweeper(new TtlStore(new MutableClock(0L), 10), Duration.ZERO);
        sweeper.start();
        assertFalse(sweeper.isRunning());
        sweeper.close();
    }

    @Test
    void startAndCloseControlTheSchedule() {
        ExpiredEntrySweeper sweeper = new ExpiredEntrySweeper(new TtlStore(new MutableClock(0L), 10), Duration.ofSeconds(30));
        sweeper.start();
        assertTrue(sweeper.isRunning());

        sweeper.close();
        assertFalse(sweeper.isRunning());
        sweeper.close();
    }

    @Test
    void periodicSweepRunsInBackground() throws InterruptedException {
        CountDownLatch swept = new CountDownLatch(2);
        TtlStore store = new TtlStore(new MutableClock(0L), 10) {
            @Override
            public int sweepExpired() {
                int removed = super.sweepExpired();
                swept.countDown();
                return removed;
            }
        };
        ExpiredEntrySweeper sweeper = new ExpiredEntrySweeper(store, Duration.ofMillis(20));
        try {
            sweeper.start();
            assertTrue(swept.await(5, TimeUnit.SECONDS));
        } finally {
            sweeper.close();
        }
    }
}
