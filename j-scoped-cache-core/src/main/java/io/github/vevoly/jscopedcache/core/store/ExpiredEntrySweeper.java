package io.github.vevoly.jscopedcache.core.store;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static io.github.vevoly.jscopedcache.api.constants.ScopedCacheConstants.LOG_PREFIX;

/**
 * 后台过期清理任务。
 * 按固定间隔调用 {@link TtlStore#sweepExpired()}，与读操作无关，保证即使没有读请求内存也是有界的。
 * <p>
 * Background expiry sweep.
 * Calls {@link TtlStore#sweepExpired()} at a fixed rate, independent of reads, so memory stays bounded even without traffic.
 *
 * @author vevoly
 */
@Slf4j
public class ExpiredEntrySweeper implements AutoCloseable {

    private final TtlStore store;
    private final Duration interval;
    private ScheduledExecutorService scheduler;

    public ExpiredEntrySweeper(TtlStore store, Duration interval) {
        this.store = store;
        this.interval = interval;
    }

    /**
     * 启动清理任务。间隔为空或不大于 0 时不启动。
     */
    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        if (interval == null || interval.isZero() || interval.isNegative()) {
            log.info(LOG_PREFIX + "[SWEEP] Background sweep disabled (interval={}).", interval);
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new BasicThreadFactory.Builder()
                .namingPattern("JScopedCache-Sweeper-%d")
                .daemon(true)
                .build());
        long periodMillis = interval.toMillis();
        scheduler.scheduleAtFixedRate(this::sweepOnce, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        log.info(LOG_PREFIX + "[SWEEP] Background sweep started, interval={}s", interval.getSeconds());
    }

    public synchronized boolean isRunning() {
        return scheduler != null && !scheduler.isShutdown();
    }

    /**
     * 执行一次清理。异常只记录日志，否则调度器会取消后续执行。
     *
     * @return 删除的条目数量，失败时为 -1
     */
    int sweepOnce() {
        try {
            int removed = store.sweepExpired();
            if (removed > 0) {
                log.debug(LOG_PREFIX + "[SWEEP] Removed {} expired entries.", removed);
            }
            return removed;
        } catch (RuntimeException e) {
            log.error(LOG_PREFIX + "[SWEEP] Expiry sweep failed.", e);
            return -1;
        }
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
            log.info(LOG_PREFIX + "[SWEEP] Background sweep stopped.");
        }
    }
}
