package io.github.vevoly.jscopedcache.core.internal;

import io.github.vevoly.jscopedcache.api.ScopedCacheHandle;
import io.github.vevoly.jscopedcache.api.config.ResolvedCacheTypePolicy;
import io.github.vevoly.jscopedcache.api.structure.CacheStatsReport;
import io.github.vevoly.jscopedcache.api.utils.CacheKeyBuilder;
import io.github.vevoly.jscopedcache.core.config.CachePolicyResolver;
import io.github.vevoly.jscopedcache.core.store.ExpiredEntrySweeper;
import io.github.vevoly.jscopedcache.core.store.TtlStore;
import io.github.vevoly.jscopedcache.core.utils.I18nLogger;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * {@link ScopedCacheHandle} 的默认实现。
 * <p>
 * 本身不包含缓存逻辑，只把调用分派给读穿流程、失效路由与统计汇总，并持有后台清理任务的生命周期。
 * <p>
 * The default {@link ScopedCacheHandle}.
 * It holds no caching logic of its own: calls are dispatched to the read-through flow, the invalidation router and the
 * stats reporter, and it owns the lifecycle of the background sweep.
 *
 * @author vevoly
 */
@Slf4j
public class ScopedCacheImpl implements ScopedCacheHandle {

    private final TtlStore store;
    private final CachePolicyResolver policyResolver;
    private final ReadThroughCache readThrough;
    private final InvalidationRouter router;
    private final StatsReporter statsReporter;
    private final ExpiredEntrySweeper sweeper;

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final I18nLogger i18nLog = new I18nLogger(log);

    public ScopedCacheImpl(TtlStore store,
                           CachePolicyResolver policyResolver,
                           ReadThroughCache readThrough,
                           InvalidationRouter router,
                           StatsReporter statsReporter,
                           ExpiredEntrySweeper sweeper) {
        this.store = store;
        this.policyResolver = policyResolver;
        this.readThrough = readThrough;
        this.router = router;
        this.statsReporter = statsReporter;
        this.sweeper = sweeper;
    }

    // ======================== ScopedCache ========================

    @Override
    public <T> T fetch(String key, String typeName, Supplier<T> loader) {
        return readThrough.getOrCompute(key, typeName, loader);
    }

    @Override
    public <T> CompletableFuture<T> fetchAsync(String key, String typeName, Supplier<? extends CompletionStage<T>> loader) {
        return readThrough.getOrComputeAsync(key, typeName, loader);
    }

    @Override
    public String buildKey(String typeName, String... params) {
        return CacheKeyBuilder.buildKey(typeName, params);
    }

    // ======================== ScopedCacheInvalidator ========================

    @Override
    public int invalidate(String primaryType, String userId, String schoolId, List<String> relatedTypes) {
        return router.invalidate(primaryType, userId, schoolId, relatedTypes);
    }

    @Override
    public int invalidateByEntityId(Collection<String> typeNames, String entityId) {
        return router.invalidateByEntityId(typeNames, entityId);
    }

    @Override
    public int invalidateSchool(Collection<String> typeNames, String schoolId) {
        return router.invalidateSchool(typeNames, schoolId);
    }

    @Override
    public int flushType(Collection<String> typeNames) {
        return router.flushType(typeNames);
    }

    // ======================== ScopedCacheAdmin ========================

    @Override
    public void flushAll() {
        store.flushAll();
        i18nLog.info("cache.flush_all");
    }

    @Override
    public CacheStatsReport report() {
        return statsReporter.report();
    }

    @Override
    public Set<String> keys() {
        return store.keys();
    }

    @Override
    public ResolvedCacheTypePolicy policyOf(String typeName) {
        return policyResolver.policyOf(typeName);
    }

    // ======================== Lifecycle ========================

    /**
     * 停止后台清理任务。重复调用无副作用；关闭后缓存仍然可以使用，只是不再有周期清理。
     * <p>
     * Stops the background sweep. Repeated calls are harmless; the cache stays usable afterwards, only without periodic sweeps.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            sweeper.close();
            i18nLog.info("cache.closed");
        }
    }

    public boolean isSweeperRunning() {
        return sweeper.isRunning();
    }
}
