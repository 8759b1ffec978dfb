package io.github.vevoly.jscopedcache.core;

import io.github.vevoly.jscopedcache.api.ScopedCacheHandle;
import io.github.vevoly.jscopedcache.core.config.CachePolicyResolver;
import io.github.vevoly.jscopedcache.core.internal.InvalidationRouter;
import io.github.vevoly.jscopedcache.core.internal.ReadThroughCache;
import io.github.vevoly.jscopedcache.core.internal.ScopedCacheImpl;
import io.github.vevoly.jscopedcache.core.internal.StatsReporter;
import io.github.vevoly.jscopedcache.core.properties.ScopedCacheRootProperties;
import io.github.vevoly.jscopedcache.core.store.ExpiredEntrySweeper;
import io.github.vevoly.jscopedcache.core.store.TtlStore;
import io.github.vevoly.jscopedcache.core.utils.I18nLogger;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;

/**
 * 创建缓存实例的入口。
 * <p>
 * 解析策略、创建存储、组装读穿/失效/统计组件，并按配置启动后台清理任务。
 * 每次调用都返回一个独立的实例，调用方负责在不再使用时 {@link ScopedCacheHandle#close() 关闭} 它。
 * <pre>
 * try (ScopedCacheHandle cache = ScopedCacheFactory.open(properties, Clock.systemUTC())) {
 *     cache.fetch(cache.buildKey("dashboard", userId, schoolId), "dashboard", () -&gt; loadDashboard(userId));
 * }
 * </pre>
 * <p>
 * Entry point creating cache instances.
 * Resolves the policies, creates the store, wires the read-through, invalidation and stats parts and starts the
 * background sweep when configured. Every call returns an independent instance that the caller
 * {@link ScopedCacheHandle#close() closes} once done.
 *
 * @author vevoly
 */
@Slf4j
public final class ScopedCacheFactory {

    private static final I18nLogger I18N_LOG = new I18nLogger(log);

    private ScopedCacheFactory() {}

    /**
     * 使用系统 UTC 时钟创建实例。
     */
    public static ScopedCacheHandle open(ScopedCacheRootProperties properties) {
        return open(properties, Clock.systemUTC());
    }

    /**
     * 解析配置并创建实例，后台清理按 {@code sweep-interval} 启动。
     *
     * @throws IllegalStateException 如果配置不合法
     */
    public static ScopedCacheHandle open(ScopedCacheRootProperties properties, Clock clock) {
        CachePolicyResolver resolver = new CachePolicyResolver(properties);
        resolver.afterPropertiesSet();
        return open(resolver, clock, true);
    }

    /**
     * 使用已经初始化的解析器创建实例。
     *
     * @param resolver 已完成 {@code afterPropertiesSet} 的解析器
     * @param clock    存储使用的时钟
     * @param sweep    是否启动后台清理；为 true 时仍然受 {@code sweep-interval} 约束
     */
    public static ScopedCacheHandle open(CachePolicyResolver resolver, Clock clock, boolean sweep) {
        ScopedCacheRootProperties properties = resolver.getRootProperties();
        TtlStore store = new TtlStore(clock, properties.getMaxEntries());
        Duration sweepInterval = sweep ? properties.getSweepInterval() : Duration.ZERO;
        ExpiredEntrySweeper sweeper = new ExpiredEntrySweeper(store, sweepInterval);

        ScopedCacheImpl cache = new ScopedCacheImpl(
                store,
                resolver,
                new ReadThroughCache(store, resolver, properties.isSingleFlight()),
                new InvalidationRouter(store),
                new StatsReporter(store, resolver),
                sweeper);
        sweeper.start();
        I18N_LOG.info("cache.opened", properties.getMaxEntries(), properties.isSingleFlight(), sweepInterval);
        return cache;
    }
}
