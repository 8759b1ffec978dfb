package io.github.vevoly.jscopedcache.core.internal;

import io.github.vevoly.jscopedcache.api.structure.CacheStatsReport;
import io.github.vevoly.jscopedcache.api.structure.StoreStats;
import io.github.vevoly.jscopedcache.api.utils.CacheKeyBuilder;
import io.github.vevoly.jscopedcache.core.config.CachePolicyResolver;
import io.github.vevoly.jscopedcache.core.store.TtlStore;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 汇总存储统计，生成管理端使用的报告。
 * <p>
 * Aggregates store statistics into the report served to administrators.
 *
 * @author vevoly
 */
public class StatsReporter {

    private final TtlStore store;
    private final CachePolicyResolver policyResolver;

    public StatsReporter(TtlStore store, CachePolicyResolver policyResolver) {
        this.store = store;
        this.policyResolver = policyResolver;
    }

    public CacheStatsReport report() {
        StoreStats stats = store.stats();
        Set<String> keys = store.keys();
        Map<String, Integer> perType = new TreeMap<>();
        for (String key : keys) {
            perType.merge(CacheKeyBuilder.typeOf(key), 1, Integer::sum);
        }
        return CacheStatsReport.builder()
                .totalKeys(keys.size())
                .hits(stats.getHitCount())
                .misses(stats.getMissCount())
                .hitRatePercent(hitRatePercent(stats.getHitCount(), stats.getMissCount()))
                .perTypeKeyCount(Collections.unmodifiableMap(perType))
                .configuredTypes(policyResolver.configuredTypeNames())
                .maxEntries(store.getMaxEntries())
                .build();
    }

    /**
     * 命中率百分比 {@code hits / (hits + misses) * 100}，不做舍入，由展示端格式化；没有任何请求时为 0。
     */
    static double hitRatePercent(long hits, long misses) {
        long total = hits + misses;
        if (total == 0) {
            return 0d;
        }
        return (double) hits / total * 100d;
    }
}
