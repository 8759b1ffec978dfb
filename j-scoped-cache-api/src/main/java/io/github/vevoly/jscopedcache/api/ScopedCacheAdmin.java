package io.github.vevoly.jscopedcache.api;

import io.github.vevoly.jscopedcache.api.config.ResolvedCacheTypePolicy;
import io.github.vevoly.jscopedcache.api.structure.CacheStatsReport;

import java.util.Set;

/**
 * JScopedCache 的管理接口，提供统计、清空等管理类操作。
 * <p>
 * Management interface for JScopedCache, providing administrative operations like stats and flushing.
 *
 * @author vevoly
 */
public interface ScopedCacheAdmin {

    /**
     * 清空全部缓存。
     * <p>
     * Removes every entry.
     */
    void flushAll();

    /**
     * 获取缓存统计报告：键数量、命中/未命中、命中率、按类型的键数量。
     * <p>
     * Returns the stats report: key count, hits/misses, hit rate, key count per type.
     */
    CacheStatsReport report();

    /**
     * 当前存活的键快照。
     * <p>
     * Snapshot of the live keys.
     */
    Set<String> keys();

    /**
     * 返回某个类型生效的策略，未配置时返回默认策略。
     * <p>
     * Returns the effective policy of a type, or the fallback policy when it is not configured.
     *
     * @param typeName 类型名称。/ The type name.
     */
    ResolvedCacheTypePolicy policyOf(String typeName);
}
