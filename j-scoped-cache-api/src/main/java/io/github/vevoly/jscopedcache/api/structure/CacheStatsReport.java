package io.github.vevoly.jscopedcache.api.structure;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * 提供给管理端点的缓存状态报告。
 * <p>
 * Cache status report served to an administrative endpoint.
 *
 * @author vevoly
 */
@Getter
@Builder
@ToString
@AllArgsConstructor
public final class CacheStatsReport {

    /**
     * 当前存活的键数量。/ Number of live keys.
     */
    private final int totalKeys;

    /**
     * 累计命中次数。/ Cumulative hits.
     */
    private final long hits;

    /**
     * 累计未命中次数。/ Cumulative misses.
     */
    private final long misses;

    /**
     * 命中率百分比，hits 与 misses 都为 0 时为 0。
     * <p>
     * Hit rate in percent; 0 when both hits and misses are 0.
     */
    private final double hitRatePercent;

    /**
     * 每个类型当前存活的键数量（按类型名排序）。
     * <p>
     * Live key count per type (sorted by type name).
     */
    private final Map<String, Integer> perTypeKeyCount;

    /**
     * 所有已配置的类型名称（排序后）。
     * <p>
     * Names of every configured type (sorted).
     */
    private final List<String> configuredTypes;

    /**
     * 存储的容量上限。/ Capacity of the store.
     */
    private final int maxEntries;
}
