package io.github.vevoly.jscopedcache.api.structure;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 存储层的累计统计快照。
 * <p>
 * Cumulative statistics snapshot of the store.
 *
 * @author vevoly
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public final class StoreStats {

    /**
     * 自进程启动以来的命中次数。/ Hits since process start.
     */
    private final long hitCount;

    /**
     * 自进程启动以来的未命中次数。/ Misses since process start.
     */
    private final long missCount;

    /**
     * 当前未过期的条目数。/ Number of live (non-expired) entries.
     */
    private final int size;
}
