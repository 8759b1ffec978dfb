package io.github.vevoly.jscopedcache.core.store;

import io.github.vevoly.jscopedcache.api.structure.StoreStats;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

import static io.github.vevoly.jscopedcache.api.constants.ScopedCacheConstants.LOG_PREFIX;

/**
 * 有容量上限、按时间过期的键值存储。
 * <p>
 * 所有写操作（写入、删除、前缀删除、清空、驱逐、清理）以及键快照都在同一把锁下执行，
 * 因此"检查键是否存在"与"写入键"之间不会被其他线程插入。
 * 条目按插入顺序排列；达到容量时先清除已过期的条目，仍然满时驱逐最早插入的条目（不感知访问顺序）。
 * <p>
 * Capacity-bounded, time-expiring key-value store.
 * Every mutator (set, delete, prefix delete, flush, eviction, sweep) and the key snapshot run under one lock,
 * so nothing interleaves between "does the key exist" and "write the key".
 * Entries are kept in insertion order; at capacity, expired entries are purged first and, if the store is still full,
 * the oldest inserted entry is evicted (the policy is not access-order aware).
 *
 * @author vevoly
 */
@Slf4j
public class TtlStore {

    private final Clock clock;
    private final int maxEntries;

    private final ReentrantLock lock = new ReentrantLock();
    // guarded by lock; insertion order, a replaced key moves to the end
    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>();

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();

    public TtlStore(Clock clock, int maxEntries) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be at least 1, got " + maxEntries);
        }
        this.clock = clock;
        this.maxEntries = maxEntries;
    }

    /**
     * 读取未过期的值并计入命中；不存在或已过期时计入未命中，过期条目会被立即丢弃。
     * <p>
     * Reads a live value and counts a hit; an absent or expired key counts a miss, and an expired entry is discarded.
     */
    public Optional<Object> get(String key) {
        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry != null && entry.isExpired(clock.millis())) {
                entries.remove(key);
                entry = null;
            }
            if (entry == null) {
                misses.increment();
                return Optional.empty();
            }
            hits.increment();
            return Optional.of(entry.getValue());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 写入或替换一个条目。
     * ttlSeconds 不大于 0 表示不缓存：不写入，并删除该键已有的条目。null 值不会被写入。
     * <p>
     * Inserts or replaces an entry.
     * A ttlSeconds of 0 or less means never cache: nothing is written and any existing entry under the key is removed.
     * null values are not stored.
     */
    public void set(String key, Object value, long ttlSeconds) {
        if (key == null) {
            throw new IllegalArgumentException("key must not be null");
        }
        lock.lock();
        try {
            CacheEntry previous = entries.remove(key);
            if (value == null || ttlSeconds <= 0) {
                return;
            }
            long now = clock.millis();
            if (previous == null && entries.size() >= maxEntries) {
                makeRoom(now);
            }
            entries.put(key, new CacheEntry(key, value, now, ttlSeconds));
        } finally {
            lock.unlock();
        }
    }

    /**
     * 删除一个键，不存在时什么也不做。
     *
     * @return 删除的是否是一个未过期的条目
     */
    public boolean delete(String key) {
        lock.lock();
        try {
            CacheEntry removed = entries.remove(key);
            return removed != null && !removed.isExpired(clock.millis());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 删除所有以 prefix 开头的键。
     * <p>
     * Removes every key starting with prefix.
     *
     * @return 被删除的未过期条目数量。/ The number of live entries removed.
     */
    public int deleteByPrefix(String prefix) {
        if (prefix == null) {
            return 0;
        }
        return deleteMatching(key -> key.startsWith(prefix));
    }

    /**
     * 在一次加锁内扫描并删除所有满足条件的键。
     * <p>
     * Scans and removes every key matching the predicate within a single lock hold.
     *
     * @return 被删除的未过期条目数量。/ The number of live entries removed.
     */
    public int deleteMatching(Predicate<String> keyPredicate) {
        lock.lock();
        try {
            long now = clock.millis();
            int removed = 0;
            Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, CacheEntry> e = it.next();
                if (keyPredicate.test(e.getKey())) {
                    if (!e.getValue().isExpired(now)) {
                        removed++;
                    }
                    it.remove();
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 未过期键的快照，按插入顺序排列；快照过程中顺带丢弃已过期的条目。
     * <p>
     * Snapshot of the live keys in insertion order; expired entries met on the way are discarded.
     */
    public Set<String> keys() {
        lock.lock();
        try {
            long now = clock.millis();
            Set<String> live = new LinkedHashSet<>();
            Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, CacheEntry> e = it.next();
                if (e.getValue().isExpired(now)) {
                    it.remove();
                } else {
                    live.add(e.getKey());
                }
            }
            return Collections.unmodifiableSet(live);
        } finally {
            lock.unlock();
        }
    }

    public void flushAll() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 物理删除所有过期条目，由后台清理任务周期调用。
     *
     * @return 删除的条目数量
     */
    public int sweepExpired() {
        lock.lock();
        try {
            return purgeExpired(clock.millis());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 累计统计。size 只计算未过期的条目。
     * <p>
     * Cumulative statistics. size counts live entries only.
     */
    public StoreStats stats() {
        int live;
        lock.lock();
        try {
            long now = clock.millis();
            live = (int) entries.values().stream().filter(e -> !e.isExpired(now)).count();
        } finally {
            lock.unlock();
        }
        return new StoreStats(hits.sum(), misses.sum(), live);
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    // caller holds the lock
    private void makeRoom(long now) {
        int purged = purgeExpired(now);
        if (entries.size() < maxEntries) {
            log.debug(LOG_PREFIX + "[CAPACITY] Purged {} expired entries to make room.", purged);
            return;
        }
        Iterator<String> eldest = entries.keySet().iterator();
        String evicted = eldest.next();
        eldest.remove();
        log.debug(LOG_PREFIX + "[EVICT] Capacity {} reached, evicted oldest key: {}", maxEntries, evicted);
    }

    // caller holds the lock
    private int purgeExpired(long now) {
        int removed = 0;
        Iterator<CacheEntry> it = entries.values().iterator();
        while (it.hasNext()) {
            if (it.next().isExpired(now)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }
}
