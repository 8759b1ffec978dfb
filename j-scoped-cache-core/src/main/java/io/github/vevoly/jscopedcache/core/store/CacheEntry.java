package io.github.vevoly.jscopedcache.core.store;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 存储中的一个条目。条目从不原地修改，刷新即替换。
 * <p>
 * One entry of the store. Entries are never mutated in place; a refresh replaces them.
 *
 * @author vevoly
 */
@Getter
@ToString
@AllArgsConstructor
public final class CacheEntry {

    private final String key;

    @ToString.Exclude
    private final Object value;

    /**
     * 写入时刻（毫秒，来自注入的 Clock）。
     */
    private final long storedAtMillis;

    private final long ttlSeconds;

    /**
     * 条目在 {@code now - storedAt > ttl} 时过期，恰好处于边界时仍然有效。
     * <p>
     * The entry expires once {@code now - storedAt > ttl}; exactly at the boundary it is still valid.
     */
    public boolean isExpired(long nowMillis) {
        return nowMillis - storedAtMillis > ttlMillis();
    }

    /**
     * TTL 换算为毫秒，溢出时取 {@link Long#MAX_VALUE}，即永不过期。
     */
    private long ttlMillis() {
        try {
            return Math.multiplyExact(ttlSeconds, 1000L);
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
