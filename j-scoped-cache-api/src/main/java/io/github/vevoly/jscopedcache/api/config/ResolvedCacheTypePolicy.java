package io.github.vevoly.jscopedcache.api.config;

import io.github.vevoly.jscopedcache.api.constants.ScopedCacheConstants;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 归一化后的缓存类型策略。
 * <p>
 * 此对象是内置默认表、YML 中的 {@code types} 配置以及框架默认值合并后的最终、不可变的结果。
 * 读穿缓存只依赖这个对象来决定一个条目的存活时间。
 * <p>
 * The normalized policy of one cache type.
 * This object is the final, immutable result of merging the built-in table, the {@code types} block in YML and the framework defaults.
 * The read-through cache relies solely on it to decide how long an entry lives.
 *
 * @author vevoly
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public final class ResolvedCacheTypePolicy {

    /**
     * 类型名称，也就是缓存键的第一段。
     * <p>
     * The type name, which is also the first segment of the cache key.
     */
    private final String typeName;

    /**
     * 该类型条目的存活时间（秒）。0 表示不缓存。
     * <p>
     * Time-to-live (in seconds) of entries of this type. 0 means never cache.
     */
    @Builder.Default
    private final long ttlSeconds = ScopedCacheConstants.DEFAULT_TTL_SECONDS;

    /**
     * 人类可读的描述，不参与任何逻辑。
     * <p>
     * Human-readable description, not used by any logic.
     */
    @Builder.Default
    private final String description = "";

    /**
     * 构建一个未知类型所使用的默认策略。
     * <p>
     * Builds the fallback policy used for unknown types.
     *
     * @param typeName   类型名称。/ The type name.
     * @param ttlSeconds 默认存活时间（秒）。/ The default time-to-live in seconds.
     * @return 默认策略。/ The fallback policy.
     */
    public static ResolvedCacheTypePolicy fallback(String typeName, long ttlSeconds) {
        return ResolvedCacheTypePolicy.builder()
                .typeName(typeName)
                .ttlSeconds(ttlSeconds)
                .description(ScopedCacheConstants.DEFAULT_POLICY_DESCRIPTION)
                .build();
    }

    /**
     * 该类型的条目是否会被写入缓存。
     * <p>
     * Whether entries of this type are stored at all.
     *
     * @return {@code true} 如果 TTL 大于 0 / {@code true} if the TTL is greater than 0.
     */
    public boolean isCacheable() {
        return ttlSeconds > 0;
    }
}
