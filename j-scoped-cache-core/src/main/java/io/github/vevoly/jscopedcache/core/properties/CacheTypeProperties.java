package io.github.vevoly.jscopedcache.core.properties;

import lombok.Data;

import java.time.Duration;

/**
 * 映射 application.yml 中单个缓存类型的配置块。
 * <p>
 * Maps the configuration block of a single cache type from the application.yml file.
 *
 * @author vevoly
 */
@Data
public class CacheTypeProperties {

    /**
     * 该类型条目的存活时间（例如: 30s, 5m）。为空时沿用内置表，内置表中也没有时使用 {@code default-ttl}。
     * 0 表示不缓存该类型。
     * <p>
     * Time-to-live of entries of this type (e.g. 30s, 5m). When empty, the built-in table applies, then {@code default-ttl}.
     * 0 means the type is never cached.
     */
    private Duration ttl;

    /**
     * 人类可读的描述。
     * <p>
     * Human-readable description.
     */
    private String description;
}
