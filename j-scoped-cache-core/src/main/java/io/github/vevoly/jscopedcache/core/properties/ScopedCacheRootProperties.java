package io.github.vevoly.jscopedcache.core.properties;

import io.github.vevoly.jscopedcache.api.constants.ScopedCacheConstants;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 映射 application.yml 文件中 {@code j-scoped-cache} 根配置块的属性。
 * <p>
 * Maps the properties of the {@code j-scoped-cache} root configuration block from the application.yml file.
 *
 * @author vevoly
 */
@Data
@ConfigurationProperties(prefix = ScopedCacheConstants.PROPERTIES_PREFIX)
public class ScopedCacheRootProperties {

    /**
     * 自动配置总开关。
     * <p>
     * Master switch of the auto-configuration.
     */
    private boolean enabled = true;

    /**
     * 未配置策略的类型所使用的过期时间。
     * <p>
     * Time-to-live used by types without a policy.
     */
    private Duration defaultTtl = Duration.ofSeconds(ScopedCacheConstants.DEFAULT_TTL_SECONDS);

    /**
     * 存储的最大条目数，必须大于 0。
     * <p>
     * Maximum number of entries held by the store, must be greater than 0.
     */
    private int maxEntries = ScopedCacheConstants.DEFAULT_MAX_ENTRIES;

    /**
     * 后台过期清理的间隔，0 表示关闭。
     * <p>
     * Interval of the background expiry sweep, 0 turns it off.
     */
    private Duration sweepInterval = Duration.ofSeconds(ScopedCacheConstants.DEFAULT_SWEEP_INTERVAL_SECONDS);

    /**
     * 是否合并同一个 Key 的并发回源请求。
     * <p>
     * Whether concurrent misses for the same key share one computation.
     */
    private boolean singleFlight = ScopedCacheConstants.DEFAULT_SINGLE_FLIGHT;

    /**
     * 类型策略的覆盖与扩展。Map 的 Key 是类型名，与内置表同名时覆盖内置值。
     * <p>
     * Overrides and extensions of the type policies. The map key is the type name; a name found in the built-in table overrides it.
     */
    private Map<String, CacheTypeProperties> types = new LinkedHashMap<>();
}
