package io.github.vevoly.jscopedcache.api.constants;

/**
 * 框架中使用的所有公共常量的集合。
 * <p>
 * A collection of all public constants used within the framework.
 *
 * @author vevoly
 */
public interface ScopedCacheConstants {

    // ===================================================================
    // ========================= 缓存键 / Cache Keys =======================
    // ===================================================================

    /**
     * 缓存键各段之间的分隔符。类型名与参数中都不允许出现未转义的分隔符。
     * <p>
     * The delimiter between cache key segments. Neither type names nor params may contain it unescaped.
     */
    String KEY_DELIMITER = ":";

    /**
     * 分隔符的字符形式。
     * <p>
     * The delimiter as a char.
     */
    char KEY_DELIMITER_CHAR = ':';

    // ===================================================================
    // ====================== 全局默认配置值 / Global Default Values ======================
    // ===================================================================

    /**
     * 未配置策略的类型所使用的默认过期时间（秒）。(5 分钟)
     * <p>
     * The default time-to-live (in seconds) for types without a configured policy. (5 minutes)
     */
    long DEFAULT_TTL_SECONDS = 300L;

    /**
     * 默认策略的描述文字。
     * <p>
     * Description of the fallback policy.
     */
    String DEFAULT_POLICY_DESCRIPTION = "Default";

    /**
     * 存储中允许的最大条目数。
     * <p>
     * The maximum number of entries held by the store.
     */
    int DEFAULT_MAX_ENTRIES = 500;

    /**
     * 后台过期清理的默认间隔（秒）。
     * <p>
     * The default interval (in seconds) of the background expiry sweep.
     */
    long DEFAULT_SWEEP_INTERVAL_SECONDS = 60L;

    /**
     * 默认是否合并同一个 Key 的并发回源请求。
     * <p>
     * Whether concurrent misses for the same key share one computation by default.
     */
    boolean DEFAULT_SINGLE_FLIGHT = true;

    // ===================================================================
    // ========================= 日志 / Logging ===========================
    // ===================================================================

    /**
     * 所有日志的统一前缀。
     * <p>
     * The common prefix of every log line.
     */
    String LOG_PREFIX = "[JScopedCache] ";

    // ====================================================================
    // ==================== 配置属性常量 / Configuration Property Constants =
    // ====================================================================

    /**
     * 配置属性的根前缀。
     * <p>
     * The root prefix of the configuration properties.
     */
    String PROPERTIES_PREFIX = "j-scoped-cache";

    /**
     * 用于标记是否启用后台清理的注解属性名。
     * <p>
     * The name of the annotation attribute marking whether the background sweep is enabled.
     */
    String SWEEP_ATTRIBUTE_NAME = "sweep";

    /**
     * Core 模块中 ScopedCacheEnableRegistrar 的全限定类名
     * <p>
     * Core module's fully qualified class name for ScopedCacheEnableRegistrar
     */
    String REGISTRAR_CLASS_NAME = "io.github.vevoly.jscopedcache.core.config.ScopedCacheEnableRegistrar";

    /**
     * ScopedCacheMarkerConfiguration 的全限定名
     * <p>
     * ScopedCacheMarkerConfiguration's fully qualified class name
     */
    String MARKER_CONFIG_CLASS_NAME = "io.github.vevoly.jscopedcache.core.config.ScopedCacheMarkerConfiguration";
}
