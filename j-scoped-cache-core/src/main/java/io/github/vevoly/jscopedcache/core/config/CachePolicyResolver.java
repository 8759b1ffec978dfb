package io.github.vevoly.jscopedcache.core.config;

import io.github.vevoly.jscopedcache.api.config.ResolvedCacheTypePolicy;
import io.github.vevoly.jscopedcache.api.constants.DefaultCachePolicies;
import io.github.vevoly.jscopedcache.api.utils.CacheKeyBuilder;
import io.github.vevoly.jscopedcache.core.properties.CacheTypeProperties;
import io.github.vevoly.jscopedcache.core.properties.ScopedCacheRootProperties;
import io.github.vevoly.jscopedcache.core.utils.I18nLogger;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.InitializingBean;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.github.vevoly.jscopedcache.api.constants.ScopedCacheConstants.KEY_DELIMITER_CHAR;

/**
 * 缓存类型策略解析器。
 * <p>
 * 在容器启动时运行 (通过 {@link InitializingBean})，将内置策略表与 YML 中的 {@code types} 配置合并（YML 优先），
 * 构建成不可变的 {@link ResolvedCacheTypePolicy} 对象。它是框架内部获取类型 TTL 的唯一入口。
 * 不合法的配置（容量小于 1、负数或带小数秒的 TTL、不足 1 毫秒的清理间隔、包含分隔符的类型名）会在启动时直接失败。
 * <p>
 * The cache type policy resolver.
 * Runs on container startup (via {@link InitializingBean}) and merges the built-in policy table with the {@code types} block
 * from YML (YML wins) into immutable {@link ResolvedCacheTypePolicy} objects. It is the single entry point for the TTL of a type.
 * Invalid settings (capacity below 1, a negative or fractional-second TTL, a sweep interval under 1ms, a type name
 * containing the delimiter) fail startup right away.
 *
 * @author vevoly
 */
@Slf4j
public class CachePolicyResolver implements InitializingBean {

    private final ScopedCacheRootProperties rootProperties;
    private final I18nLogger i18nLog = new I18nLogger(log);

    private Map<String, ResolvedCacheTypePolicy> resolvedPolicies = Collections.emptyMap();
    private long defaultTtlSeconds;

    public CachePolicyResolver(ScopedCacheRootProperties rootProperties) {
        this.rootProperties = rootProperties;
    }

    /**
     * 在所有属性设置完成后由容器调用；脱离容器使用时由 ScopedCacheFactory 调用。
     * <p>
     * Invoked by the container once properties are set; called by ScopedCacheFactory outside a container.
     *
     * @throws IllegalStateException 如果配置不合法。/ if the configuration is invalid.
     */
    @Override
    public void afterPropertiesSet() {
        i18nLog.info("resolver.start_parse");
        if (rootProperties.getMaxEntries() < 1) {
            throw new IllegalStateException(i18nLog.format("resolver.invalid_max_entries", rootProperties.getMaxEntries()));
        }
        Duration sweepInterval = rootProperties.getSweepInterval();
        if (sweepInterval != null && sweepInterval.isNegative()) {
            throw new IllegalStateException(i18nLog.format("resolver.invalid_sweep_interval", sweepInterval));
        }
        // the sweeper schedules in whole milliseconds
        if (sweepInterval != null && !sweepInterval.isZero() && sweepInterval.toMillis() < 1) {
            throw new IllegalStateException(i18nLog.format("resolver.sweep_interval_too_short", sweepInterval));
        }
        Duration defaultTtl = rootProperties.getDefaultTtl();
        if (defaultTtl == null || defaultTtl.isNegative()) {
            throw new IllegalStateException(i18nLog.format("resolver.invalid_default_ttl", defaultTtl));
        }
        if (!isWholeSeconds(defaultTtl)) {
            throw new IllegalStateException(i18nLog.format("resolver.default_ttl_not_whole_seconds", defaultTtl));
        }
        this.defaultTtlSeconds = defaultTtl.getSeconds();

        Map<String, ResolvedCacheTypePolicy> merged = new LinkedHashMap<>(DefaultCachePolicies.all());
        Map<String, CacheTypeProperties> configured = Optional.ofNullable(rootProperties.getTypes()).orElse(Collections.emptyMap());
        for (Map.Entry<String, CacheTypeProperties> entry : configured.entrySet()) {
            String typeName = entry.getKey();
            if (StringUtils.isBlank(typeName) || StringUtils.contains(typeName, KEY_DELIMITER_CHAR)) {
                throw new IllegalStateException(i18nLog.format("resolver.invalid_type_name", typeName));
            }
            CacheTypeProperties props = Optional.ofNullable(entry.getValue()).orElseGet(CacheTypeProperties::new);
            ResolvedCacheTypePolicy builtIn = merged.get(typeName);

            // TTL: Config -> Built-in -> default-ttl
            long ttlSeconds;
            if (props.getTtl() != null) {
                if (props.getTtl().isNegative()) {
                    throw new IllegalStateException(i18nLog.format("resolver.invalid_ttl", typeName, props.getTtl()));
                }
                if (!isWholeSeconds(props.getTtl())) {
                    throw new IllegalStateException(i18nLog.format("resolver.ttl_not_whole_seconds", typeName, props.getTtl()));
                }
                ttlSeconds = props.getTtl().getSeconds();
            } else {
                ttlSeconds = builtIn != null ? builtIn.getTtlSeconds() : defaultTtlSeconds;
            }
            // Description: Config -> Built-in -> ""
            String description = Optional.ofNullable(props.getDescription())
                    .or(() -> Optional.ofNullable(builtIn).map(ResolvedCacheTypePolicy::getDescription))
                    .orElse("");

            merged.put(typeName, ResolvedCacheTypePolicy.builder()
                    .typeName(typeName)
                    .ttlSeconds(ttlSeconds)
                    .description(description)
                    .build());
        }
        this.resolvedPolicies = Collections.unmodifiableMap(merged);
        i18nLog.info("resolver.loaded", resolvedPolicies.size(), configured.size(), defaultTtlSeconds);
    }

    /**
     * 返回类型生效的策略；未知类型使用 {@code default-ttl} 的默认策略。
     * <p>
     * Returns the effective policy of a type; unknown types get the fallback policy with {@code default-ttl}.
     *
     * @param typeName 类型名称。/ The type name.
     * @return 永不为 null。/ Never null.
     */
    public ResolvedCacheTypePolicy policyOf(String typeName) {
        ResolvedCacheTypePolicy policy = typeName == null ? null : resolvedPolicies.get(typeName);
        return policy != null ? policy : ResolvedCacheTypePolicy.fallback(typeName, defaultTtlSeconds);
    }

    /**
     * 根据缓存键的第一段推断策略。
     * <p>
     * Infers the policy from the first segment of a cache key.
     */
    public ResolvedCacheTypePolicy policyOfKey(String key) {
        return policyOf(CacheKeyBuilder.typeOf(key));
    }

    /**
     * 所有已解析的策略（内置表在前，配置新增的在后）。
     * <p>
     * Every resolved policy (built-in ones first, configured additions after).
     */
    public Collection<ResolvedCacheTypePolicy> getAllResolvedPolicies() {
        return resolvedPolicies.values();
    }

    /**
     * 所有已知的类型名，按字母排序。
     * <p>
     * Every known type name, sorted alphabetically.
     */
    public List<String> configuredTypeNames() {
        List<String> names = new ArrayList<>(resolvedPolicies.keySet());
        Collections.sort(names);
        return Collections.unmodifiableList(names);
    }

    /**
     * 条目的 TTL 以整秒存储，带有小数秒的配置会被拒绝而不是截断。
     */
    private static boolean isWholeSeconds(Duration ttl) {
        return ttl.getNano() == 0;
    }

    public long getDefaultTtlSeconds() {
        return defaultTtlSeconds;
    }

    public ScopedCacheRootProperties getRootProperties() {
        return rootProperties;
    }
}
