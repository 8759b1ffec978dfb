package io.github.vevoly.jscopedcache.core.internal;

import io.github.vevoly.jscopedcache.api.ScopedCacheHandle;
import io.github.vevoly.jscopedcache.api.config.ResolvedCacheTypePolicy;
import io.github.vevoly.jscopedcache.api.constants.ScopedCacheConstants;
import io.github.vevoly.jscopedcache.api.structure.CacheStatsReport;
import io.github.vevoly.jscopedcache.api.utils.CacheKeyBuilder;
import io.github.vevoly.jscopedcache.core.utils.I18nLogger;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * 降级实现类（当未启用框架时使用）。
 * 所有查询直接调用加载器，失效与管理操作都是空操作。
 * @author vevoly
 */
@Slf4j
public class NoOpScopedCache implements ScopedCacheHandle {

    public NoOpScopedCache() {
        new I18nLogger(log).warn("noop.active");
    }

    @Override
    public <T> T fetch(String key, String typeName, Supplier<T> loader) {
        return loader != null ? loader.get() : null;
    }

    @Override
    public <T> CompletableFuture<T> fetchAsync(String key, String typeName, Supplier<? extends CompletionStage<T>> loader) {
        if (loader == null) {
            return CompletableFuture.completedFuture(null);
        }
        try {
            return loader.get().toCompletableFuture();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public String buildKey(String typeName, String... params) {
        return CacheKeyBuilder.buildKey(typeName, params);
    }

    @Override
    public int invalidate(String primaryType, String userId, String schoolId, List<String> relatedTypes) {
        return 0;
    }

    @Override
    public int invalidateByEntityId(Collection<String> typeNames, String entityId) {
        return 0;
    }

    @Override
    public int invalidateSchool(Collection<String> typeNames, String schoolId) {
        return 0;
    }

    @Override
    public int flushType(Collection<String> typeNames) {
        return 0;
    }

    @Override
    public void flushAll() {
    }

    @Override
    public CacheStatsReport report() {
        return CacheStatsReport.builder()
                .perTypeKeyCount(Collections.emptyMap())
                .configuredTypes(Collections.emptyList())
                .build();
    }

    @Override
    public Set<String> keys() {
        return Collections.emptySet();
    }

    @Override
    public ResolvedCacheTypePolicy policyOf(String typeName) {
        return ResolvedCacheTypePolicy.fallback(typeName, ScopedCacheConstants.DEFAULT_TTL_SECONDS);
    }

    @Override
    public void close() {
    }
}
