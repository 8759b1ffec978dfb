package io.github.vevoly.jscopedcache.core.internal;

import io.github.vevoly.jscopedcache.api.utils.CacheKeyBuilder;
import io.github.vevoly.jscopedcache.core.store.TtlStore;
import io.github.vevoly.jscopedcache.core.utils.I18nLogger;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static io.github.vevoly.jscopedcache.api.constants.ScopedCacheConstants.KEY_DELIMITER;

/**
 * 将失效请求翻译成存储上的键删除。
 * <p>
 * 作用域前缀总是带着分隔符边界匹配：{@code dashboard:u1:s1} 清除它自己以及 {@code dashboard:u1:s1:...}，
 * 但不会波及 {@code dashboard:u1:s10}。每一次删除都在存储锁内完成扫描与移除。
 * <p>
 * Translates invalidation requests into key removals on the store.
 * Scope prefixes always match on a delimiter boundary: {@code dashboard:u1:s1} removes itself and {@code dashboard:u1:s1:...}
 * but never touches {@code dashboard:u1:s10}. Every removal scans and deletes within one hold of the store lock.
 *
 * @author vevoly
 */
@Slf4j
public class InvalidationRouter {

    private final TtlStore store;
    private final I18nLogger i18nLog = new I18nLogger(log);

    public InvalidationRouter(TtlStore store) {
        this.store = store;
    }

    /**
     * 清除主类型与相关类型在 (用户, 学校) 作用域下的所有键。
     *
     * @return 被清除的键数量
     */
    public int invalidate(String primaryType, String userId, String schoolId, List<String> relatedTypes) {
        Set<String> types = new LinkedHashSet<>();
        types.add(primaryType);
        if (CollectionUtils.isNotEmpty(relatedTypes)) {
            types.addAll(relatedTypes);
        }
        int removed = 0;
        for (String type : types) {
            String scope = CacheKeyBuilder.scopeKey(type, userId, schoolId);
            String nested = scope + KEY_DELIMITER;
            removed += store.deleteMatching(key -> key.equals(scope) || key.startsWith(nested));
        }
        i18nLog.info("invalidation.scope", removed, types, userId, schoolId);
        return removed;
    }

    /**
     * 清除给定类型中、类型之后的部分包含 entityId 的所有键。entityId 为空时什么也不做，否则会匹配全部键。
     *
     * @return 被清除的键数量
     */
    public int invalidateByEntityId(Collection<String> typeNames, String entityId) {
        if (StringUtils.isEmpty(entityId)) {
            i18nLog.warn("invalidation.entity_blank", typeNames);
            return 0;
        }
        if (CollectionUtils.isEmpty(typeNames)) {
            return 0;
        }
        Set<String> types = new HashSet<>(typeNames);
        int removed = store.deleteMatching(key -> types.contains(CacheKeyBuilder.typeOf(key))
                && StringUtils.substringAfter(key, KEY_DELIMITER).contains(entityId));
        i18nLog.info("invalidation.entity", removed, typeNames, entityId);
        return removed;
    }

    /**
     * 清除给定类型中第三段（学校）等于 schoolId 的所有键，不区分用户。
     *
     * @return 被清除的键数量
     */
    public int invalidateSchool(Collection<String> typeNames, String schoolId) {
        if (StringUtils.isEmpty(schoolId) || CollectionUtils.isEmpty(typeNames)) {
            return 0;
        }
        Set<String> types = new HashSet<>(typeNames);
        int removed = store.deleteMatching(key -> {
            String[] segments = CacheKeyBuilder.segments(key);
            return segments.length >= 3 && types.contains(segments[0]) && schoolId.equals(segments[2]);
        });
        i18nLog.info("invalidation.school", removed, typeNames, schoolId);
        return removed;
    }

    /**
     * 清除给定类型的全部键。
     *
     * @return 被清除的键数量
     */
    public int flushType(Collection<String> typeNames) {
        if (CollectionUtils.isEmpty(typeNames)) {
            return 0;
        }
        Set<String> types = new HashSet<>(typeNames);
        int removed = store.deleteMatching(key -> types.contains(CacheKeyBuilder.typeOf(key)));
        i18nLog.info("invalidation.flush_type", removed, typeNames);
        return removed;
    }
}
