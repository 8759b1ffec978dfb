package io.github.vevoly.jscopedcache.api;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * 缓存失效接口。
 * 写操作成功后，由调用方显式调用，将受影响作用域下的缓存全部清除。失效是粗粒度的：宁可多算一次，也不返回过期的聚合数据。
 * <p>
 * Cache invalidation interface.
 * Called explicitly by the caller after a write succeeded, to remove every cached entry in the affected scope.
 * Invalidation is coarse-grained: one extra recomputation is preferred over serving stale aggregates.
 *
 * @author vevoly
 */
public interface ScopedCacheInvalidator {

    /**
     * 清除主类型及相关类型在 (用户, 学校) 作用域下的所有缓存，无论键后面还附带了哪些查询参数。
     * <p>
     * Removes every entry of the primary type and the related types in the (user, school) scope,
     * whatever query params follow in the key.
     *
     * @param primaryType  主类型。/ The primary type.
     * @param userId       用户 ID。/ The user id.
     * @param schoolId     学校 ID。/ The school id.
     * @param relatedTypes 需要一起失效的类型，可以为空。/ Types invalidated along, may be empty.
     * @return 被清除的键数量。/ The number of removed keys.
     */
    int invalidate(String primaryType, String userId, String schoolId, List<String> relatedTypes);

    /**
     * {@link #invalidate(String, String, String, List)} 的便捷形式。
     * <p>
     * Convenience form of {@link #invalidate(String, String, String, List)}.
     */
    default int invalidateRelated(String primaryType, String userId, String schoolId, String... relatedTypes) {
        return invalidate(primaryType, userId, schoolId, relatedTypes == null ? List.of() : Arrays.asList(relatedTypes));
    }

    /**
     * 清除给定类型中，键（类型之后的部分）包含 entityId 的所有缓存。
     * 适用于受影响的范围不是单个 (用户, 学校)，而是嵌在键中任意位置的某个 ID（例如课程 ID）。
     * 需要扫描全部键，复杂度为 O(n)。
     * <p>
     * Removes every entry of the given types whose key (after the type) contains entityId.
     * For cases where the affected scope is an identifier embedded anywhere in the key (for example a course id)
     * rather than a single (user, school) pair. Scans all keys, O(n).
     *
     * @param typeNames 类型集合。/ The types.
     * @param entityId  实体 ID。/ The entity id.
     * @return 被清除的键数量。/ The number of removed keys.
     */
    int invalidateByEntityId(Collection<String> typeNames, String entityId);

    /**
     * 清除给定类型中属于某个学校（第三段）的所有缓存，不区分用户。
     * <p>
     * Removes every entry of the given types that belongs to a school (third segment), for all users.
     *
     * @param typeNames 类型集合。/ The types.
     * @param schoolId  学校 ID。/ The school id.
     * @return 被清除的键数量。/ The number of removed keys.
     */
    int invalidateSchool(Collection<String> typeNames, String schoolId);

    /**
     * 清除给定类型的全部缓存，不区分作用域，例如学期结束时。
     * <p>
     * Removes every entry of the given types regardless of scope, e.g. when an academic period closes.
     *
     * @param typeNames 类型集合。/ The types.
     * @return 被清除的键数量。/ The number of removed keys.
     */
    int flushType(Collection<String> typeNames);
}
