package io.github.vevoly.jscopedcache.core.hooks;

import io.github.vevoly.jscopedcache.api.ScopedCacheInvalidator;
import io.github.vevoly.jscopedcache.api.constants.CacheTypes;

import java.util.List;
import java.util.Set;

/**
 * 仪表盘相关写操作（消息、公告、日程）成功后的失效钩子。
 * <p>
 * Invalidation hook run after a dashboard-affecting write (message, announcement, calendar) succeeded.
 *
 * @author vevoly
 */
public class DashboardInvalidationHook extends AbstractInvalidationHook {

    /**
     * 这些角色的仪表盘还汇总了消息与通知。
     */
    public static final Set<String> ADMIN_ROLES = Set.of("ADMIN", "RECTOR", "COORDINADOR");

    public static final String MANUAL_TYPE_DASHBOARD = CacheTypes.DASHBOARD;
    public static final String MANUAL_TYPE_ALL = "all";

    public DashboardInvalidationHook(ScopedCacheInvalidator invalidator) {
        super(invalidator);
    }

    /**
     * 写操作成功后清除该用户的仪表盘；管理类角色同时清除消息与通知。
     *
     * @return 清除的键数量
     */
    public int onWriteSucceeded(String userId, String schoolId, String role) {
        return guarded("dashboard-write", () -> {
            if (role != null && ADMIN_ROLES.contains(role)) {
                return invalidator.invalidate(CacheTypes.DASHBOARD, userId, schoolId,
                        List.of(CacheTypes.MESSAGES, CacheTypes.NOTIFICATIONS));
            }
            return invalidator.invalidate(CacheTypes.DASHBOARD, userId, schoolId, List.of());
        });
    }

    /**
     * 清除该用户整个仪表盘分组。
     */
    public int invalidateUserDashboard(String userId, String schoolId) {
        return guarded("dashboard-user", () -> invalidator.invalidate(CacheTypes.DASHBOARD, userId, schoolId,
                CacheTypes.DASHBOARD_GROUP));
    }

    /**
     * 管理员手动失效。
     * <ul>
     *     <li>{@code dashboard}: 清除 userId 在该学校的仪表盘。</li>
     *     <li>{@code all}: 清除请求者在该学校的仪表盘、消息、公告与通知。</li>
     * </ul>
     * 参数校验失败时抛出 {@link IllegalArgumentException}，供调用方返回 400；缓存本身的异常不会抛出。
     *
     * @param type        {@code dashboard} 或 {@code all}
     * @param userId      {@code dashboard} 时的目标用户
     * @param schoolId    学校 ID
     * @param requesterId 发起请求的管理员
     * @return 清除的键数量
     * @throws IllegalArgumentException 类型不受支持或缺少必需参数
     */
    public int manualInvalidate(String type, String userId, String schoolId, String requesterId) {
        if (MANUAL_TYPE_DASHBOARD.equals(type) && userId != null && schoolId != null) {
            i18nLog.info("hook.manual", type, requesterId, schoolId);
            return guarded("dashboard-manual", () -> invalidator.invalidate(CacheTypes.DASHBOARD, userId, schoolId, List.of()));
        }
        if (MANUAL_TYPE_ALL.equals(type) && schoolId != null && requesterId != null) {
            i18nLog.info("hook.manual", type, requesterId, schoolId);
            return guarded("dashboard-manual-all", () -> invalidator.invalidate(CacheTypes.DASHBOARD, requesterId, schoolId,
                    List.of(CacheTypes.MESSAGES, CacheTypes.ANNOUNCEMENTS, CacheTypes.NOTIFICATIONS)));
        }
        throw new IllegalArgumentException("Invalid parameters. Use type \"dashboard\" with userId and schoolId, "
                + "or type \"all\" with schoolId");
    }
}
