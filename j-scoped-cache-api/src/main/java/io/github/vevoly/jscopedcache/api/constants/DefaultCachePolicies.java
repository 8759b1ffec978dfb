package io.github.vevoly.jscopedcache.api.constants;

import io.github.vevoly.jscopedcache.api.config.ResolvedCacheTypePolicy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 内置的类型策略表。
 * <p>
 * YML 中 {@code j-scoped-cache.types} 的同名配置会覆盖这里的值。
 * <p>
 * The built-in type policy table.
 * An entry with the same name under {@code j-scoped-cache.types} in YML overrides the value defined here.
 *
 * @author vevoly
 */
public final class DefaultCachePolicies {

    private DefaultCachePolicies() {}

    private static final Map<String, ResolvedCacheTypePolicy> POLICIES;

    static {
        Map<String, ResolvedCacheTypePolicy> table = new LinkedHashMap<>();
        put(table, CacheTypes.DASHBOARD, 180, "Dashboard - 3 min");
        put(table, CacheTypes.MESSAGES, 120, "Message list - 2 min");
        put(table, CacheTypes.ANNOUNCEMENTS, 300, "Announcements - 5 min");
        put(table, CacheTypes.NOTIFICATIONS, 60, "Notifications - 1 min");
        put(table, CacheTypes.GRADES, 240, "Grades - 4 min");
        put(table, CacheTypes.COURSES, 600, "Course list - 10 min");
        put(table, CacheTypes.USERS, 900, "User list - 15 min");

        put(table, CacheTypes.DASHBOARD_ROLE, 300, "Summary per role - 5 min");
        put(table, CacheTypes.DASHBOARD_FULL, 180, "Full dashboard - 3 min");
        put(table, CacheTypes.TODAY_EVENTS, 600, "Today's events - 10 min");
        put(table, CacheTypes.ADVANCED_METRICS, 900, "Advanced metrics - 15 min");

        put(table, CacheTypes.PERIOD_AVERAGE, 300, "Period average - 5 min");
        put(table, CacheTypes.SUBJECT_AVERAGE, 600, "Subject average - 10 min");
        put(table, CacheTypes.GROUP_STATISTICS, 180, "Group statistics - 3 min");

        put(table, CacheTypes.RECIPIENTS, 120, "Possible recipients - 2 min");
        put(table, CacheTypes.RECIPIENT_COURSES, 600, "Courses for messages - 10 min");
        put(table, CacheTypes.GUARDIANS, 300, "Student guardians - 5 min");
        put(table, CacheTypes.MESSAGE_LIST, 120, "Filtered message list - 2 min");

        put(table, CacheTypes.ATTENDANCE, 240, "Attendance - 4 min");
        put(table, CacheTypes.SCHOOL, 1800, "School info - 30 min");
        put(table, CacheTypes.ACHIEVEMENTS, 900, "Achievements - 15 min");
        POLICIES = Collections.unmodifiableMap(table);
    }

    /**
     * 返回内置策略表（按声明顺序，不可修改）。
     * <p>
     * Returns the built-in policy table (in declaration order, unmodifiable).
     *
     * @return 类型名到策略的映射。/ Map from type name to policy.
     */
    public static Map<String, ResolvedCacheTypePolicy> all() {
        return POLICIES;
    }

    private static void put(Map<String, ResolvedCacheTypePolicy> table, String type, long ttlSeconds, String description) {
        table.put(type, ResolvedCacheTypePolicy.builder()
                .typeName(type)
                .ttlSeconds(ttlSeconds)
                .description(description)
                .build());
    }
}
