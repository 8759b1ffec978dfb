package io.github.vevoly.jscopedcache.core.hooks;

import io.github.vevoly.jscopedcache.api.ScopedCacheInvalidator;
import io.github.vevoly.jscopedcache.api.constants.CacheTypes;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 学业数据（成绩、成就、课程、学期）变化后的失效钩子。
 * <p>
 * 平均分与分组统计的键中嵌有学生或课程 ID，但不一定按 (用户, 学校) 排列，
 * 所以课程相关的失效使用实体 ID 扫描，学校范围的仪表盘失效使用 {@link ScopedCacheInvalidator#invalidateSchool}。
 * <p>
 * Invalidation hook for academic changes (grades, achievements, courses, periods).
 * Average and group-statistics keys embed student or course ids without always following the (user, school) order,
 * so course-wide invalidation scans by entity id and school-wide dashboard invalidation uses
 * {@link ScopedCacheInvalidator#invalidateSchool}.
 *
 * @author vevoly
 */
@Slf4j
public class AcademicInvalidationHook extends AbstractInvalidationHook {

    /**
     * 学生数据变化时一起失效的类型。
     */
    public static final List<String> STUDENT_TYPES;

    /**
     * 课程变化时按课程 ID 扫描的类型。
     */
    public static final List<String> COURSE_TYPES;

    static {
        List<String> student = new ArrayList<>(CacheTypes.ACADEMIC_GROUP);
        student.add(CacheTypes.DASHBOARD);
        student.add(CacheTypes.DASHBOARD_ROLE);
        student.add(CacheTypes.DASHBOARD_FULL);
        STUDENT_TYPES = Collections.unmodifiableList(student);

        List<String> course = new ArrayList<>();
        course.add(CacheTypes.GROUP_STATISTICS);
        course.addAll(CacheTypes.DASHBOARD_GROUP);
        COURSE_TYPES = Collections.unmodifiableList(course);
    }

    private static final List<String> GRADE_DASHBOARD_RELATED = List.of(
            CacheTypes.DASHBOARD_ROLE, CacheTypes.DASHBOARD_FULL, CacheTypes.ADVANCED_METRICS);
    private static final List<String> COURSE_DASHBOARD_TYPES = List.of(
            CacheTypes.DASHBOARD, CacheTypes.DASHBOARD_ROLE, CacheTypes.DASHBOARD_FULL);
    private static final List<String> PERIOD_DASHBOARD_TYPES = List.of(
            CacheTypes.DASHBOARD, CacheTypes.DASHBOARD_ROLE, CacheTypes.DASHBOARD_FULL, CacheTypes.ADVANCED_METRICS);

    public AcademicInvalidationHook(ScopedCacheInvalidator invalidator) {
        super(invalidator);
    }

    /**
     * 清除某个学生的学业与仪表盘缓存。schoolId 为空时退化为按学生 ID 扫描。
     */
    public int invalidateStudent(String studentId, String schoolId) {
        if (schoolId == null) {
            return guarded("academic-student-scan", () -> invalidator.invalidateByEntityId(STUDENT_TYPES, studentId));
        }
        return guarded("academic-student", () -> invalidator.invalidate(STUDENT_TYPES.get(0), studentId, schoolId,
                STUDENT_TYPES.subList(1, STUDENT_TYPES.size())));
    }

    /**
     * 按课程 ID 扫描分组统计与仪表盘分组。
     */
    public int invalidateCourse(String courseId) {
        return guarded("academic-course", () -> invalidator.invalidateByEntityId(COURSE_TYPES, courseId));
    }

    /**
     * 清空全部学业计算缓存。
     */
    public int clearAcademic() {
        return guarded("academic-clear", () -> invalidator.flushType(CacheTypes.ACADEMIC_GROUP));
    }

    /**
     * 成绩新增或修改。
     */
    public int onGradeChanged(String studentId, String subjectId, String courseId, String schoolId) {
        log.debug("Grade changed: student={}, subject={}, course={}", studentId, subjectId, courseId);
        int removed = invalidateStudent(studentId, schoolId);
        removed += invalidateCourse(courseId);
        if (schoolId != null) {
            removed += guarded("academic-grade-dashboard", () -> invalidator.invalidate(CacheTypes.DASHBOARD, studentId, schoolId,
                    GRADE_DASHBOARD_RELATED));
        }
        return removed;
    }

    /**
     * 成就新增或修改：影响整个课程，且平均分需要全部重算。
     */
    public int onAchievementChanged(String subjectId, String courseId, String schoolId) {
        log.debug("Achievement changed: subject={}, course={}, school={}", subjectId, courseId, schoolId);
        return invalidateCourse(courseId) + clearAcademic();
    }

    /**
     * 课程成员变化：清除课程缓存以及该学校所有用户的仪表盘。
     */
    public int onCourseChanged(String courseId, String schoolId) {
        return invalidateCourse(courseId)
                + guarded("academic-course-school", () -> invalidator.invalidateSchool(COURSE_DASHBOARD_TYPES, schoolId));
    }

    /**
     * 学期结束：清空学业缓存以及该学校所有用户的仪表盘与高级指标。
     */
    public int onPeriodClosed(String schoolId, int period) {
        log.debug("Period {} closed for school {}", period, schoolId);
        return clearAcademic()
                + guarded("academic-period-school", () -> invalidator.invalidateSchool(PERIOD_DASHBOARD_TYPES, schoolId));
    }
}
