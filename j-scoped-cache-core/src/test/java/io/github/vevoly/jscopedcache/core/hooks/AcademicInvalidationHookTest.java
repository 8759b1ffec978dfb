package io.github.vevoly.jscopedcache.core.hooks;

import io.github.vevoly.jscopedcache.api.ScopedCacheHandle;
import io.github.vevoly.jscopedcache.core.ScopedCacheFactory;
import io.github.vevoly.jscopedcache.core.support.MutableClock;
import io.github.vevoly.jscopedcache.core.support.TestPolicies;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AcademicInvalidationHookTest {

    private ScopedCacheHandle cache;
    private AcademicInvalidationHook hook;

    @BeforeEach
    void setUp() {
        cache = ScopedCacheFactory.open(TestPolicies.properties(100, true), new MutableClock(0L));
        hook = new AcademicInvalidationHook(cache);
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    private void seed(String... keys) {
        for (String key : keys) {
            cache.fetch(key, null, () -> "v");
        }
    }

    @Test
    void studentWithSchoolUsesScopeInvalidation() {
        seed("promedio_periodo:st1:s1:p1", "estadisticas_grupo:st1:s1", "dashboard:st1:s1", "dashboard:st2:s1",
                "logros:st1:s1");

        assertEquals(3, hook.invalidateStudent("st1", "s1"));
        assertEquals(Set.of("dashboard:st2:s1", "logros:st1:s1"), cache.keys());
    }

    @Test
    void studentWithoutSchoolFallsBackToEntityScan() {
        seed("promedio_asignatura:sub3:st1", "dashboard_rol:st1:s9", "logros:st1:s1");

        assertEquals(2, hook.invalidateStudent("st1", null));
        assertEquals(Set.of("logros:st1:s1"), cache.keys());
    }

    @Test
    void courseScanCoversGroupStatisticsAndDashboards() {
        seed("estadisticas_grupo:c42:p2", "eventos_hoy:u1:s1:c42", "promedio_periodo:c42", "estadisticas_grupo:c7");

        assertEquals(2, hook.invalidateCourse("c42"));
        assertEquals(Set.of("promedio_periodo:c42", "estadisticas_grupo:c7"), cache.keys());
    }

    @Test
    void clearAcademicFlushesAcademicTypesOnly() {
        seed("promedio_periodo:a", "promedio_asignatura:b", "estadisticas_grupo:c", "dashboard:u1:s1");

        assertEquals(3, hook.clearAcademic());
        assertEquals(Set.of("dashboard:u1:s1"), cache.keys());
    }

    @Test
    void courseChangeClearsEveryDashboardOfTheSchool() {
        seed("dashboard:u1:s1", "dashboard_rol:u2:s1", "dashboard:u3:s2", "estadisticas_grupo:c1:p1");

        hook.onCourseChanged("c1", "s1");

        assertEquals(Set.of("dashboard:u3:s2"), cache.keys());
    }

    @Test
    void periodCloseClearsAcademicAndSchoolDashboards() {
        seed("promedio_periodo:st1:s1", "metricas_avanzadas:u1:s1", "dashboard:u2:s1", "dashboard:u3:s2",
                "eventos_hoy:u1:s1");

        hook.onPeriodClosed("s1", 2);

        assertEquals(Set.of("dashboard:u3:s2", "eventos_hoy:u1:s1"), cache.keys());
    }

    @Test
    void gradeChangeClearsStudentCourseAndDashboards() {
        seed("promedio_periodo:st1:s1", "estadisticas_grupo:c1:p1", "metricas_avanzadas:st1:s1",
                "dashboard:st2:s1", "logros:st1:s1");

        hook.onGradeChanged("st1", "sub1", "c1", "s1");

        assertEquals(Set.of("dashboard:st2:s1", "logros:st1:s1"), cache.keys());
    }

    @Test
    void achievementChangeClearsCourseAndAllAcademicTypes() {
        seed("estadisticas_grupo:c1:p1", "promedio_asignatura:st9:s1", "dashboard:u1:s1:c1", "dashboard:u2:s1");

        hook.onAchievementChanged("sub1", "c1", "s1");

        assertEquals(Set.of("dashboard:u2:s1"), cache.keys());
    }
}
