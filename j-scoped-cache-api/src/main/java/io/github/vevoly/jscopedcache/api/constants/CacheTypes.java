package io.github.vevoly.jscopedcache.api.constants;

import java.util.List;

/**
 * 定义了框架内置的缓存类型名称，以及在失效时经常一起处理的类型分组。
 * <p>
 * 类型名就是缓存键的第一段，它决定了条目的 TTL 策略。
 * 用户可以在 application.yml 的 {@code types} 中覆盖或新增类型。
 * <p>
 * Defines the built-in cache type names, and the groups of types that are usually invalidated together.
 * The type name is the first segment of a cache key and selects the TTL policy of the entry.
 * Users can override or add types under {@code types} in application.yml.
 *
 * @author vevoly
 */
public final class CacheTypes {

    private CacheTypes() {}

    // ======================== 通用 / General ========================

    public static final String DASHBOARD = "dashboard";
    public static final String MESSAGES = "mensajes";
    public static final String ANNOUNCEMENTS = "anuncios";
    public static final String NOTIFICATIONS = "notificaciones";
    public static final String GRADES = "calificaciones";
    public static final String COURSES = "cursos";
    public static final String USERS = "usuarios";

    // ======================== 仪表盘 / Dashboard ========================

    public static final String DASHBOARD_ROLE = "dashboard_rol";
    public static final String DASHBOARD_FULL = "dashboard_completo";
    public static final String TODAY_EVENTS = "eventos_hoy";
    public static final String ADVANCED_METRICS = "metricas_avanzadas";

    // ======================== 学业 / Academic ========================

    public static final String PERIOD_AVERAGE = "promedio_periodo";
    public static final String SUBJECT_AVERAGE = "promedio_asignatura";
    public static final String GROUP_STATISTICS = "estadisticas_grupo";

    // ======================== 消息 / Messaging ========================

    public static final String RECIPIENTS = "destinatarios";
    public static final String RECIPIENT_COURSES = "cursos_destinatarios";
    public static final String GUARDIANS = "acudientes";
    public static final String MESSAGE_LIST = "lista_mensajes";

    // ======================== 其他 / Others ========================

    public static final String ATTENDANCE = "asistencia";
    public static final String SCHOOL = "escuela";
    public static final String ACHIEVEMENTS = "logros";

    // ======================== 分组 / Groups ========================

    /**
     * 仪表盘相关的全部类型。
     * <p>
     * Every dashboard-related type.
     */
    public static final List<String> DASHBOARD_GROUP = List.of(
            DASHBOARD, DASHBOARD_ROLE, DASHBOARD_FULL, TODAY_EVENTS, ADVANCED_METRICS);

    /**
     * 学业计算相关的类型（平均分、分组统计）。
     * <p>
     * Types holding academic computations (averages, group statistics).
     */
    public static final List<String> ACADEMIC_GROUP = List.of(
            PERIOD_AVERAGE, SUBJECT_AVERAGE, GROUP_STATISTICS);

    /**
     * 新消息写入后需要跟随 {@link #MESSAGES} 一起失效的类型。
     * <p>
     * Types invalidated together with {@link #MESSAGES} after a message is written.
     */
    public static final List<String> MESSAGE_RELATED_GROUP = List.of(
            RECIPIENTS, RECIPIENT_COURSES, GUARDIANS, DASHBOARD, DASHBOARD_FULL);
}
