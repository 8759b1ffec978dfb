package io.github.vevoly.jscopedcache.api.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 写操作成功后的缓存失效钩子。
 * 只有方法正常返回时才会失效 (类型, 用户, 学校) 作用域；方法抛出异常时什么也不做。
 * 失效过程中的任何错误只记录日志，不会影响方法的返回。
 * <p>
 * Post-commit invalidation hook for write operations.
 * The (type, user, school) scope is invalidated only when the method returns normally; nothing happens when it throws.
 * Any error raised while invalidating is logged and never affects the method's result.
 *
 * @author vevoly
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface InvalidatesScopedCache {

    /**
     * 主类型。
     */
    String type();

    /**
     * 一起失效的相关类型。
     */
    String[] related() default {};

    /**
     * 解析用户 ID 的 SpEL 表达式，可以引用方法参数 (#param) 和返回值 (#result)。
     */
    String userId();

    /**
     * 解析学校 ID 的 SpEL 表达式，可以引用方法参数 (#param) 和返回值 (#result)。
     */
    String schoolId();
}
