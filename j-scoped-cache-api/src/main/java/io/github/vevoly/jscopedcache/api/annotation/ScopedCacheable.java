package io.github.vevoly.jscopedcache.api.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 查询并缓存。
 * 方法返回值以 {@code type + key 参数} 组成的缓存键做读穿缓存，TTL 由类型策略决定。
 * <p>
 * Query and cache.
 * The method's return value is read-through cached under the key built from {@code type} and the key params,
 * with the TTL taken from the type policy.
 *
 * <pre>
 * &#64;ScopedCacheable(type = CacheTypes.RECIPIENTS, key = {"#userId", "#schoolId", "T(io.github.vevoly.jscopedcache.api.utils.CacheKeyBuilder).queryParam(#query)"})
 * public List&lt;Recipient&gt; findRecipients(String userId, String schoolId, String query) { ... }
 * </pre>
 *
 * @author vevoly
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface ScopedCacheable {

    /**
     * 缓存类型名称，对应策略表中的类型。
     */
    String type();

    /**
     * 按顺序求值的 SpEL 表达式，每个表达式的结果作为键的一段。
     * 为空时，按顺序使用方法的全部参数。
     */
    String[] key() default {};
}
