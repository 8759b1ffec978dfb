package io.github.vevoly.jscopedcache.api.annotation;

import io.github.vevoly.jscopedcache.api.config.ScopedCacheImportsSelector;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * 启用 j-scoped-cache 框架的核心功能。
 * 将此注解添加到您的主应用类 (带有 @SpringBootApplication 的类) 上。
 * 未添加时，框架只注册一个直接回源的空实现。
 * <p>
 * Enables the core functionalities of the j-scoped-cache framework.
 * Add this annotation to your main application class (the one with @SpringBootApplication).
 * Without it the framework only registers a pass-through no-op implementation.
 *
 * @author vevoly
 */
@Documented
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Import(ScopedCacheImportsSelector.class)
public @interface EnableScopedCache {

    /**
     * 是否启动后台过期清理任务。
     * 设置为 false 时，过期条目只会在读取或列出键时被惰性清除。
     * <p>
     * Whether to start the background expiry sweep.
     * When false, expired entries are only discarded lazily on reads and key listings.
     */
    boolean sweep() default true;
}
