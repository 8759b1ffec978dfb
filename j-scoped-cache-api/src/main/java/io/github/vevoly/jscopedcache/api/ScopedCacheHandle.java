package io.github.vevoly.jscopedcache.api;

/**
 * 一个显式创建的缓存实例。
 * 它被注入到需要它的服务中，而不是作为全局单例存在；关闭时停止后台清理任务。
 * <p>
 * An explicitly created cache instance.
 * It is injected into the services that need it instead of living as a global singleton; closing it stops the background sweep.
 *
 * @author vevoly
 */
public interface ScopedCacheHandle extends ScopedCache, ScopedCacheInvalidator, ScopedCacheAdmin, AutoCloseable {

    @Override
    void close();
}
