package io.github.vevoly.jscopedcache.api;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * JScopedCache 核心 API 接口。
 * 定义了读穿缓存对外暴露的查询操作：命中直接返回，未命中则调用加载器、按类型策略回填并返回。
 * <p>
 * The core API interface for JScopedCache.
 * Defines the read-through operations: a hit returns immediately, a miss invokes the loader,
 * stores the result according to the type policy and returns it.
 *
 * @author vevoly
 */
public interface ScopedCache {

    // =================================================================
    // ======================== 读穿查询 / Read-through Fetch ============
    // =================================================================

    /**
     * 根据完整的缓存 Key 获取数据。
     * 如果缓存未命中，则调用 loader 加载数据，并以 typeName 对应的 TTL 回填缓存。
     * loader 抛出的异常会原样抛给调用方，且不会被缓存。
     * loader 返回 null 时不会写入缓存。
     * <p>
     * Fetches data by its full cache key.
     * If the cache misses, invokes the loader and stores the result with the TTL of typeName's policy.
     * An exception thrown by the loader reaches the caller unchanged and nothing is cached.
     * A null result is returned but never stored.
     *
     * @param key      完整的缓存键，通常由 {@link #buildKey(String, String...)} 生成。/ The full cache key, usually from {@link #buildKey(String, String...)}.
     * @param typeName 缓存类型，决定 TTL。/ The cache type, selecting the TTL.
     * @param loader   未命中时执行的加载器。/ The loader executed on a miss.
     * @param <T>      返回数据的类型。/ The type of the returned data.
     * @return 缓存或加载器中的数据。/ The data from cache or loader.
     */
    <T> T fetch(String key, String typeName, Supplier<T> loader);

    /**
     * 异步版本的 {@link #fetch(String, String, Supplier)}。
     * 加载器返回的 Future 失败时，返回的 Future 以相同原因失败，且不会被缓存。
     * <p>
     * Asynchronous variant of {@link #fetch(String, String, Supplier)}.
     * When the loader's future fails, the returned future fails with the same cause and nothing is cached.
     *
     * @param key      完整的缓存键。/ The full cache key.
     * @param typeName 缓存类型。/ The cache type.
     * @param loader   返回异步结果的加载器。/ A loader returning an asynchronous result.
     * @param <T>      返回数据的类型。/ The type of the returned data.
     * @return 结果 Future。/ The result future.
     */
    <T> CompletableFuture<T> fetchAsync(String key, String typeName, Supplier<? extends CompletionStage<T>> loader);

    // =================================================================
    // ======================== 键 / Keys ===============================
    // =================================================================

    /**
     * 构建缓存键，供调用方保持一致的键格式。
     * <p>
     * Builds a cache key so callers construct keys consistently.
     *
     * @param typeName 缓存类型。/ The cache type.
     * @param params   有序参数（通常为 userId, schoolId, 查询参数）。/ Ordered params (usually userId, schoolId, query).
     * @return 完整的缓存键。/ The full cache key.
     */
    String buildKey(String typeName, String... params);
}
