package io.github.vevoly.jscopedcache.core.internal;

import io.github.vevoly.jscopedcache.api.exception.InvalidCacheKeyException;
import io.github.vevoly.jscopedcache.core.config.CachePolicyResolver;
import io.github.vevoly.jscopedcache.core.store.TtlStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

import static io.github.vevoly.jscopedcache.api.constants.ScopedCacheConstants.LOG_PREFIX;

/**
 * 读穿缓存的核心流程。
 * <p>
 * 命中时直接返回，不调用加载器；未命中时调用加载器，成功后按类型策略的 TTL 回填，失败时异常原样抛出且不写入任何内容。
 * 存储层本身的读写异常只记录日志（fail open）：读失败视为未命中，写失败仍然返回计算结果。
 * <p>
 * 开启 single-flight 时，同一个 Key 的并发未命中共享同一个进行中的 {@link CompletableFuture}，
 * 该 Future 完成（无论成功或失败）后即从进行中表里移除。加载器执行期间不持有任何存储锁。
 * 加载器不能在同一线程上对同一个 Key 再次调用同步读穿，否则会等待自己的计算而永远阻塞。
 * <p>
 * The read-through flow.
 * A hit returns right away without calling the loader; a miss calls the loader, stores a success with the TTL of the type policy,
 * and lets a failure propagate unchanged with nothing stored.
 * Failures of the store itself are logged and tolerated (fail open): a failed read is a miss, a failed write still returns the value.
 * <p>
 * With single-flight on, concurrent misses for one key share one in-flight {@link CompletableFuture},
 * which leaves the in-flight table as soon as it completes, successfully or not. No store lock is held while a loader runs.
 * A loader must not call the synchronous read-through again for the same key on the same thread: it would wait on its own
 * computation forever.
 * <p>
 * A null key is rejected with {@link InvalidCacheKeyException} whether single-flight is on or off.
 *
 * @author vevoly
 */
@Slf4j
public class ReadThroughCache {

    private final TtlStore store;
    private final CachePolicyResolver policyResolver;
    private final boolean singleFlight;

    private final ConcurrentMap<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();

    public ReadThroughCache(TtlStore store, CachePolicyResolver policyResolver, boolean singleFlight) {
        this.store = store;
        this.policyResolver = policyResolver;
        this.singleFlight = singleFlight;
    }

    /**
     * 同步读穿。
     * <p>
     * Synchronous read-through.
     *
     * @param key      完整的缓存键。/ The full cache key.
     * @param typeName 缓存类型，为空时从键的第一段推断。/ The cache type, inferred from the key's first segment when blank.
     * @param loader   未命中时调用的加载器。/ The loader invoked on a miss.
     * @throws InvalidCacheKeyException 如果 key 为 null。/ if the key is null.
     */
    @SuppressWarnings("unchecked")
    public <T> T getOrCompute(String key, String typeName, Supplier<T> loader) {
        requireKey(key);
        Optional<Object> cached = readQuietly(key);
        if (cached.isPresent()) {
            log.debug(LOG_PREFIX + "[HIT] key={}", key);
            return (T) cached.get();
        }
        log.debug(LOG_PREFIX + "[MISS] key={}", key);
        if (!singleFlight) {
            T value = loader.get();
            writeQuietly(key, typeName, value);
            return value;
        }

        CompletableFuture<Object> mine = new CompletableFuture<>();
        CompletableFuture<Object> shared = inFlight.putIfAbsent(key, mine);
        if (shared != null) {
            log.debug(LOG_PREFIX + "[JOIN] key={} is already being computed", key);
            return (T) awaitShared(shared);
        }

        T value;
        try {
            value = loader.get();
        } catch (Throwable t) {
            inFlight.remove(key, mine);
            mine.completeExceptionally(t);
            throw t;
        }
        writeQuietly(key, typeName, value);
        inFlight.remove(key, mine);
        mine.complete(value);
        return value;
    }

    /**
     * 异步读穿。加载器在调用线程上被调用，它返回的阶段完成后才写入缓存。
     * 加载器直接抛出异常时，返回一个以该异常失败的 Future。
     * <p>
     * Asynchronous read-through. The loader is called on the calling thread and the value is stored once its stage completes.
     * A loader that throws directly yields a future failed with that exception.
     */
    @SuppressWarnings("unchecked")
    public <T> CompletableFuture<T> getOrComputeAsync(String key, String typeName, Supplier<? extends CompletionStage<T>> loader) {
        requireKey(key);
        Optional<Object> cached = readQuietly(key);
        if (cached.isPresent()) {
            log.debug(LOG_PREFIX + "[HIT] key={}", key);
            return CompletableFuture.completedFuture((T) cached.get());
        }
        log.debug(LOG_PREFIX + "[MISS] key={}", key);
        if (!singleFlight) {
            return load(key, typeName, loader);
        }

        CompletableFuture<Object> mine = new CompletableFuture<>();
        CompletableFuture<Object> shared = inFlight.putIfAbsent(key, mine);
        if (shared != null) {
            log.debug(LOG_PREFIX + "[JOIN] key={} is already being computed", key);
            return shared.thenApply(value -> (T) value);
        }

        CompletableFuture<T> result = load(key, typeName, loader);
        result.whenComplete((value, error) -> {
            inFlight.remove(key, mine);
            if (error != null) {
                mine.completeExceptionally(unwrap(error));
            } else {
                mine.complete(value);
            }
        });
        return result;
    }

    /**
     * 当前进行中的计算数量，主要用于测试与诊断。
     * <p>
     * Number of computations currently in flight, mainly for tests and diagnostics.
     */
    public int inFlightCount() {
        return inFlight.size();
    }

    public boolean isSingleFlight() {
        return singleFlight;
    }

    private <T> CompletableFuture<T> load(String key, String typeName, Supplier<? extends CompletionStage<T>> loader) {
        CompletionStage<T> stage;
        try {
            stage = loader.get();
        } catch (Throwable t) {
            return CompletableFuture.failedFuture(t);
        }
        if (stage == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("Async loader for key " + key + " returned no stage"));
        }
        return stage.toCompletableFuture().thenApply(value -> {
            writeQuietly(key, typeName, value);
            return value;
        });
    }

    private static void requireKey(String key) {
        if (key == null) {
            throw new InvalidCacheKeyException("Cache key must not be null");
        }
    }

    private Optional<Object> readQuietly(String key) {
        try {
            return store.get(key);
        } catch (RuntimeException e) {
            log.warn(LOG_PREFIX + "[FAIL-OPEN] Store read failed for key={}, treating it as a miss.", key, e);
            return Optional.empty();
        }
    }

    private void writeQuietly(String key, String typeName, Object value) {
        if (value == null) {
            return;
        }
        try {
            long ttlSeconds = StringUtils.isBlank(typeName)
                    ? policyResolver.policyOfKey(key).getTtlSeconds()
                    : policyResolver.policyOf(typeName).getTtlSeconds();
            store.set(key, value, ttlSeconds);
            log.debug(LOG_PREFIX + "[SET] key={}, ttl={}s", key, ttlSeconds);
        } catch (RuntimeException e) {
            log.warn(LOG_PREFIX + "[FAIL-OPEN] Store write failed for key={}, returning the computed value.", key, e);
        }
    }

    private static Object awaitShared(CompletableFuture<Object> shared) {
        try {
            return shared.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
