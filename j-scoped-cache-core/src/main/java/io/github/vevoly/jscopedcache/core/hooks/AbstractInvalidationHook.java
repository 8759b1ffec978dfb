package io.github.vevoly.jscopedcache.core.hooks;

import io.github.vevoly.jscopedcache.api.ScopedCacheInvalidator;
import io.github.vevoly.jscopedcache.core.utils.I18nLogger;
import lombok.extern.slf4j.Slf4j;

import java.util.function.IntSupplier;

/**
 * 失效钩子的基类。
 * <p>
 * 钩子在写操作成功之后由业务代码调用。缓存失效失败不能让已经成功的请求失败，
 * 因此每个动作都在 {@link #guarded(String, IntSupplier)} 中执行：异常只记录日志，返回 0。
 * <p>
 * Base class of the invalidation hooks.
 * Hooks are called by business code after a write succeeded. A failed invalidation must never fail a request that already
 * succeeded, so every action runs inside {@link #guarded(String, IntSupplier)}: exceptions are logged and 0 is returned.
 *
 * @author vevoly
 */
@Slf4j
public abstract class AbstractInvalidationHook {

    protected final ScopedCacheInvalidator invalidator;
    protected final I18nLogger i18nLog = new I18nLogger(log);

    protected AbstractInvalidationHook(ScopedCacheInvalidator invalidator) {
        this.invalidator = invalidator;
    }

    /**
     * 执行一次失效动作，吞掉并记录运行时异常。
     *
     * @param operation 用于日志的动作名称
     * @param action    失效动作，返回清除的键数量
     * @return 清除的键数量，失败时为 0
     */
    protected int guarded(String operation, IntSupplier action) {
        try {
            return action.getAsInt();
        } catch (RuntimeException e) {
            i18nLog.error("hook.failed", e, operation);
            return 0;
        }
    }
}
