package io.github.vevoly.jscopedcache.core.internal;

import io.github.vevoly.jscopedcache.api.ScopedCacheInvalidator;
import io.github.vevoly.jscopedcache.api.annotation.InvalidatesScopedCache;
import io.github.vevoly.jscopedcache.core.utils.I18nLogger;
import io.github.vevoly.jscopedcache.core.utils.SpelArgumentEvaluator;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.JoinPoint;
import org.aspectj.lang.annotation.AfterReturning;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.expression.EvaluationContext;

import java.lang.reflect.Method;
import java.util.Arrays;

/**
 * 处理 {@link InvalidatesScopedCache} 注解的 AOP 切面。
 * <p>
 * 只在方法正常返回后触发，相当于写操作提交后的失效钩子。失效过程中的任何异常都只记录日志。
 * <p>
 * Aspect for handling the {@link InvalidatesScopedCache} annotation.
 * Fires only after the method returned normally, acting as the post-commit invalidation hook of a write.
 * Any exception raised while invalidating is logged only.
 *
 * @author vevoly
 */
@Slf4j
@Aspect
public class ScopedCacheInvalidationAspect {

    private final ScopedCacheInvalidator invalidator;
    private final SpelArgumentEvaluator evaluator = new SpelArgumentEvaluator();
    private final I18nLogger i18nLogger = new I18nLogger(log);

    public ScopedCacheInvalidationAspect(ScopedCacheInvalidator invalidator) {
        this.invalidator = invalidator;
    }

    @AfterReturning(pointcut = "@annotation(invalidatesScopedCache)", returning = "result")
    public void afterReturning(JoinPoint joinPoint, InvalidatesScopedCache invalidatesScopedCache, Object result) {
        Method method = ((MethodSignature) joinPoint.getSignature()).getMethod();
        try {
            EvaluationContext context = evaluator.createContext(method, joinPoint.getArgs(), result);
            String userId = evaluator.evaluateToString(invalidatesScopedCache.userId(), context);
            String schoolId = evaluator.evaluateToString(invalidatesScopedCache.schoolId(), context);
            invalidator.invalidate(invalidatesScopedCache.type(), userId, schoolId,
                    Arrays.asList(invalidatesScopedCache.related()));
        } catch (RuntimeException e) {
            i18nLogger.error("aop.invalidate_failed", e, method.getDeclaringClass().getSimpleName(), method.getName());
        }
    }
}
