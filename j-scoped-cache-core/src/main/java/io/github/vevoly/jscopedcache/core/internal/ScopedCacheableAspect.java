package io.github.vevoly.jscopedcache.core.internal;

import io.github.vevoly.jscopedcache.api.ScopedCache;
import io.github.vevoly.jscopedcache.api.annotation.ScopedCacheable;
import io.github.vevoly.jscopedcache.core.utils.I18nLogger;
import io.github.vevoly.jscopedcache.core.utils.SpelArgumentEvaluator;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.expression.EvaluationContext;

import java.lang.reflect.Method;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * 处理 {@link ScopedCacheable} 注解的 AOP 切面。
 * <p>
 * 由注解的类型与 SpEL 键参数构建缓存键，再交给 {@link ScopedCache#fetch} 做读穿；返回 {@link CompletionStage} 的方法走异步读穿。
 * 构建键失败（SpEL 错误、参数包含分隔符、参数为 null）时不影响业务，直接调用原方法。
 * 原方法抛出的异常原样传给调用方。
 * <p>
 * Aspect for handling the {@link ScopedCacheable} annotation.
 * Builds the cache key from the annotated type and the SpEL key params, then read-throughs via {@link ScopedCache#fetch};
 * methods returning a {@link CompletionStage} go through the asynchronous read-through.
 * When the key cannot be built (SpEL error, a param containing the delimiter, a null param) the method is simply invoked.
 * Exceptions thrown by the method reach the caller unchanged.
 *
 * @author vevoly
 */
@Slf4j
@Aspect
public class ScopedCacheableAspect {

    private final ScopedCache scopedCache;
    private final SpelArgumentEvaluator evaluator = new SpelArgumentEvaluator();
    private final I18nLogger i18nLogger = new I18nLogger(log);

    public ScopedCacheableAspect(ScopedCache scopedCache) {
        this.scopedCache = scopedCache;
    }

    @Around("@annotation(scopedCacheable)")
    public Object around(ProceedingJoinPoint joinPoint, ScopedCacheable scopedCacheable) throws Throwable {
        Method method = ((MethodSignature) joinPoint.getSignature()).getMethod();
        String key;
        try {
            key = scopedCache.buildKey(scopedCacheable.type(), keyParams(method, joinPoint.getArgs(), scopedCacheable));
        } catch (RuntimeException e) {
            i18nLogger.warn("aop.key_failed", e, method.getDeclaringClass().getSimpleName(), method.getName());
            return joinPoint.proceed();
        }

        try {
            if (CompletionStage.class.isAssignableFrom(method.getReturnType())) {
                return scopedCache.fetchAsync(key, scopedCacheable.type(), asyncLoader(joinPoint));
            }
            return scopedCache.fetch(key, scopedCacheable.type(), loader(joinPoint));
        } catch (CheckedInvocationException e) {
            throw e.getCause();
        }
    }

    private String[] keyParams(Method method, Object[] args, ScopedCacheable annotation) {
        String[] expressions = annotation.key();
        if (expressions.length == 0) {
            String[] params = new String[args.length];
            for (int i = 0; i < args.length; i++) {
                params[i] = Objects.toString(args[i], null);
            }
            return params;
        }
        EvaluationContext context = evaluator.createContext(method, args, null);
        String[] params = new String[expressions.length];
        for (int i = 0; i < expressions.length; i++) {
            params[i] = evaluator.evaluateToString(expressions[i], context);
        }
        return params;
    }

    private static Supplier<Object> loader(ProceedingJoinPoint joinPoint) {
        return () -> proceed(joinPoint);
    }

    @SuppressWarnings("unchecked")
    private static Supplier<CompletionStage<Object>> asyncLoader(ProceedingJoinPoint joinPoint) {
        return () -> {
            try {
                return (CompletionStage<Object>) joinPoint.proceed();
            } catch (Throwable t) {
                return CompletableFuture.failedFuture(t);
            }
        };
    }

    private static Object proceed(ProceedingJoinPoint joinPoint) {
        try {
            return joinPoint.proceed();
        } catch (RuntimeException | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new CheckedInvocationException(t);
        }
    }

    /**
     * 在 Supplier 中携带原方法声明的受检异常，出切面前还原。
     */
    private static final class CheckedInvocationException extends RuntimeException {
        CheckedInvocationException(Throwable cause) {
            super(cause);
        }
    }
}
