package io.github.vevoly.jscopedcache.core.utils;

import org.springframework.core.DefaultParameterNameDiscoverer;
import org.springframework.core.ParameterNameDiscoverer;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;

import java.lang.reflect.Method;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 在方法参数上求值 SpEL 表达式，供切面解析缓存键与失效作用域。
 * <p>
 * 上下文中的变量：每个参数按参数名注册（需要 {@code -parameters} 编译），同时注册 {@code #p0}、{@code #p1} ...；
 * 提供返回值时注册为 {@code #result}。解析后的表达式会被缓存。
 * <p>
 * Evaluates SpEL expressions against method arguments, used by the aspects to resolve cache keys and invalidation scopes.
 * Context variables: each argument under its parameter name (requires {@code -parameters}) and as {@code #p0}, {@code #p1} ...;
 * the return value, when given, as {@code #result}. Parsed expressions are cached.
 *
 * @author vevoly
 */
public class SpelArgumentEvaluator {

    public static final String RESULT_VARIABLE = "result";

    private final ExpressionParser parser = new SpelExpressionParser();
    private final ParameterNameDiscoverer parameterNameDiscoverer = new DefaultParameterNameDiscoverer();
    private final Map<String, Expression> expressionCache = new ConcurrentHashMap<>();

    public EvaluationContext createContext(Method method, Object[] args, Object result) {
        StandardEvaluationContext context = new StandardEvaluationContext();
        String[] paramNames = parameterNameDiscoverer.getParameterNames(method);
        for (int i = 0; i < args.length; i++) {
            context.setVariable("p" + i, args[i]);
            if (paramNames != null && i < paramNames.length) {
                context.setVariable(paramNames[i], args[i]);
            }
        }
        context.setVariable(RESULT_VARIABLE, result);
        return context;
    }

    /**
     * 求值并转为字符串，结果为 null 时返回 null。
     *
     * @throws org.springframework.expression.ExpressionException 如果表达式无法解析或求值
     */
    public String evaluateToString(String expression, EvaluationContext context) {
        Object value = expressionCache.computeIfAbsent(expression, parser::parseExpression).getValue(context);
        return Objects.toString(value, null);
    }
}
