package io.github.vevoly.jscopedcache.starter.autoconfigure;

import io.github.vevoly.jscopedcache.api.ScopedCache;
import io.github.vevoly.jscopedcache.api.ScopedCacheHandle;
import io.github.vevoly.jscopedcache.api.ScopedCacheInvalidator;
import io.github.vevoly.jscopedcache.core.config.CachePolicyResolver;
import io.github.vevoly.jscopedcache.core.hooks.AcademicInvalidationHook;
import io.github.vevoly.jscopedcache.core.hooks.DashboardInvalidationHook;
import io.github.vevoly.jscopedcache.core.hooks.MessageInvalidationHook;
import io.github.vevoly.jscopedcache.core.internal.NoOpScopedCache;
import io.github.vevoly.jscopedcache.core.internal.ScopedCacheInvalidationAspect;
import io.github.vevoly.jscopedcache.core.internal.ScopedCacheManagerConfiguration;
import io.github.vevoly.jscopedcache.core.internal.ScopedCacheableAspect;
import io.github.vevoly.jscopedcache.core.properties.ScopedCacheRootProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import java.time.Clock;

import static io.github.vevoly.jscopedcache.api.constants.ScopedCacheConstants.MARKER_CONFIG_CLASS_NAME;

/**
 * j-scoped-cache 的自动配置类。
 * <p>
 * 负责组装框架的所有组件：
 * 1. 激活配置属性。
 * 2. 初始化类型策略解析器。
 * 3. 创建缓存实例（含后台清理任务）。
 * 4. 注册 AOP 切面与失效钩子。
 * <p>
 * Auto-configuration class for j-scoped-cache.
 * Assembles every component of the framework:
 * 1. Activating configuration properties.
 * 2. Initializing the type policy resolver.
 * 3. Creating the cache instance (with its background sweep).
 * 4. Registering the AOP aspects and the invalidation hooks.
 *
 * @author vevoly
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(ScopedCacheRootProperties.class)
@ConditionalOnProperty(prefix = "j-scoped-cache", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ScopedCacheAutoConfiguration {

    /**
     * 【启用模式】
     * 用户使用了 @EnableScopedCache 注解，加载真实的缓存、切面与清理任务。
     */
    @Configuration
    @ConditionalOnBean(type = MARKER_CONFIG_CLASS_NAME) // 只有 Marker 存在时才生效 / Only take effect when Marker exists
    @Import(ScopedCacheManagerConfiguration.class)
    static class ScopedCacheActiveConfiguration {

        /**
         * 存储使用的时钟，可由用户覆盖（例如测试中使用固定时钟）。
         */
        @Bean("jScopedCacheClock")
        @ConditionalOnMissingBean(name = "jScopedCacheClock")
        public Clock jScopedCacheClock() {
            return Clock.systemUTC();
        }

        @Bean
        public CachePolicyResolver scopedCachePolicyResolver(ScopedCacheRootProperties rootProperties) {
            return new CachePolicyResolver(rootProperties);
        }

        @Bean
        public ScopedCacheableAspect scopedCacheableAspect(ScopedCache scopedCache) {
            return new ScopedCacheableAspect(scopedCache);
        }

        @Bean
        public ScopedCacheInvalidationAspect scopedCacheInvalidationAspect(ScopedCacheInvalidator scopedCacheInvalidator) {
            return new ScopedCacheInvalidationAspect(scopedCacheInvalidator);
        }
    }

    /**
     * 【降级模式】
     * 用户没有使用 @EnableScopedCache 注解，只注册一个直接回源的空实现，防止注入失败。
     */
    @Configuration
    @ConditionalOnMissingBean(type = MARKER_CONFIG_CLASS_NAME) // Marker 不存在时生效 / Only take effect when Marker not exists
    static class ScopedCacheFallbackConfiguration {

        @Bean
        @ConditionalOnMissingBean(ScopedCacheHandle.class)
        public ScopedCacheHandle scopedCacheFallback() {
            return new NoOpScopedCache();
        }
    }

    // 两种模式都注册钩子，业务代码无需区分

    @Bean
    @ConditionalOnMissingBean
    public DashboardInvalidationHook dashboardInvalidationHook(ScopedCacheInvalidator invalidator) {
        return new DashboardInvalidationHook(invalidator);
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageInvalidationHook messageInvalidationHook(ScopedCacheInvalidator invalidator) {
        return new MessageInvalidationHook(invalidator);
    }

    @Bean
    @ConditionalOnMissingBean
    public AcademicInvalidationHook academicInvalidationHook(ScopedCacheInvalidator invalidator) {
        return new AcademicInvalidationHook(invalidator);
    }
}
