package io.github.vevoly.jscopedcache.core.internal;

import io.github.vevoly.jscopedcache.api.ScopedCacheHandle;
import io.github.vevoly.jscopedcache.core.ScopedCacheFactory;
import io.github.vevoly.jscopedcache.core.config.CachePolicyResolver;
import io.github.vevoly.jscopedcache.core.config.ScopedCacheMarkerConfiguration;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * ScopedCache 实例配置类。
 * 容器关闭时调用 close 停止后台清理。
 * @author vevoly
 */
@Configuration
public class ScopedCacheManagerConfiguration {

    @Bean(destroyMethod = "close")
    public ScopedCacheHandle scopedCache(
            CachePolicyResolver policyResolver,
            @Qualifier("jScopedCacheClock") Clock clock,
            ScopedCacheMarkerConfiguration marker
    ) {
        return ScopedCacheFactory.open(policyResolver, clock, marker.isSweep());
    }
}
