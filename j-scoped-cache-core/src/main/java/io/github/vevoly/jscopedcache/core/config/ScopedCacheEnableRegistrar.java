package io.github.vevoly.jscopedcache.core.config;

import io.github.vevoly.jscopedcache.api.annotation.EnableScopedCache;
import org.springframework.beans.factory.support.BeanDefinitionBuilder;
import org.springframework.beans.factory.support.BeanDefinitionRegistry;
import org.springframework.context.annotation.ImportBeanDefinitionRegistrar;
import org.springframework.core.annotation.AnnotationAttributes;
import org.springframework.core.type.AnnotationMetadata;

import static io.github.vevoly.jscopedcache.api.constants.ScopedCacheConstants.SWEEP_ATTRIBUTE_NAME;

/**
 * 解析 @EnableScopedCache，并把 ScopedCacheMarkerConfiguration 注册到容器中。
 * @author vevoly
 */
public class ScopedCacheEnableRegistrar implements ImportBeanDefinitionRegistrar {

    @Override
    public void registerBeanDefinitions(AnnotationMetadata importingClassMetadata, BeanDefinitionRegistry registry) {
        AnnotationAttributes attributes = AnnotationAttributes.fromMap(
                importingClassMetadata.getAnnotationAttributes(EnableScopedCache.class.getName())
        );
        if (attributes == null) {
            return;
        }
        BeanDefinitionBuilder marker = BeanDefinitionBuilder.rootBeanDefinition(ScopedCacheMarkerConfiguration.class);
        marker.addPropertyValue(SWEEP_ATTRIBUTE_NAME, attributes.getBoolean(SWEEP_ATTRIBUTE_NAME));
        registry.registerBeanDefinition(ScopedCacheMarkerConfiguration.class.getName(), marker.getBeanDefinition());
    }
}
