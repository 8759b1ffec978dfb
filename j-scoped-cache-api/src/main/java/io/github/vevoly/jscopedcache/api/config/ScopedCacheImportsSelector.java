package io.github.vevoly.jscopedcache.api.config;

import org.springframework.context.annotation.ImportSelector;
import org.springframework.core.type.AnnotationMetadata;

import static io.github.vevoly.jscopedcache.api.constants.ScopedCacheConstants.REGISTRAR_CLASS_NAME;

/**
 * 用于导入 core 模块中的 ScopedCacheEnableRegistrar 类，避免强依赖。
 * api 模块不能依赖 core 模块，所以注解中无法直接 import 位于 core 模块的 Registrar，这里返回它的全限定类名，
 * 运行期只要 core 包在 classpath 下就能正常加载。
 * <p>
 * Imports ScopedCacheEnableRegistrar from the core module without a compile-time dependency.
 * The api module cannot depend on core, so the registrar is returned by its fully qualified name
 * and loaded at runtime as long as core is on the classpath.
 *
 * @author vevoly
 */
public class ScopedCacheImportsSelector implements ImportSelector {

    @Override
    public String[] selectImports(AnnotationMetadata importingClassMetadata) {
        return new String[]{REGISTRAR_CLASS_NAME};
    }
}
