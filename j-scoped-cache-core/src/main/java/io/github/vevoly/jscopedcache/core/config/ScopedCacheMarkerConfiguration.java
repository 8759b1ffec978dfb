package io.github.vevoly.jscopedcache.core.config;

/**
 * 标记 Bean，保存 @EnableScopedCache 注解中的配置。
 * 它存在即表示用户启用了框架。
 * @author vevoly
 */
public class ScopedCacheMarkerConfiguration {

    private boolean sweep = true;

    public boolean isSweep() {
        return sweep;
    }

    public void setSweep(boolean sweep) {
        this.sweep = sweep;
    }
}
