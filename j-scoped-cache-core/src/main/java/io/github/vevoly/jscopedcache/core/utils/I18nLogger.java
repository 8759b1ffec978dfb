package io.github.vevoly.jscopedcache.core.utils;

import org.slf4j.Logger;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

import static io.github.vevoly.jscopedcache.api.constants.ScopedCacheConstants.LOG_PREFIX;

/**
 * 支持国际化 (i18n) 日志输出的辅助类。
 * <p>
 * 封装 {@link ResourceBundle} 与 SLF4J {@link Logger}：调用方只传消息键，
 * 消息模板按当前 Locale 从 {@code i18n/jscopedcache_messages*.properties} 中加载，并统一加上 {@code [JScopedCache] } 前缀。
 * 找不到资源包或消息键时不会抛出异常，而是输出键本身。
 * <p>
 * Helper for internationalized (i18n) log output.
 * Wraps {@link ResourceBundle} and the SLF4J {@link Logger}: callers pass a message key only,
 * the template is loaded for the current Locale from {@code i18n/jscopedcache_messages*.properties} and prefixed with {@code [JScopedCache] }.
 * A missing bundle or key never throws; the key itself is logged instead.
 *
 * @author vevoly
 */
public class I18nLogger {

    private static final String BUNDLE_BASE_NAME = "i18n.jscopedcache_messages";

    private final Logger delegate;
    private final ResourceBundle bundle;

    /**
     * @param delegate 实际输出日志的 SLF4J Logger。/ The SLF4J logger doing the actual output.
     */
    public I18nLogger(Logger delegate) {
        this.delegate = delegate;
        this.bundle = loadBundle(delegate);
    }

    public void debug(String key, Object... args) {
        if (delegate.isDebugEnabled()) {
            delegate.debug(format(key, args));
        }
    }

    public void info(String key, Object... args) {
        if (delegate.isInfoEnabled()) {
            delegate.info(format(key, args));
        }
    }

    public void warn(String key, Object... args) {
        if (delegate.isWarnEnabled()) {
            delegate.warn(format(key, args));
        }
    }

    /**
     * 以 WARN 级别记录一条带异常的国际化日志。
     * <p>
     * Logs an internationalized message with an exception at the WARN level.
     */
    public void warn(String key, Throwable t, Object... args) {
        if (delegate.isWarnEnabled()) {
            delegate.warn(format(key, args), t);
        }
    }

    /**
     * 以 ERROR 级别记录一条带异常的国际化日志。
     * <p>
     * Logs an internationalized message with an exception at the ERROR level.
     */
    public void error(String key, Throwable t, Object... args) {
        if (delegate.isErrorEnabled()) {
            delegate.error(format(key, args), t);
        }
    }

    /**
     * 按键和参数生成最终消息，供日志与异常消息共用。
     * <p>
     * Renders the final message from a key and its arguments, shared by log lines and exception messages.
     */
    public String format(String key, Object... args) {
        if (bundle == null) {
            return LOG_PREFIX + "[i18n disabled] " + key;
        }
        try {
            return LOG_PREFIX + MessageFormat.format(bundle.getString(key), args);
        } catch (MissingResourceException e) {
            return LOG_PREFIX + "!!! LOG KEY NOT FOUND: " + key + " !!!";
        } catch (IllegalArgumentException e) {
            return LOG_PREFIX + "!!! LOG FORMATTING ERROR for key: " + key + " !!!";
        }
    }

    private static ResourceBundle loadBundle(Logger logger) {
        try {
            return ResourceBundle.getBundle(BUNDLE_BASE_NAME, Locale.getDefault(), I18nLogger.class.getClassLoader());
        } catch (MissingResourceException e) {
            logger.warn(LOG_PREFIX + "Could not find i18n resource bundle '{}'. Log keys will be printed as is.", BUNDLE_BASE_NAME);
            return null;
        }
    }
}
