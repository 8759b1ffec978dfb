package io.github.vevoly.jscopedcache.api.exception;

/**
 * 缓存键的组成部分不合法（例如参数中包含未转义的分隔符），继续拼接会产生冲突的键。
 * 这是编程错误，应当尽早暴露。
 * <p>
 * A cache key component is invalid (for example a param contains the unescaped delimiter),
 * and building the key would risk a collision. This is a programming error and fails fast.
 *
 * @author vevoly
 */
public class InvalidCacheKeyException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidCacheKeyException(String message) {
        super(message);
    }

    public InvalidCacheKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
