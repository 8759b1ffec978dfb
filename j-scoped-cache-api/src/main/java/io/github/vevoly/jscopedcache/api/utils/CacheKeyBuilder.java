package io.github.vevoly.jscopedcache.api.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.github.vevoly.jscopedcache.api.exception.InvalidCacheKeyException;
import org.apache.commons.lang3.StringUtils;

import static io.github.vevoly.jscopedcache.api.constants.ScopedCacheConstants.KEY_DELIMITER;
import static io.github.vevoly.jscopedcache.api.constants.ScopedCacheConstants.KEY_DELIMITER_CHAR;

/**
 * 缓存键的构建工具。
 * <p>
 * 规则：typeName + ":" + params[0] + ":" + params[1] ...
 * 约定参数顺序为 userId、schoolId、其余查询参数，这样按 (类型, 用户, 学校) 前缀就可以一次清除所有变体。
 * <p>
 * Cache key construction utility.
 * Rule: typeName + ":" + params[0] + ":" + params[1] ...
 * By convention params are ordered userId, schoolId, then free-form query params, so a
 * (type, user, school) prefix removes every variant at once.
 *
 * @author vevoly
 */
public final class CacheKeyBuilder {

    private CacheKeyBuilder() {}

    private static final String NULL_QUERY = "null";

    private static final String[] ESCAPE_SEARCH = {"%", KEY_DELIMITER};
    private static final String[] ESCAPE_REPLACE = {"%25", "%3A"};

    /**
     * 专门用于序列化查询参数的 ObjectMapper，属性与 Map 条目都按名称排序，保证输出稳定。
     */
    private static final ObjectMapper QUERY_MAPPER = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .build();

    /**
     * 构建完整的缓存键。
     * <p>
     * 没有参数时，键就是类型名本身。类型名不能为空；类型名和参数都不能包含分隔符，参数不能为 null。
     * 需要放入任意文本时，请先调用 {@link #escape(String)} 或 {@link #queryParam(Object)}。
     * <p>
     * Builds the full cache key.
     * With no params the key is the type name alone. The type name must not be blank; neither it nor any param may contain
     * the delimiter, and params must not be null. Pass arbitrary text through {@link #escape(String)} or {@link #queryParam(Object)} first.
     *
     * @param typeName 缓存类型。/ The cache type.
     * @param params   有序参数。/ The ordered params.
     * @return 拼接后的 Key。/ The joined key.
     * @throws InvalidCacheKeyException 如果任一部分不合法。/ if any component is invalid.
     */
    public static String buildKey(String typeName, String... params) {
        if (StringUtils.isBlank(typeName)) {
            throw new InvalidCacheKeyException("Cache type name must not be blank");
        }
        if (StringUtils.contains(typeName, KEY_DELIMITER_CHAR)) {
            throw new InvalidCacheKeyException("Cache type name '" + typeName + "' contains the reserved delimiter '" + KEY_DELIMITER + "'");
        }
        if (params == null || params.length == 0) {
            return typeName;
        }
        StringBuilder key = new StringBuilder(typeName);
        for (int i = 0; i < params.length; i++) {
            String param = params[i];
            if (param == null) {
                throw new InvalidCacheKeyException("Param #" + i + " of cache type '" + typeName + "' is null");
            }
            if (param.indexOf(KEY_DELIMITER_CHAR) >= 0) {
                throw new InvalidCacheKeyException("Param #" + i + " of cache type '" + typeName
                        + "' contains the reserved delimiter '" + KEY_DELIMITER + "': " + param);
            }
            key.append(KEY_DELIMITER_CHAR).append(param);
        }
        return key.toString();
    }

    /**
     * 构建 (类型, 用户, 学校) 作用域键，它同时是该作用域下所有键的前缀。
     * <p>
     * Builds the (type, user, school) scope key, which is also the prefix of every key in that scope.
     */
    public static String scopeKey(String typeName, String userId, String schoolId) {
        return buildKey(typeName, userId, schoolId);
    }

    /**
     * 转义一段任意文本，使其可以安全地作为参数使用。
     * <p>
     * Escapes arbitrary text so it can be used safely as a param.
     *
     * @param raw 原始文本。/ The raw text.
     * @return 转义后的文本，{@code %} 变为 {@code %25}，{@code :} 变为 {@code %3A}。/ The escaped text.
     */
    public static String escape(String raw) {
        if (raw == null) {
            throw new InvalidCacheKeyException("Cannot escape a null param");
        }
        return StringUtils.replaceEach(raw, ESCAPE_SEARCH, ESCAPE_REPLACE);
    }

    /**
     * 将查询/过滤对象序列化为稳定的 JSON 并转义，作为键的最后一段。
     * null 序列化为 {@code null}，与空对象 {@code {}} 产生不同的键。
     * <p>
     * Serializes a query/filter object into canonical JSON and escapes it, for use as the last key segment.
     * null serializes as {@code null}, so an absent filter and an empty one never share a key.
     *
     * @param filter 查询对象（Map、POJO 等）。/ The query object (Map, POJO, ...).
     * @return 可用作参数的文本。/ Text usable as a param.
     */
    public static String queryParam(Object filter) {
        if (filter == null) {
            return NULL_QUERY;
        }
        try {
            return escape(QUERY_MAPPER.writeValueAsString(filter));
        } catch (JsonProcessingException e) {
            throw new InvalidCacheKeyException("Could not serialize query param of type " + filter.getClass().getName(), e);
        }
    }

    /**
     * 从缓存键中解析类型名（第一个分隔符之前的部分）。
     * <p>
     * Parses the type name (the part before the first delimiter) out of a cache key.
     */
    public static String typeOf(String key) {
        return StringUtils.substringBefore(key, KEY_DELIMITER);
    }

    /**
     * 将缓存键拆分为各段，保留空段。
     * <p>
     * Splits a cache key into its segments, keeping empty ones.
     */
    public static String[] segments(String key) {
        return StringUtils.splitPreserveAllTokens(key, KEY_DELIMITER_CHAR);
    }
}
