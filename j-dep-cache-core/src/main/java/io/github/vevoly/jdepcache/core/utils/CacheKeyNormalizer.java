package io.github.vevoly.jdepcache.core.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.github.vevoly.jdepcache.api.constants.JDepCacheConstants;
import io.github.vevoly.jdepcache.api.exception.InvalidCacheKeyException;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.CharUtils;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * 缓存 Key 归一化器。
 * <p>
 * 将任意原始 Key 转换为后端安全的字符串：
 * 1. 字符串和整数：仅由 ASCII 字母数字组成且不超过 32 字节时原样返回，否则返回其 MD5。
 * 2. 其他结构 (Map, List, 对象等)：序列化为规范 JSON (Key 有序) 后返回其 MD5。
 * <p>
 * Converts arbitrary raw keys into backend-safe strings:
 * 1. Strings and integers: returned unchanged when made of ASCII letters and digits only and at most 32 bytes long, otherwise their MD5.
 * 2. Any other structure (maps, lists, beans...): serialized to canonical JSON (ordered keys), then hashed with MD5.
 * <p>
 * Distinct raw keys collide only if their MD5 digests do; that risk is accepted.
 *
 * @author vevoly
 */
public class CacheKeyNormalizer {

    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .build();

    /**
     * 归一化一个原始 Key。
     * <p>
     * Normalizes a raw key.
     *
     * @param key 原始 Key。/ The raw key.
     * @return 归一化后的 Key。/ The normalized key.
     * @throws InvalidCacheKeyException 如果 Key 为 null 或无法被序列化。/ if the key is null or cannot be serialized.
     */
    public String normalize(Object key) {
        if (isScalar(key)) {
            String stringKey = key.toString();
            return isPlainKey(stringKey) ? stringKey : DigestUtils.md5Hex(stringKey);
        }
        return DigestUtils.md5Hex(serialize(key));
    }

    /**
     * 在关闭归一化时使用：字符串和整数直接转为字符串，其他结构转为规范 JSON，不做哈希。
     * <p>
     * Used when normalization is disabled: strings and integers become their string form, other structures their canonical JSON, without hashing.
     */
    public String stringify(Object key) {
        return isScalar(key) ? key.toString() : serialize(key);
    }

    /**
     * 将 Key 序列化为规范 JSON 文本。Map 按 Key 排序，对象属性按字母排序。
     * <p>
     * Serializes a key to canonical JSON text. Map entries are ordered by key and bean properties alphabetically.
     *
     * @throws InvalidCacheKeyException 如果无法序列化 (例如循环引用或不可序列化的值)。/ if the key cannot be serialized (e.g. a cycle or a non-serializable value).
     */
    public String serialize(Object key) {
        if (key == null) {
            throw new InvalidCacheKeyException("Invalid key. Cache key must not be null.");
        }
        try {
            return CANONICAL_MAPPER.writeValueAsString(key);
        } catch (JsonProcessingException | IllegalArgumentException | ClassCastException e) {
            // ClassCastException: map keys of mixed types cannot be ordered
            throw new InvalidCacheKeyException("Invalid key. " + e.getMessage(), e);
        }
    }

    private static boolean isScalar(Object key) {
        return key instanceof String
                || key instanceof Integer
                || key instanceof Long
                || key instanceof Short
                || key instanceof Byte
                || key instanceof BigInteger;
    }

    private static boolean isPlainKey(String key) {
        if (key.isEmpty() || key.getBytes(StandardCharsets.UTF_8).length > JDepCacheConstants.MAX_PLAIN_KEY_LENGTH) {
            return false;
        }
        for (int i = 0; i < key.length(); i++) {
            if (!CharUtils.isAsciiAlphanumeric(key.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
