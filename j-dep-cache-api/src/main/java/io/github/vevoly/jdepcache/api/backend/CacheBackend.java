package io.github.vevoly.jdepcache.api.backend;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JDepCache 所依赖的底层键值存储接口。
 * <p>
 * 该接口只描述原始存储能力，不包含任何 Key 归一化或依赖语义。
 * 框架的所有组件都应依赖此接口，而不是具体的实现。批量方法提供了基于单 Key 方法的默认实现，
 * 支持原生批量操作的后端应覆盖它们。
 * <p>
 * The raw key-value store consumed by JDepCache.
 * This interface describes plain storage only, without key normalization or dependency semantics.
 * All components should depend on this interface rather than a specific implementation. The batch methods
 * default to loops over the single-key methods; backends with native batching should override them.
 *
 * @author vevoly
 */
public interface CacheBackend {

    // ===================================================================
    // ======================== 单 Key 操作 / Single Key Operations =======
    // ===================================================================

    /**
     * 获取指定 key 的值。
     * <p>
     * Gets the value of a key.
     *
     * @param key          键 / the key
     * @param defaultValue key 不存在或已过期时返回的值 / the value returned when the key is absent or expired
     * @return 存储的值或默认值 / the stored value or the default
     */
    Object get(String key, Object defaultValue);

    /**
     * 检查给定的 key 是否存在。
     * <p>
     * Checks if a given key exists.
     *
     * @param key 键 / the key
     * @return {@code true} 如果 key 存在 / {@code true} if the key exists
     */
    boolean has(String key);

    /**
     * 设置 key 的值。
     * <p>
     * Sets the value of a key.
     *
     * @param key   键 / the key
     * @param value 值 / the value
     * @param ttl   过期时间，null 表示永不过期，零或负数表示删除 / the TTL, null meaning infinite, zero or negative meaning delete
     * @return 是否成功 / whether the write succeeded
     */
    boolean set(String key, Object value, Duration ttl);

    /**
     * 删除一个 key。
     * <p>
     * Deletes a key.
     *
     * @param key 键 / the key
     * @return 是否没有发生错误 / whether no error happened
     */
    boolean delete(String key);

    /**
     * 清空所有数据。
     * <p>
     * Removes every entry.
     *
     * @return 是否成功 / whether the flush succeeded
     */
    boolean clear();

    // ===================================================================
    // ======================== 批量操作 / Batch Operations ===============
    // ===================================================================

    /**
     * 批量获取多个 key 的值。
     * <p>
     * Gets the values of multiple keys.
     *
     * @param keys         要查询的 key 集合 / collection of keys to query
     * @param defaultValue 缺失 key 对应的值 / the value used for missing keys
     * @return Key 到值的 Map，每个请求的 key 都会出现 / a map from key to value containing every requested key
     */
    default Map<String, Object> getMultiple(Collection<String> keys, Object defaultValue) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (String key : keys) {
            result.put(key, get(key, defaultValue));
        }
        return result;
    }

    /**
     * 批量设置多个 key-value 对。
     * <p>
     * Sets multiple key-value pairs.
     *
     * @param values 要设置的 key-value Map / a map of key-value pairs to set
     * @param ttl    统一的过期时间 / the uniform TTL for all keys
     * @return 是否全部成功 / whether every write succeeded
     */
    default boolean setMultiple(Map<String, Object> values, Duration ttl) {
        boolean success = true;
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            success = set(entry.getKey(), entry.getValue(), ttl) && success;
        }
        return success;
    }

    /**
     * 批量删除多个 key。
     * <p>
     * Deletes multiple keys.
     *
     * @param keys 要删除的 key 集合 / collection of keys to delete
     * @return 是否全部成功 / whether every delete succeeded
     */
    default boolean deleteMultiple(Collection<String> keys) {
        boolean success = true;
        for (String key : keys) {
            success = delete(key) && success;
        }
        return success;
    }
}
