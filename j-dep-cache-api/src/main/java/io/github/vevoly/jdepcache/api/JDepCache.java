package io.github.vevoly.jdepcache.api;

import io.github.vevoly.jdepcache.api.backend.CacheBackend;
import io.github.vevoly.jdepcache.api.dependency.Dependency;
import io.github.vevoly.jdepcache.api.exception.InvalidCacheConfigException;
import io.github.vevoly.jdepcache.api.exception.InvalidCacheKeyException;
import io.github.vevoly.jdepcache.api.exception.SetCacheException;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.function.Function;

/**
 * JDepCache 核心 API 接口。
 * 在一个外部提供的 {@link CacheBackend} 之上提供 Key 归一化、TTL 处理以及基于 {@link Dependency} 的失效能力。
 * <p>
 * The core API interface for JDepCache.
 * Adds key normalization, TTL shaping and {@link Dependency}-based invalidation on top of an externally supplied {@link CacheBackend}.
 * <p>
 * Typical usage:
 * <pre>{@code
 * List<Product> top = cache.getOrSet(List.of("top-n-products", count),
 *         c -> productRepository.findTop(count),
 *         Duration.ofMinutes(10),
 *         new TagDependency("products"));
 * }</pre>
 * <p>
 * Keys may be strings, integers or composite structures (maps, lists, beans). Every operation is synchronous
 * and performs no locking: {@link #add} is check-then-act and {@link #getOrSet} performs no single-flight suppression.
 *
 * @author vevoly
 */
public interface JDepCache {

    // =================================================================
    // ======================== 单点操作 / Single Item Operations =======
    // =================================================================

    /**
     * 获取单个缓存值，未命中返回 null。
     * <p>
     * Fetches a single cached value, or {@code null} on a miss.
     *
     * @param key 原始 Key。/ The raw key.
     * @param <T> 值的类型。/ The type of the value.
     * @return 缓存值或 null。/ The cached value, or null.
     * @throws InvalidCacheKeyException 如果 Key 无法被序列化。/ if the key cannot be serialized.
     */
    default <T> T get(Object key) {
        return get(key, null);
    }

    /**
     * 获取单个缓存值。若值不存在、已过期或其依赖已变化，则返回 {@code defaultValue}。
     * <p>
     * Fetches a single cached value. Returns {@code defaultValue} if the value is absent, expired, or its dependency has changed.
     *
     * @param key          原始 Key。/ The raw key.
     * @param defaultValue 未命中时返回的默认值。/ The value returned on a miss.
     * @param <T>          值的类型。/ The type of the value.
     * @return 缓存值或默认值。/ The cached value, or the default.
     */
    <T> T get(Object key, T defaultValue);

    /**
     * 检查后端是否存在该 Key。
     * 注意：此方法不检查依赖是否变化，一个依赖已失效但仍存在的条目会返回 {@code true}。
     * <p>
     * Checks whether the backend holds an entry for the key.
     * Note: dependency staleness is not consulted; a present entry whose dependency has changed still reports {@code true}.
     *
     * @param key 原始 Key。/ The raw key.
     * @return {@code true} 如果后端存在该条目。/ {@code true} if the backend holds the entry.
     */
    boolean has(Object key);

    /**
     * 存储一个值，使用默认 TTL。
     * <p>
     * Stores a value using the default TTL.
     */
    default boolean set(Object key, Object value) {
        return set(key, value, null, null);
    }

    /**
     * 存储一个值。
     * <p>
     * Stores a value.
     */
    default boolean set(Object key, Object value, Duration ttl) {
        return set(key, value, ttl, null);
    }

    /**
     * 存储一个值。如果已存在同名 Key，则值与过期时间都会被覆盖。
     * <p>
     * Stores a value. An existing entry with the same key has its value and expiration replaced.
     *
     * @param key        原始 Key。/ The raw key.
     * @param value      要缓存的值。/ The value to cache.
     * @param ttl        过期时间，null 表示使用默认 TTL。按整秒截断，因此小于 1 秒的正数 TTL 变为 0，条目会被删除而不是写入。/
     *                   The TTL, null meaning the default TTL. Truncated to whole seconds, so a positive TTL below one second
     *                   becomes 0 and the entry is deleted instead of stored.
     * @param dependency 可选的依赖。依赖变化后，该值在读取时被视为不存在。/ Optional dependency. Once it changes, the value reads as absent.
     * @return 后端是否写入成功。/ Whether the backend reported success.
     */
    boolean set(Object key, Object value, Duration ttl, Dependency dependency);

    /**
     * 仅当 Key 不存在时存储一个值。
     * <p>
     * Stores a value only if the key is not present yet.
     */
    default boolean add(Object key, Object value) {
        return add(key, value, null, null);
    }

    /**
     * 仅当 Key 不存在时存储一个值。
     * <p>
     * Stores a value only if the key is not present yet.
     */
    default boolean add(Object key, Object value, Duration ttl) {
        return add(key, value, ttl, null);
    }

    /**
     * 仅当 Key 不存在时存储一个值。该操作是“先检查后写入”，并非原子操作。
     * <p>
     * Stores a value only if the key is not present yet. This is check-then-act and not atomic against concurrent writers.
     *
     * @param ttl 过期时间，规则同 {@link #set(Object, Object, Duration, Dependency)}，小于 1 秒会截断为 0。/
     *            The TTL, resolved as for {@link #set(Object, Object, Duration, Dependency)}; below one second it truncates to 0.
     * @return {@code false} 如果 Key 已存在，否则为后端写入结果。/ {@code false} if the key exists, otherwise the backend write result.
     */
    boolean add(Object key, Object value, Duration ttl, Dependency dependency);

    /**
     * 删除单个缓存项。
     * <p>
     * Deletes a single entry.
     *
     * @param key 原始 Key。/ The raw key.
     * @return 后端删除结果。/ The backend result.
     */
    boolean delete(Object key);

    /**
     * 清空整个后端。如果后端被多个应用共享，请谨慎使用。
     * <p>
     * Clears the whole backend. Be careful when the backend is shared among applications.
     */
    boolean clear();

    // =================================================================
    // ======================== 批量操作 / Batch Operations =============
    // =================================================================

    /**
     * 批量获取，未命中的 Key 对应 null。
     * <p>
     * Fetches several values at once; misses map to {@code null}.
     */
    default Map<Object, Object> getMultiple(Collection<?> keys) {
        return getMultiple(keys, null);
    }

    /**
     * 批量获取。返回的 Map 以调用方传入的原始 Key 为键。
     * <p>
     * Fetches several values with a single backend call. The returned map is keyed by the caller's raw keys.
     *
     * @param keys         原始 Key 集合。/ The raw keys.
     * @param defaultValue 未命中或依赖已变化时的默认值。/ The value used for misses and changed dependencies.
     * @return 原始 Key 到值的映射。/ A map from raw key to value.
     */
    Map<Object, Object> getMultiple(Collection<?> keys, Object defaultValue);

    default boolean setMultiple(Map<?, ?> values) {
        return setMultiple(values, null, null);
    }

    default boolean setMultiple(Map<?, ?> values, Duration ttl) {
        return setMultiple(values, ttl, null);
    }

    /**
     * 批量存储。所有条目共用同一个 TTL 和同一个依赖，依赖最多只会被计算一次。
     * <p>
     * Stores several values with a single backend call. All entries share the TTL and the dependency; the dependency is evaluated at most once.
     *
     * @param values     原始 Key 到值的映射。/ A map from raw key to value.
     * @param ttl        统一的过期时间，规则同 {@link #set(Object, Object, Duration, Dependency)}，小于 1 秒会截断为 0。/
     *                   The uniform TTL, resolved as for {@link #set(Object, Object, Duration, Dependency)}; below one second it truncates to 0.
     * @param dependency 可选的共享依赖。/ Optional shared dependency.
     * @return 后端批量写入结果。/ The backend batch result.
     */
    boolean setMultiple(Map<?, ?> values, Duration ttl, Dependency dependency);

    default boolean addMultiple(Map<?, ?> values) {
        return addMultiple(values, null, null);
    }

    default boolean addMultiple(Map<?, ?> values, Duration ttl) {
        return addMultiple(values, ttl, null);
    }

    /**
     * 批量存储后端中尚不存在的条目。已存在的条目被静默跳过，不会单独报告失败。
     * <p>
     * Stores the entries that are not present in the backend yet. Present entries are silently skipped and not reported.
     *
     * @param ttl 统一的过期时间，小于 1 秒会截断为 0。/ The uniform TTL; below one second it truncates to 0.
     * @return 对剩余条目执行的批量写入结果。/ The batch write result for the remaining entries.
     */
    boolean addMultiple(Map<?, ?> values, Duration ttl, Dependency dependency);

    /**
     * 批量删除。
     * <p>
     * Deletes several entries with a single backend call.
     */
    boolean deleteMultiple(Collection<?> keys);

    // =================================================================
    // ======================== 组合操作 / Composite Operations =========
    // =================================================================

    default <T> T getOrSet(Object key, Function<? super JDepCache, ? extends T> callable) {
        return getOrSet(key, callable, null, null);
    }

    default <T> T getOrSet(Object key, Function<? super JDepCache, ? extends T> callable, Duration ttl) {
        return getOrSet(key, callable, ttl, null);
    }

    /**
     * 获取缓存值；未命中时执行 {@code callable} 计算并回填。
     * {@code callable} 接收当前缓存实例，因此可以在其中递归使用缓存。并发调用可能多次执行 {@code callable}。
     * <p>
     * Returns the cached value; on a miss, computes it with {@code callable} and stores the result.
     * {@code callable} receives this cache so it can use the cache recursively. Concurrent callers may each run {@code callable}.
     *
     * @param key        原始 Key。/ The raw key.
     * @param callable   值的计算函数。/ The function computing the value.
     * @param ttl        过期时间。/ The TTL.
     * @param dependency 可选的依赖。/ Optional dependency.
     * @param <T>        值的类型。/ The type of the value.
     * @return 缓存值或新计算的值。/ The cached or freshly computed value.
     * @throws SetCacheException 如果回填失败。/ if storing the computed value fails.
     */
    <T> T getOrSet(Object key, Function<? super JDepCache, ? extends T> callable, Duration ttl, Dependency dependency);

    // =================================================================
    // ======================== 配置 / Configuration ====================
    // =================================================================

    /**
     * 计算原始 Key 在后端中的最终 Key（含前缀）。
     * <p>
     * Computes the final backend key (prefix included) for a raw key.
     */
    String buildKey(Object key);

    /**
     * 设置 Key 前缀，仅允许字母、数字和下划线。
     * <p>
     * Sets the key prefix. Only ASCII letters, digits and underscores are accepted.
     *
     * @throws InvalidCacheConfigException 如果前缀不合法。/ if the prefix is invalid.
     */
    void setKeyPrefix(String keyPrefix);

    String getKeyPrefix();

    void enableKeyNormalization();

    void disableKeyNormalization();

    boolean isKeyNormalizationEnabled();

    /**
     * 设置默认 TTL，null 表示永不过期。
     * <p>
     * Sets the default TTL, null meaning no expiry.
     */
    void setDefaultTtl(Duration defaultTtl);

    Duration getDefaultTtl();
}
