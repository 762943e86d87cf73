package io.github.vevoly.jdepcache.core.internal;

import io.github.vevoly.jdepcache.api.JDepCache;
import io.github.vevoly.jdepcache.api.backend.CacheBackend;
import io.github.vevoly.jdepcache.api.constants.JDepCacheConstants;
import io.github.vevoly.jdepcache.api.dependency.Dependency;
import io.github.vevoly.jdepcache.api.exception.InvalidCacheConfigException;
import io.github.vevoly.jdepcache.api.exception.SetCacheException;
import io.github.vevoly.jdepcache.core.utils.CacheKeyNormalizer;
import io.github.vevoly.jdepcache.core.utils.I18nLogger;
import io.github.vevoly.jdepcache.core.wrap.CacheEntry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.lang3.CharUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * {@link JDepCache} 接口的核心实现类。
 * <p>
 * 此类是外部 {@link CacheBackend} 的装饰器，负责：
 * 1. 将原始 Key 归一化为后端安全的 Key，并加上前缀。
 * 2. 解析 TTL：调用方显式 TTL > 默认 TTL > 永不过期。
 * 3. 写入时将值与已计算的依赖一起包装为 {@link CacheEntry}；读取时检查依赖是否变化并解包。
 * 4. 批量操作中维护归一化 Key 与原始 Key 的映射。
 * <p>
 * The core implementation of the {@link JDepCache} interface.
 * This class decorates an external {@link CacheBackend} and is responsible for:
 * 1. Normalizing raw keys into prefixed, backend-safe keys.
 * 2. Resolving TTLs: explicit TTL > default TTL > no expiry.
 * 3. Wrapping values together with their evaluated dependency into a {@link CacheEntry} on write; checking the dependency and unwrapping on read.
 * 4. Keeping the mapping between normalized and raw keys in batch operations.
 * <p>
 * The instance holds no per-call state and performs no locking: concurrent writers race at the backend.
 *
 * @author vevoly
 */
@Slf4j
public class JDepCacheImpl implements JDepCache {

    private final CacheBackend backend;
    private final CacheKeyNormalizer keyNormalizer;

    private String keyPrefix = JDepCacheConstants.DEFAULT_KEY_PREFIX;
    private boolean keyNormalization = true;
    private Duration defaultTtl;

    private final I18nLogger i18nLog = new I18nLogger(log);

    public JDepCacheImpl(CacheBackend backend) {
        this(backend, new CacheKeyNormalizer());
    }

    public JDepCacheImpl(CacheBackend backend, CacheKeyNormalizer keyNormalizer) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.keyNormalizer = Objects.requireNonNull(keyNormalizer, "keyNormalizer must not be null");
        i18nLog.info("cache.init", backend.getClass().getSimpleName());
    }

    // ===================================================================
    // ======== 单点操作 / Single Item Operations =========================
    // ===================================================================

    @Override
    @SuppressWarnings("unchecked")
    public <T> T get(Object key, T defaultValue) {
        String builtKey = buildKey(key);
        Object stored = backend.get(builtKey, defaultValue);
        return (T) getValueOrDefaultIfDependencyChanged(builtKey, stored, defaultValue);
    }

    @Override
    public boolean has(Object key) {
        return backend.has(buildKey(key));
    }

    @Override
    public boolean set(Object key, Object value, Duration ttl, Dependency dependency) {
        String builtKey = buildKey(key);
        CacheEntry entry = addEvaluatedDependencyToValue(value, dependency);
        return backend.set(builtKey, entry, normalizeTtl(ttl));
    }

    @Override
    public boolean add(Object key, Object value, Duration ttl, Dependency dependency) {
        String builtKey = buildKey(key);
        if (backend.has(builtKey)) {
            return false;
        }
        CacheEntry entry = addEvaluatedDependencyToValue(value, dependency);
        return backend.set(builtKey, entry, normalizeTtl(ttl));
    }

    @Override
    public boolean delete(Object key) {
        return backend.delete(buildKey(key));
    }

    @Override
    public boolean clear() {
        return backend.clear();
    }

    // ===================================================================
    // ======== 批量操作 / Batch Operations ===============================
    // ===================================================================

    @Override
    public Map<Object, Object> getMultiple(Collection<?> keys, Object defaultValue) {
        if (CollectionUtils.isEmpty(keys)) {
            return Collections.emptyMap();
        }
        Map<String, Object> keyMap = buildKeyMap(keys);
        Map<String, Object> values = backend.getMultiple(keyMap.keySet(), defaultValue);
        return restoreKeysAndUnwrap(values, keyMap, defaultValue);
    }

    @Override
    public boolean setMultiple(Map<?, ?> values, Duration ttl, Dependency dependency) {
        Map<String, Object> data = prepareDataForSetOrAddMultiple(values, dependency);
        return backend.setMultiple(data, normalizeTtl(ttl));
    }

    @Override
    public boolean addMultiple(Map<?, ?> values, Duration ttl, Dependency dependency) {
        Map<String, Object> data = prepareDataForSetOrAddMultiple(values, dependency);
        data = excludeExistingValues(data);
        return backend.setMultiple(data, normalizeTtl(ttl));
    }

    @Override
    public boolean deleteMultiple(Collection<?> keys) {
        if (CollectionUtils.isEmpty(keys)) {
            return backend.deleteMultiple(Collections.emptyList());
        }
        return backend.deleteMultiple(buildKeyMap(keys).keySet());
    }

    // ===================================================================
    // ======== 组合操作 / Composite Operations ===========================
    // ===================================================================

    @Override
    public <T> T getOrSet(Object key, Function<? super JDepCache, ? extends T> callable, Duration ttl, Dependency dependency) {
        T value = get(key);
        if (value != null) {
            return value;
        }
        value = callable.apply(this);
        if (!set(key, value, ttl, dependency)) {
            i18nLog.warn("cache.set_failed", key);
            throw new SetCacheException(key, value, this);
        }
        return value;
    }

    // ===================================================================
    // ======== 配置 / Configuration ======================================
    // ===================================================================

    /**
     * 构建带前缀的后端 Key。
     * <p>
     * 开启归一化时：仅由字母数字组成且不超过 32 字节的字符串/整数原样保留，其他 Key 取 MD5；
     * 关闭归一化时：字符串/整数原样保留，组合 Key 使用其规范 JSON。
     * <p>
     * Builds the prefixed backend key.
     * With normalization on, alphanumeric strings and integers of at most 32 bytes are kept as-is and any other key becomes its MD5;
     * with normalization off, strings and integers are kept as-is and composite keys become their canonical JSON.
     */
    @Override
    public String buildKey(Object key) {
        String normalizedKey = keyNormalization ? keyNormalizer.normalize(key) : keyNormalizer.stringify(key);
        return keyPrefix + normalizedKey;
    }

    @Override
    public void setKeyPrefix(String keyPrefix) {
        if (!isValidKeyPrefix(keyPrefix)) {
            throw new InvalidCacheConfigException("Cache key prefix should contain only letters, digits and underscores: " + keyPrefix);
        }
        this.keyPrefix = keyPrefix;
        i18nLog.info("cache.key_prefix_changed", keyPrefix);
    }

    @Override
    public String getKeyPrefix() {
        return keyPrefix;
    }

    @Override
    public void enableKeyNormalization() {
        this.keyNormalization = true;
        i18nLog.info("cache.key_normalization", true);
    }

    @Override
    public void disableKeyNormalization() {
        this.keyNormalization = false;
        i18nLog.info("cache.key_normalization", false);
    }

    @Override
    public boolean isKeyNormalizationEnabled() {
        return keyNormalization;
    }

    @Override
    public void setDefaultTtl(Duration defaultTtl) {
        this.defaultTtl = defaultTtl == null ? null : toSeconds(defaultTtl);
        i18nLog.info("cache.default_ttl_changed", this.defaultTtl);
    }

    @Override
    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    /**
     * 解析最终生效的 TTL。null 使用默认 TTL (默认 TTL 也为 null 时表示永不过期)，
     * 其他值按相对时长换算为整秒，零或负数原样交给后端。
     * <p>
     * Resolves the effective TTL. null falls back to the default TTL (null again meaning no expiry);
     * any other value is a relative span truncated to whole seconds, zero or negative values are passed to the backend as-is.
     */
    protected Duration normalizeTtl(Duration ttl) {
        if (ttl == null) {
            return defaultTtl;
        }
        return toSeconds(ttl);
    }

    // ===================================================================
    // ======== 内部辅助 / Internal Helpers ===============================
    // ===================================================================

    private static Duration toSeconds(Duration ttl) {
        return Duration.ofSeconds(Instant.EPOCH.plus(ttl).getEpochSecond());
    }

    private static boolean isValidKeyPrefix(String keyPrefix) {
        if (keyPrefix == null) {
            return false;
        }
        for (int i = 0; i < keyPrefix.length(); i++) {
            char c = keyPrefix.charAt(i);
            if (!CharUtils.isAsciiAlphanumeric(c) && c != '_') {
                return false;
            }
        }
        return true;
    }

    /**
     * 如果依赖不为 null 且尚未计算，则先计算依赖，再与值一起包装为存储条目。
     * <p>
     * Evaluates the dependency if present and not evaluated yet, then wraps it with the value.
     */
    private CacheEntry addEvaluatedDependencyToValue(Object value, Dependency dependency) {
        if (dependency != null && !dependency.isEvaluated()) {
            dependency.evaluateDependency(this);
        }
        return CacheEntry.of(value, dependency);
    }

    /**
     * 依赖未变化时返回解包后的值，否则返回默认值。非 {@link CacheEntry} 对象原样返回。
     * <p>
     * Returns the unwrapped value if the dependency has not changed, the default otherwise. Objects that are not a {@link CacheEntry} are returned as-is.
     */
    private Object getValueOrDefaultIfDependencyChanged(String builtKey, Object stored, Object defaultValue) {
        if (!(stored instanceof CacheEntry entry)) {
            return stored;
        }
        if (entry.isDependencyChanged(this)) {
            i18nLog.debug("cache.dependency_changed", builtKey);
            return defaultValue;
        }
        return entry.getValue();
    }

    private Map<String, Object> prepareDataForSetOrAddMultiple(Map<?, ?> values, Dependency dependency) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (MapUtils.isEmpty(values)) {
            return data;
        }
        for (Map.Entry<?, ?> entry : values.entrySet()) {
            data.put(buildKey(entry.getKey()), addEvaluatedDependencyToValue(entry.getValue(), dependency));
        }
        return data;
    }

    /**
     * 查询后端中已存在的条目，只保留尚不存在的条目。
     * <p>
     * Looks up the entries already in the backend and keeps only the absent ones.
     */
    private Map<String, Object> excludeExistingValues(Map<String, Object> data) {
        if (data.isEmpty()) {
            return data;
        }
        Map<String, Object> existingValues = backend.getMultiple(data.keySet(), null);
        int skipped = 0;
        for (Map.Entry<String, Object> existing : existingValues.entrySet()) {
            if (existing.getValue() != null && data.remove(existing.getKey()) != null) {
                skipped++;
            }
        }
        if (skipped > 0) {
            i18nLog.debug("cache.add_skipped", skipped);
        }
        return data;
    }

    /**
     * 构建 {@code 归一化 Key -> 原始 Key} 的映射。两个原始 Key 归一化结果相同时，后者覆盖前者。
     * <p>
     * Builds the {@code normalized key -> raw key} map. When two raw keys normalize identically, the last one wins.
     */
    private Map<String, Object> buildKeyMap(Collection<?> keys) {
        Map<String, Object> keyMap = new LinkedHashMap<>();
        for (Object key : keys) {
            keyMap.put(buildKey(key), key);
        }
        return keyMap;
    }

    /**
     * 将后端返回的结果还原为原始 Key，并逐条解包。不在映射中的后端 Key 原样保留。
     * <p>
     * Restores raw keys on the backend result and unwraps every entry. Backend keys missing from the map are kept as they are.
     */
    private Map<Object, Object> restoreKeysAndUnwrap(Map<String, Object> values, Map<String, Object> keyMap, Object defaultValue) {
        Map<Object, Object> results = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            String builtKey = entry.getKey();
            Object restoredKey = keyMap.containsKey(builtKey) ? keyMap.get(builtKey) : builtKey;
            results.put(restoredKey, getValueOrDefaultIfDependencyChanged(builtKey, entry.getValue(), defaultValue));
        }
        return results;
    }
}
