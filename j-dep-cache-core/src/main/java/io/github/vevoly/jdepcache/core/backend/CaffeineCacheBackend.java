package io.github.vevoly.jdepcache.core.backend;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import io.github.vevoly.jdepcache.api.backend.CacheBackend;
import io.github.vevoly.jdepcache.api.constants.JDepCacheConstants;
import io.github.vevoly.jdepcache.core.utils.I18nLogger;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link CacheBackend} 基于 Caffeine 的进程内实现。
 * <p>
 * 每个条目拥有独立的过期时间 (通过 {@link Expiry} 实现)，容量由 {@code maximumSize} 限制。
 * null 值会被包装存储，因此 {@link #has(String)} 对存储了 null 的 key 也返回 true。
 * <p>
 * An in-process implementation of {@link CacheBackend} based on Caffeine.
 * Every entry carries its own expiration (through an {@link Expiry}); capacity is bounded by {@code maximumSize}.
 * Null values are stored wrapped, so {@link #has(String)} reports true for a key holding null.
 *
 * @author vevoly
 */
@Slf4j
public class CaffeineCacheBackend implements CacheBackend {

    private final Cache<String, ExpiringValue> cache;
    private final I18nLogger i18nLog = new I18nLogger(log);

    public CaffeineCacheBackend() {
        this(JDepCacheConstants.DEFAULT_LOCAL_CACHE_MAX_SIZE);
    }

    public CaffeineCacheBackend(long maximumSize) {
        this(maximumSize, Ticker.systemTicker());
    }

    /**
     * 使用指定的时钟构造后端，主要用于测试过期行为。
     * <p>
     * Constructs the backend with the given ticker, mainly to test expiration.
     *
     * @param maximumSize 最大条目数。/ The maximum number of entries.
     * @param ticker      Caffeine 时钟。/ The Caffeine ticker.
     */
    public CaffeineCacheBackend(long maximumSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new PerEntryExpiry())
                .ticker(ticker)
                .recordStats()
                .build();
        i18nLog.info("caffeine.init", maximumSize);
    }

    @Override
    public Object get(String key, Object defaultValue) {
        ExpiringValue holder = cache.getIfPresent(key);
        return holder == null ? defaultValue : holder.value;
    }

    @Override
    public boolean has(String key) {
        return cache.getIfPresent(key) != null;
    }

    @Override
    public boolean set(String key, Object value, Duration ttl) {
        if (isExpiredOnArrival(ttl)) {
            // 零或负数的 TTL 视为删除 / zero or negative TTL means delete
            cache.invalidate(key);
            return true;
        }
        cache.put(key, new ExpiringValue(value, ttl));
        return true;
    }

    @Override
    public boolean delete(String key) {
        cache.invalidate(key);
        return true;
    }

    @Override
    public boolean clear() {
        cache.invalidateAll();
        return true;
    }

    @Override
    public Map<String, Object> getMultiple(Collection<String> keys, Object defaultValue) {
        Map<String, ExpiringValue> present = cache.getAllPresent(keys);
        Map<String, Object> result = new LinkedHashMap<>();
        for (String key : keys) {
            ExpiringValue holder = present.get(key);
            result.put(key, holder == null ? defaultValue : holder.value);
        }
        return result;
    }

    @Override
    public boolean setMultiple(Map<String, Object> values, Duration ttl) {
        if (isExpiredOnArrival(ttl)) {
            cache.invalidateAll(values.keySet());
            return true;
        }
        Map<String, ExpiringValue> holders = new LinkedHashMap<>();
        values.forEach((key, value) -> holders.put(key, new ExpiringValue(value, ttl)));
        cache.putAll(holders);
        return true;
    }

    @Override
    public boolean deleteMultiple(Collection<String> keys) {
        cache.invalidateAll(keys);
        return true;
    }

    /**
     * 获取统计信息的单行摘要。
     * <p>
     * Returns a one-line summary of the statistics.
     */
    public String getStats() {
        CacheStats stats = cache.stats();
        return String.format(
                "Size: %d | HitRate: %.2f%% | Hits: %d | Misses: %d | Evictions: %d",
                cache.estimatedSize(),
                stats.hitRate() * 100,
                stats.hitCount(),
                stats.missCount(),
                stats.evictionCount()
        );
    }

    private static boolean isExpiredOnArrival(Duration ttl) {
        return ttl != null && (ttl.isZero() || ttl.isNegative());
    }

    /**
     * 值与其 TTL 的组合。
     * <p>
     * A value together with its TTL.
     */
    private static final class ExpiringValue {

        private final Object value;
        private final long ttlNanos;

        private ExpiringValue(Object value, Duration ttl) {
            this.value = value;
            this.ttlNanos = ttl == null ? Long.MAX_VALUE : saturatedNanos(ttl);
        }

        private static long saturatedNanos(Duration ttl) {
            try {
                return ttl.toNanos();
            } catch (ArithmeticException e) {
                return Long.MAX_VALUE;
            }
        }
    }

    private static final class PerEntryExpiry implements Expiry<String, ExpiringValue> {

        @Override
        public long expireAfterCreate(String key, ExpiringValue value, long currentTime) {
            return value.ttlNanos;
        }

        @Override
        public long expireAfterUpdate(String key, ExpiringValue value, long currentTime, long currentDuration) {
            return value.ttlNanos;
        }

        @Override
        public long expireAfterRead(String key, ExpiringValue value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
