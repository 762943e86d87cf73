package io.github.vevoly.jdepcache.core.backend;

import io.github.vevoly.jdepcache.api.backend.CacheBackend;
import io.github.vevoly.jdepcache.core.utils.I18nLogger;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.lang3.StringUtils;
import org.redisson.api.BatchOptions;
import org.redisson.api.RBatch;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.Codec;
import org.redisson.codec.SerializationCodec;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link CacheBackend} 基于 Redisson 的 Redis 实现。
 * <p>
 * 条目通过 {@link Codec} 序列化后存储在 Redis String 中，默认使用 Java 序列化 ({@link SerializationCodec})，
 * 因此缓存值与依赖都需要实现 {@link java.io.Serializable}。
 * <p>
 * A Redis implementation of {@link CacheBackend} based on Redisson.
 * Entries are stored in Redis strings through a {@link Codec}, Java serialization ({@link SerializationCodec}) by default,
 * so cached values and dependencies must implement {@link java.io.Serializable}.
 *
 * @author vevoly
 */
@Slf4j
public class RedissonCacheBackend implements CacheBackend {

    private final RedissonClient redisson;
    private final Codec codec;
    private final String namespacePattern;

    private final I18nLogger i18nLog = new I18nLogger(log);

    public RedissonCacheBackend(RedissonClient redisson) {
        this(redisson, new SerializationCodec(), null);
    }

    /**
     * @param redisson         Redisson 客户端。/ The Redisson client.
     * @param codec            值的编解码器。/ The value codec.
     * @param namespacePattern {@link #clear()} 删除的 Key 模式 (如 {@code app_*})，为空时清空整个数据库。/
     *                         The key pattern deleted by {@link #clear()} (e.g. {@code app_*}); blank means flushing the whole database.
     */
    public RedissonCacheBackend(RedissonClient redisson, Codec codec, String namespacePattern) {
        this.redisson = redisson;
        this.codec = codec;
        this.namespacePattern = namespacePattern;
        i18nLog.info("redis.init", namespacePattern);
    }

    @Override
    public Object get(String key, Object defaultValue) {
        Object value = bucket(key).get();
        return value == null ? defaultValue : value;
    }

    @Override
    public boolean has(String key) {
        return bucket(key).isExists();
    }

    @Override
    public boolean set(String key, Object value, Duration ttl) {
        if (value == null || isExpiredOnArrival(ttl)) {
            // Redisson 不能存储 null；零或负数 TTL 视为删除 / Redisson cannot store null; zero or negative TTL means delete
            bucket(key).delete();
            return true;
        }
        RBucket<Object> bucket = bucket(key);
        if (ttl != null) {
            bucket.set(value, ttl);
        } else {
            bucket.set(value);
        }
        return true;
    }

    @Override
    public boolean delete(String key) {
        bucket(key).delete();
        return true;
    }

    @Override
    public boolean clear() {
        if (StringUtils.isBlank(namespacePattern)) {
            i18nLog.warn("redis.flushdb");
            redisson.getKeys().flushdb();
        } else {
            redisson.getKeys().deleteByPattern(namespacePattern);
        }
        return true;
    }

    @Override
    public Map<String, Object> getMultiple(Collection<String> keys, Object defaultValue) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (CollectionUtils.isEmpty(keys)) {
            return result;
        }
        Map<String, Object> found = redisson.getBuckets(codec).get(keys.toArray(new String[0]));
        for (String key : keys) {
            Object value = found.get(key);
            result.put(key, value == null ? defaultValue : value);
        }
        return result;
    }

    @Override
    public boolean setMultiple(Map<String, Object> values, Duration ttl) {
        if (MapUtils.isEmpty(values)) {
            return true;
        }
        if (isExpiredOnArrival(ttl)) {
            return deleteMultiple(values.keySet());
        }
        RBatch batch = redisson.createBatch(BatchOptions.defaults());
        values.forEach((key, value) -> {
            if (value == null) {
                batch.getBucket(key, codec).deleteAsync();
            } else if (ttl != null) {
                batch.getBucket(key, codec).setAsync(value, ttl);
            } else {
                batch.getBucket(key, codec).setAsync(value);
            }
        });
        batch.execute();
        return true;
    }

    @Override
    public boolean deleteMultiple(Collection<String> keys) {
        if (CollectionUtils.isNotEmpty(keys)) {
            redisson.getKeys().delete(keys.toArray(new String[0]));
        }
        return true;
    }

    private RBucket<Object> bucket(String key) {
        return redisson.getBucket(key, codec);
    }

    private static boolean isExpiredOnArrival(Duration ttl) {
        return ttl != null && (ttl.isZero() || ttl.isNegative());
    }
}
