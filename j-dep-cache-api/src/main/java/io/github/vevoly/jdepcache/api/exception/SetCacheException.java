package io.github.vevoly.jdepcache.api.exception;

import io.github.vevoly.jdepcache.api.JDepCache;
import lombok.Getter;

/**
 * 当 {@link JDepCache#getOrSet} 计算出值后回填失败时抛出。
 * 异常携带原始 Key、已计算的值以及缓存实例，调用方可以据此重试或直接使用该值。
 * <p>
 * Thrown when {@link JDepCache#getOrSet} computed a value but failed to store it.
 * Carries the raw key, the computed value and the cache so that callers can retry or use the value anyway.
 *
 * @author vevoly
 */
@Getter
public class SetCacheException extends JDepCacheException {

    private final transient Object key;
    private final transient Object value;
    private final transient JDepCache cache;

    public SetCacheException(Object key, Object value, JDepCache cache) {
        super("Failed to store value in cache for key: " + key);
        this.key = key;
        this.value = value;
        this.cache = cache;
    }
}
