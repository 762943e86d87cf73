package io.github.vevoly.jdepcache.core.backend;

import io.github.vevoly.jdepcache.api.backend.CacheBackend;
import io.github.vevoly.jdepcache.core.utils.I18nLogger;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * 降级实现（当缓存被关闭时使用）。
 * 不存储任何数据：所有读取都未命中，所有写入都报告成功。
 * <p>
 * Fallback implementation used when caching is switched off.
 * Stores nothing: every read misses and every write reports success.
 *
 * @author vevoly
 */
@Slf4j
public class NoOpCacheBackend implements CacheBackend {

    private final I18nLogger i18nLog = new I18nLogger(log);

    public NoOpCacheBackend() {
        i18nLog.warn("noop.init");
    }

    @Override
    public Object get(String key, Object defaultValue) {
        return defaultValue;
    }

    @Override
    public boolean has(String key) {
        return false;
    }

    @Override
    public boolean set(String key, Object value, Duration ttl) {
        return true;
    }

    @Override
    public boolean delete(String key) {
        return true;
    }

    @Override
    public boolean clear() {
        return true;
    }
}
