package io.github.vevoly.jdepcache.api.exception;

/**
 * 当缓存配置不合法时抛出，例如 Key 前缀包含不允许的字符。
 * <p>
 * Thrown when the cache configuration is invalid, e.g. a key prefix with disallowed characters.
 *
 * @author vevoly
 */
public class InvalidCacheConfigException extends JDepCacheException {

    public InvalidCacheConfigException(String message) {
        super(message);
    }
}
