package io.github.vevoly.jdepcache.api.exception;

/**
 * 当一个组合 Key 无法被序列化为规范形式时抛出。
 * <p>
 * Thrown when a composite key cannot be serialized into its canonical form.
 *
 * @author vevoly
 */
public class InvalidCacheKeyException extends JDepCacheException {

    public InvalidCacheKeyException(String message) {
        super(message);
    }

    public InvalidCacheKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
