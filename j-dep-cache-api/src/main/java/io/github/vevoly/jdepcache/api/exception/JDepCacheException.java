package io.github.vevoly.jdepcache.api.exception;

/**
 * JDepCache 所有异常的基类。
 * <p>
 * Base class of every exception raised by JDepCache. Backend exceptions are never wrapped in it.
 *
 * @author vevoly
 */
public class JDepCacheException extends RuntimeException {

    public JDepCacheException(String message) {
        super(message);
    }

    public JDepCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
