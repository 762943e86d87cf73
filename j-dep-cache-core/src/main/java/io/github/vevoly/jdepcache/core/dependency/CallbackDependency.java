package io.github.vevoly.jdepcache.core.dependency;

import io.github.vevoly.jdepcache.api.JDepCache;
import io.github.vevoly.jdepcache.api.dependency.AbstractDependency;

import java.io.Serializable;
import java.util.Objects;
import java.util.function.Function;

/**
 * 基于回调的依赖：快照为回调函数的返回值。
 * <p>
 * A dependency whose snapshot is the result of a callback.
 * <p>
 * The callback is stored together with the cached value, so it must be serializable for persistent backends
 * (a lambda assigned to {@link DependencyCallback} is).
 *
 * <pre>{@code
 * cache.set("config", config, null, new CallbackDependency(c -> configRepository.version()));
 * }</pre>
 *
 * @author vevoly
 */
public class CallbackDependency extends AbstractDependency {

    private static final long serialVersionUID = 1L;

    private final DependencyCallback callback;

    public CallbackDependency(DependencyCallback callback) {
        this.callback = Objects.requireNonNull(callback, "callback must not be null");
    }

    @Override
    protected Object generateDependencyData(JDepCache cache) {
        return callback.apply(cache);
    }

    /**
     * 可序列化的快照回调。
     * <p>
     * A serializable snapshot callback.
     */
    @FunctionalInterface
    public interface DependencyCallback extends Function<JDepCache, Object>, Serializable {
    }
}
