package io.github.vevoly.jdepcache.api.constants;

/**
 * 定义了框架内置的后端类型标识符。
 * <p>
 * 用户可以在 application.yml 的 {@code j-dep-cache.backend} 属性中使用这些值。
 * <p>
 * Defines the built-in backend type identifiers.
 * Users can use these values in the {@code j-dep-cache.backend} property of application.yml.
 *
 * @author vevoly
 */
public final class DefaultBackendTypes {

    private DefaultBackendTypes() {}

    /**
     * 基于 Caffeine 的进程内存储。
     * <p>
     * In-process storage backed by Caffeine.
     */
    public static final String CAFFEINE = "caffeine";

    /**
     * 基于 Redisson 的 Redis 存储。
     * <p>
     * Redis storage through Redisson.
     */
    public static final String REDIS = "redis";

    /**
     * 不存储任何数据，用于关闭缓存。
     * <p>
     * Stores nothing; used to switch caching off.
     */
    public static final String NONE = "none";
}
