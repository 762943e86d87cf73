package io.github.vevoly.jdepcache.api.constants;

/**
 * 框架中使用的所有公共常量的集合。
 * <p>
 * A collection of all public constants used within the framework.
 *
 * @author vevoly
 */
public interface JDepCacheConstants {

    // ===================================================================
    // ====================== Key 归一化 / Key Normalization ==============
    // ===================================================================

    /**
     * 可以原样透传的 Key 的最大字节长度。超过该长度的 Key 会被哈希。
     * <p>
     * The maximum byte length of a key that is passed through unchanged. Longer keys are hashed.
     */
    int MAX_PLAIN_KEY_LENGTH = 32;

    /**
     * 默认的 Key 前缀（不做命名空间隔离）。
     * <p>
     * The default key prefix (no namespacing).
     */
    String DEFAULT_KEY_PREFIX = "";

    // ===================================================================
    // ====================== 依赖 / Dependencies =========================
    // ===================================================================

    /**
     * 标签版本号在缓存中的 Key 前缀。完整 Key 为 {@code [TAG_KEY_PREFIX, tag]}。
     * <p>
     * The marker of tag version keys in the cache. The full raw key is {@code [TAG_KEY_PREFIX, tag]}.
     */
    String TAG_KEY_PREFIX = "__tag__";

    // ===================================================================
    // ====================== 后端默认值 / Backend Defaults ================
    // ===================================================================

    /**
     * Caffeine 本地后端的默认最大容量。
     * <p>
     * The default maximum size of the Caffeine local backend.
     */
    long DEFAULT_LOCAL_CACHE_MAX_SIZE = 10_000L;
}
