package io.github.vevoly.jdepcache.starter.properties;

import io.github.vevoly.jdepcache.api.constants.DefaultBackendTypes;
import io.github.vevoly.jdepcache.api.constants.JDepCacheConstants;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 映射 application.yml 文件中 {@code j-dep-cache} 配置块的属性。
 * <p>
 * Maps the properties of the {@code j-dep-cache} configuration block from the application.yml file.
 *
 * @author vevoly
 */
@Data
@ConfigurationProperties(prefix = "j-dep-cache")
public class JDepCacheProperties {

    /**
     * 是否启用自动配置。
     * <p>
     * Whether the auto-configuration is enabled.
     */
    private boolean enabled = true;

    /**
     * 添加到每个 Key 前的前缀，用于多个应用共享同一后端时的隔离。只允许字母、数字和下划线。
     * <p>
     * The prefix added to every key, isolating applications that share one backend. Only letters, digits and underscores are allowed.
     */
    private String keyPrefix = JDepCacheConstants.DEFAULT_KEY_PREFIX;

    /**
     * 是否开启 Key 归一化。
     * <p>
     * Whether key normalization is enabled.
     */
    private boolean keyNormalization = true;

    /**
     * 写入时未指定 TTL 时使用的默认 TTL (例如: 30s, 5m, 1h)。为空表示永不过期。
     * <p>
     * The TTL used when a write specifies none (e.g. 30s, 5m, 1h). Empty means no expiry.
     */
    private Duration defaultTtl;

    /**
     * 后端类型 (caffeine, redis, none)。
     * <p>
     * The backend type (caffeine, redis, none).
     */
    private String backend = DefaultBackendTypes.CAFFEINE;

    /**
     * Caffeine 后端的最大容量。
     * <p>
     * The maximum size of the Caffeine backend.
     */
    private long localMaxSize = JDepCacheConstants.DEFAULT_LOCAL_CACHE_MAX_SIZE;

    /**
     * Redis 后端执行 clear() 时删除的 Key 模式，例如 {@code app_*}。为空时 clear() 会清空整个数据库。
     * <p>
     * The key pattern deleted by clear() on the Redis backend, e.g. {@code app_*}. Empty means clear() flushes the whole database.
     */
    private String redisNamespacePattern;
}
