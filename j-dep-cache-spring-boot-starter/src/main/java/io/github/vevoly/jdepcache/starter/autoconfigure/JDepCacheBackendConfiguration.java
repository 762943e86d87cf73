package io.github.vevoly.jdepcache.starter.autoconfigure;

import io.github.vevoly.jdepcache.api.backend.CacheBackend;
import io.github.vevoly.jdepcache.api.constants.DefaultBackendTypes;
import io.github.vevoly.jdepcache.core.backend.CaffeineCacheBackend;
import io.github.vevoly.jdepcache.core.backend.NoOpCacheBackend;
import io.github.vevoly.jdepcache.core.backend.RedissonCacheBackend;
import io.github.vevoly.jdepcache.starter.properties.JDepCacheProperties;
import org.redisson.api.RedissonClient;
import org.redisson.codec.SerializationCodec;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 各后端的配置类。同一时间只有 {@code j-dep-cache.backend} 选中的那一个生效。
 * <p>
 * Backend configurations. Only the one selected by {@code j-dep-cache.backend} applies.
 *
 * @author vevoly
 */
final class JDepCacheBackendConfiguration {

    private JDepCacheBackendConfiguration() {}

    /**
     * Redis 后端，依赖用户项目中已有的 RedissonClient Bean。
     * <p>
     * Redis backend, relying on the RedissonClient bean of the application.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(RedissonClient.class)
    @ConditionalOnBean(RedissonClient.class)
    @ConditionalOnProperty(prefix = "j-dep-cache", name = "backend", havingValue = DefaultBackendTypes.REDIS)
    static class RedisBackendConfiguration {

        @Bean("jDepCacheBackend")
        @ConditionalOnMissingBean(CacheBackend.class)
        public CacheBackend jDepCacheRedisBackend(RedissonClient redissonClient, JDepCacheProperties properties) {
            return new RedissonCacheBackend(redissonClient, new SerializationCodec(), properties.getRedisNamespacePattern());
        }
    }

    /**
     * 默认的 Caffeine 后端。
     * <p>
     * The default Caffeine backend.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "j-dep-cache", name = "backend", havingValue = DefaultBackendTypes.CAFFEINE, matchIfMissing = true)
    static class CaffeineBackendConfiguration {

        @Bean("jDepCacheBackend")
        @ConditionalOnMissingBean(CacheBackend.class)
        public CacheBackend jDepCacheCaffeineBackend(JDepCacheProperties properties) {
            return new CaffeineCacheBackend(properties.getLocalMaxSize());
        }
    }

    /**
     * 关闭缓存：所有读取都未命中。
     * <p>
     * Caching off: every read misses.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "j-dep-cache", name = "backend", havingValue = DefaultBackendTypes.NONE)
    static class NoOpBackendConfiguration {

        @Bean("jDepCacheBackend")
        @ConditionalOnMissingBean(CacheBackend.class)
        public CacheBackend jDepCacheNoOpBackend() {
            return new NoOpCacheBackend();
        }
    }
}
