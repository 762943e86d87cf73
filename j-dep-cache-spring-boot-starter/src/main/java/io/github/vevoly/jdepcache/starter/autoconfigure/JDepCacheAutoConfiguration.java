package io.github.vevoly.jdepcache.starter.autoconfigure;

import io.github.vevoly.jdepcache.api.JDepCache;
import io.github.vevoly.jdepcache.api.backend.CacheBackend;
import io.github.vevoly.jdepcache.core.internal.JDepCacheImpl;
import io.github.vevoly.jdepcache.core.utils.I18nLogger;
import io.github.vevoly.jdepcache.starter.properties.JDepCacheProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

/**
 * j-dep-cache 的自动配置类。
 * <p>
 * 负责：
 * 1. 激活 {@code j-dep-cache.*} 配置属性。
 * 2. 根据 {@code j-dep-cache.backend} 注册后端 (Caffeine / Redis / NoOp)，用户自定义的 {@link CacheBackend} 优先。
 * 3. 注册按配置初始化好的 {@link JDepCache}。
 * <p>
 * Auto-configuration class for j-dep-cache.
 * Responsible for:
 * 1. Activating the {@code j-dep-cache.*} configuration properties.
 * 2. Registering the backend selected by {@code j-dep-cache.backend} (Caffeine / Redis / NoOp); a user-defined {@link CacheBackend} wins.
 * 3. Registering a {@link JDepCache} configured from the properties.
 *
 * @author vevoly
 */
@Slf4j
@AutoConfiguration
@AutoConfigureAfter(name = "org.redisson.spring.starter.RedissonAutoConfiguration") // 等待 RedissonClient Bean / wait for the RedissonClient bean
@EnableConfigurationProperties(JDepCacheProperties.class)
@ConditionalOnProperty(prefix = "j-dep-cache", name = "enabled", havingValue = "true", matchIfMissing = true)
@Import({
        JDepCacheBackendConfiguration.RedisBackendConfiguration.class,       // Redis 后端 / Redis backend
        JDepCacheBackendConfiguration.CaffeineBackendConfiguration.class,    // Caffeine 后端 / Caffeine backend
        JDepCacheBackendConfiguration.NoOpBackendConfiguration.class,        // 关闭缓存 / caching off
})
public class JDepCacheAutoConfiguration {

    private static final I18nLogger I18N_LOG = new I18nLogger(log);

    /**
     * 配置缓存门面。
     * <p>
     * Configures the cache facade.
     */
    @Bean
    @ConditionalOnMissingBean(JDepCache.class)
    public JDepCache jDepCache(CacheBackend cacheBackend, JDepCacheProperties properties) {
        JDepCacheImpl cache = new JDepCacheImpl(cacheBackend);
        cache.setKeyPrefix(properties.getKeyPrefix());
        if (!properties.isKeyNormalization()) {
            cache.disableKeyNormalization();
        }
        cache.setDefaultTtl(properties.getDefaultTtl());
        I18N_LOG.info("autoconfig.ready", cacheBackend.getClass().getSimpleName(), properties.getKeyPrefix());
        return cache;
    }
}
