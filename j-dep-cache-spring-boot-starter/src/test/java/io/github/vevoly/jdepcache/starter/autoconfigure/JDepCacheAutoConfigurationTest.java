package io.github.vevoly.jdepcache.starter.autoconfigure;

import io.github.vevoly.jdepcache.api.JDepCache;
import io.github.vevoly.jdepcache.api.backend.CacheBackend;
import io.github.vevoly.jdepcache.api.exception.InvalidCacheConfigException;
import io.github.vevoly.jdepcache.core.backend.CaffeineCacheBackend;
import io.github.vevoly.jdepcache.core.backend.NoOpCacheBackend;
import io.github.vevoly.jdepcache.core.backend.RedissonCacheBackend;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.redisson.api.RedissonClient;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class JDepCacheAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JDepCacheAutoConfiguration.class));

    @Test
    void shouldUseCaffeineByDefault() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(JDepCache.class);
            assertThat(context).getBean(CacheBackend.class).isInstanceOf(CaffeineCacheBackend.class);

            JDepCache cache = context.getBean(JDepCache.class);
            assertThat(cache.getKeyPrefix()).isEmpty();
            assertThat(cache.isKeyNormalizationEnabled()).isTrue();
            assertThat(cache.getDefaultTtl()).isNull();
        });
    }

    @Test
    void shouldApplyProperties() {
        contextRunner
                .withPropertyValues(
                        "j-dep-cache.key-prefix=app_",
                        "j-dep-cache.key-normalization=false",
                        "j-dep-cache.default-ttl=60s")
                .run(context -> {
                    JDepCache cache = context.getBean(JDepCache.class);
                    assertThat(cache.getKeyPrefix()).isEqualTo("app_");
                    assertThat(cache.isKeyNormalizationEnabled()).isFalse();
                    assertThat(cache.getDefaultTtl()).isEqualTo(Duration.ofSeconds(60));
                    assertThat(cache.buildKey("hello world")).isEqualTo("app_hello world");
                });
    }

    @Test
    void shouldServeReadsAndWrites() {
        contextRunner.run(context -> {
            JDepCache cache = context.getBean(JDepCache.class);

            cache.set("user42", "alice");

            assertThat(cache.<String>get("user42")).isEqualTo("alice");
        });
    }

    @Test
    void shouldFailOnInvalidPrefix() {
        contextRunner
                .withPropertyValues("j-dep-cache.key-prefix=app-1")
                .run(context -> assertThat(context)
                        .hasFailed()
                        .getFailure()
                        .rootCause()
                        .isInstanceOf(InvalidCacheConfigException.class));
    }

    @Test
    void shouldUseNoOpBackendWhenDisabledByType() {
        contextRunner
                .withPropertyValues("j-dep-cache.backend=none")
                .run(context -> {
                    assertThat(context).getBean(CacheBackend.class).isInstanceOf(NoOpCacheBackend.class);

                    JDepCache cache = context.getBean(JDepCache.class);
                    cache.set("k", "v");
                    assertThat(cache.get("k", "miss")).isEqualTo("miss");
                });
    }

    @Test
    void shouldUseRedissonWhenClientPresent() {
        contextRunner
                .withBean(RedissonClient.class, () -> Mockito.mock(RedissonClient.class))
                .withPropertyValues("j-dep-cache.backend=redis", "j-dep-cache.redis-namespace-pattern=app_*")
                .run(context -> assertThat(context)
                        .getBean(CacheBackend.class)
                        .isInstanceOf(RedissonCacheBackend.class));
    }

    @Test
    void shouldFailWithoutRedissonClientForRedisBackend() {
        contextRunner
                .withPropertyValues("j-dep-cache.backend=redis")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void shouldBackOffForUserDefinedBackend() {
        NoOpCacheBackend custom = new NoOpCacheBackend();
        contextRunner
                .withBean(CacheBackend.class, () -> custom)
                .run(context -> assertThat(context).getBean(CacheBackend.class).isSameAs(custom));
    }

    @Test
    void shouldRegisterNothingWhenDisabled() {
        contextRunner
                .withPropertyValues("j-dep-cache.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(JDepCache.class);
                    assertThat(context).doesNotHaveBean(CacheBackend.class);
                });
    }
}
