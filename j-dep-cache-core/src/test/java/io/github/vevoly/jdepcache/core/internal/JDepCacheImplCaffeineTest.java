package io.github.vevoly.jdepcache.core.internal;

import io.github.vevoly.jdepcache.api.JDepCache;
import io.github.vevoly.jdepcache.api.dependency.AbstractDependency;
import io.github.vevoly.jdepcache.core.backend.CaffeineCacheBackend;
import io.github.vevoly.jdepcache.core.dependency.CallbackDependency;
import io.github.vevoly.jdepcache.core.dependency.TagDependency;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 基于真实 Caffeine 后端的门面行为测试。
 * <p>
 * Facade behavior against a real Caffeine backend.
 */
class JDepCacheImplCaffeineTest {

    private final AtomicLong clock = new AtomicLong();

    private JDepCacheImpl cache;

    @BeforeEach
    void setUp() {
        cache = new JDepCacheImpl(new CaffeineCacheBackend(1_000, clock::get));
    }

    private void advance(Duration duration) {
        clock.addAndGet(duration.toNanos());
    }

    @Test
    void shouldStoreAndReadBack() {
        assertThat(cache.set("user42", "alice")).isTrue();

        String value = cache.get("user42");

        assertThat(value).isEqualTo("alice");
        assertThat(cache.has("user42")).isTrue();
    }

    @Test
    void shouldReturnDefaultOnMiss() {
        assertThat(cache.get("missing", "fallback")).isEqualTo("fallback");
        assertThat(cache.has("missing")).isFalse();
    }

    @Test
    void shouldAcceptCompositeKeys() {
        Map<String, Object> key = new LinkedHashMap<>();
        key.put("type", "user");
        key.put("id", 42);
        Map<String, Object> sameKeyOtherOrder = new LinkedHashMap<>();
        sameKeyOtherOrder.put("id", 42);
        sameKeyOtherOrder.put("type", "user");

        cache.set(key, "alice");

        assertThat(cache.<String>get(sameKeyOtherOrder)).isEqualTo("alice");
    }

    @Test
    @DisplayName("依赖变化后读取返回默认值 / a changed dependency makes reads return the default")
    void shouldInvalidateOnDependencyChange() {
        AtomicInteger version = new AtomicInteger(1);
        cache.set("config", "v1", null, new CallbackDependency(c -> version.get()));

        assertThat(cache.get("config", "none")).isEqualTo("v1");

        version.set(2);

        assertThat(cache.get("config", "none")).isEqualTo("none");
        // has 不检查依赖 / has ignores dependencies
        assertThat(cache.has("config")).isTrue();
    }

    @Test
    void shouldInvalidateEntriesByTag() {
        cache.set("p1", "phone", null, new TagDependency("products"));
        cache.set("p2", "laptop", null, new TagDependency("products", "featured"));
        cache.set("u1", "alice", null, new TagDependency("users"));

        TagDependency.invalidate(cache, "products");

        assertThat(cache.<String>get("p1")).isNull();
        assertThat(cache.<String>get("p2")).isNull();
        assertThat(cache.<String>get("u1")).isEqualTo("alice");
    }

    @Test
    void shouldExpireAfterTtl() {
        cache.set("k", "v", Duration.ofSeconds(10));

        advance(Duration.ofSeconds(9));
        assertThat(cache.<String>get("k")).isEqualTo("v");

        advance(Duration.ofSeconds(2));
        assertThat(cache.<String>get("k")).isNull();
    }

    @Test
    void shouldApplyDefaultTtl() {
        cache.setDefaultTtl(Duration.ofSeconds(5));
        cache.set("short", "v");
        cache.set("long", "v", Duration.ofSeconds(60));

        advance(Duration.ofSeconds(6));

        assertThat(cache.has("short")).isFalse();
        assertThat(cache.has("long")).isTrue();
    }

    @Test
    void shouldDeleteOnNonPositiveTtl() {
        cache.set("k", "v");

        cache.set("k", "w", Duration.ZERO);

        assertThat(cache.has("k")).isFalse();
    }

    @Test
    void shouldOnlyAddAbsentKeys() {
        assertThat(cache.add("k", "first")).isTrue();
        assertThat(cache.add("k", "second")).isFalse();

        assertThat(cache.<String>get("k")).isEqualTo("first");
    }

    @Test
    void shouldTreatStoredNullAsExisting() {
        cache.set("k", null);

        assertThat(cache.has("k")).isTrue();
        assertThat(cache.add("k", "v")).isFalse();
    }

    @Test
    void shouldRestoreRawKeysInBatches() {
        List<Integer> composite = Arrays.asList(1, 2);
        Map<Object, Object> values = new LinkedHashMap<>();
        values.put("a", 1);
        values.put(composite, "pair");

        assertThat(cache.setMultiple(values)).isTrue();
        Map<Object, Object> result = cache.getMultiple(List.of("a", composite, "missing"), "none");

        assertThat(result)
                .containsEntry("a", 1)
                .containsEntry(composite, "pair")
                .containsEntry("missing", "none")
                .hasSize(3);
    }

    @Test
    void shouldApplyDependencyPerEntryInBatches() {
        AtomicInteger version = new AtomicInteger(1);
        cache.setMultiple(Map.of("a", 1, "b", 2), null, new CallbackDependency(c -> version.get()));
        cache.set("c", 3);

        version.incrementAndGet();

        assertThat(cache.getMultiple(List.of("a", "b", "c")))
                .containsEntry("a", null)
                .containsEntry("b", null)
                .containsEntry("c", 3);
    }

    @Test
    @DisplayName("批量写入时共享依赖只计算一次 / a shared dependency is evaluated once per batch")
    void shouldEvaluateSharedDependencyOnceInBatches() {
        CountingDependency dependency = new CountingDependency();

        cache.setMultiple(Map.of("a", 1, "b", 2, "c", 3), null, dependency);

        assertThat(dependency.evaluations).hasValue(1);
        assertThat(cache.getMultiple(List.of("a", "b", "c")))
                .containsEntry("a", 1)
                .containsEntry("b", 2)
                .containsEntry("c", 3);
    }

    @Test
    void shouldEvaluateSharedDependencyOnceOnAddMultiple() {
        CountingDependency dependency = new CountingDependency();

        cache.addMultiple(Map.of("a", 1, "b", 2, "c", 3), null, dependency);

        assertThat(dependency.evaluations).hasValue(1);
    }

    @Test
    void shouldDeleteOnSubSecondTtl() {
        cache.set("k", "v");

        cache.set("k", "w", Duration.ofMillis(500));

        // 500ms 截断为 0 秒 / 500ms truncates to 0 seconds
        assertThat(cache.has("k")).isFalse();
        assertThat(cache.<String>get("k")).isNull();
    }

    @Test
    void shouldAddOnlyMissingEntriesInBatches() {
        cache.set("a", 1);

        cache.addMultiple(Map.of("a", 10, "b", 20));

        assertThat(cache.getMultiple(List.of("a", "b")))
                .containsEntry("a", 1)
                .containsEntry("b", 20);
    }

    @Test
    void shouldDeleteSingleAndMultipleKeys() {
        cache.setMultiple(Map.of("a", 1, "b", 2, "c", 3));

        cache.delete("a");
        cache.deleteMultiple(List.of("b"));

        assertThat(cache.has("a")).isFalse();
        assertThat(cache.has("b")).isFalse();
        assertThat(cache.has("c")).isTrue();
    }

    @Test
    void shouldClearEverything() {
        cache.setMultiple(Map.of("a", 1, "b", 2));

        assertThat(cache.clear()).isTrue();

        assertThat(cache.getMultiple(List.of("a", "b"))).containsEntry("a", null).containsEntry("b", null);
    }

    @Test
    @DisplayName("getOrSet 只在未命中时计算一次 / getOrSet computes once on a miss")
    void shouldComputeOnlyOnce() {
        AtomicInteger calls = new AtomicInteger();

        String first = cache.getOrSet("report", c -> "result" + calls.incrementAndGet(), Duration.ofMinutes(1));
        String second = cache.getOrSet("report", c -> "result" + calls.incrementAndGet(), Duration.ofMinutes(1));

        assertThat(first).isEqualTo("result1");
        assertThat(second).isEqualTo("result1");
        assertThat(calls).hasValue(1);
    }

    @Test
    void shouldRecomputeAfterDependencyChange() {
        AtomicInteger version = new AtomicInteger(1);
        AtomicInteger calls = new AtomicInteger();

        cache.getOrSet("k", c -> calls.incrementAndGet(), null, new CallbackDependency(c -> version.get()));
        version.set(2);
        Integer value = cache.getOrSet("k", c -> calls.incrementAndGet(), null, new CallbackDependency(c -> version.get()));

        assertThat(value).isEqualTo(2);
        assertThat(calls).hasValue(2);
    }

    @Test
    void shouldIsolateByPrefix() {
        JDepCacheImpl other = new JDepCacheImpl(new CaffeineCacheBackend());
        other.setKeyPrefix("app_");

        assertThat(other.buildKey("user42")).isEqualTo("app_user42");
        assertThat(cache.buildKey("user42")).isEqualTo("user42");
    }

    @Test
    void shouldTruncateTtlBeforeExpiring() {
        cache.set("k", "v", Duration.ofMillis(1500));

        advance(Duration.ofMillis(1100));

        // TTL 被截断为 1 秒 / TTL truncated to 1 second
        assertThat(cache.has("k")).isFalse();
    }

    /**
     * 记录计算次数的依赖，快照恒定。
     * <p>
     * A dependency with a constant snapshot that counts its evaluations.
     */
    static final class CountingDependency extends AbstractDependency {

        private static final long serialVersionUID = 1L;

        final AtomicInteger evaluations = new AtomicInteger();

        @Override
        public void evaluateDependency(JDepCache cache) {
            evaluations.incrementAndGet();
            super.evaluateDependency(cache);
        }

        @Override
        protected Object generateDependencyData(JDepCache cache) {
            return "constant";
        }
    }
}
