package io.github.vevoly.jdepcache.core.dependency;

import io.github.vevoly.jdepcache.api.JDepCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.Collections;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CompositeDependencyTest {

    private final JDepCache cache = Mockito.mock(JDepCache.class);

    private AtomicInteger first;
    private AtomicInteger second;
    private CallbackDependency firstDependency;
    private CallbackDependency secondDependency;

    @BeforeEach
    void setUp() {
        first = new AtomicInteger();
        second = new AtomicInteger();
        firstDependency = new CallbackDependency(c -> first.get());
        secondDependency = new CallbackDependency(c -> second.get());
    }

    @Test
    void shouldEvaluateEveryChild() {
        AnyDependency dependency = new AnyDependency(firstDependency, secondDependency);

        dependency.evaluateDependency(cache);

        assertThat(dependency.isEvaluated()).isTrue();
        assertThat(firstDependency.isEvaluated()).isTrue();
        assertThat(secondDependency.isEvaluated()).isTrue();
    }

    @Test
    void shouldKeepSnapshotsOfAlreadyEvaluatedChildren() {
        firstDependency.evaluateDependency(cache);
        first.set(5);

        new AnyDependency(firstDependency).evaluateDependency(cache);

        assertThat(firstDependency.getData()).isEqualTo(0);
    }

    @Test
    void anyShouldChangeWhenOneChildChanges() {
        AnyDependency dependency = new AnyDependency(firstDependency, secondDependency);
        dependency.evaluateDependency(cache);

        assertThat(dependency.isChanged(cache)).isFalse();

        second.incrementAndGet();

        assertThat(dependency.isChanged(cache)).isTrue();
    }

    @Test
    void allShouldChangeOnlyWhenEveryChildChanges() {
        AllDependencies dependency = new AllDependencies(firstDependency, secondDependency);
        dependency.evaluateDependency(cache);

        first.incrementAndGet();
        assertThat(dependency.isChanged(cache)).isFalse();

        second.incrementAndGet();
        assertThat(dependency.isChanged(cache)).isTrue();
    }

    @Test
    void emptyCompositesShouldNeverChange() {
        AllDependencies all = new AllDependencies(Collections.emptyList());
        AnyDependency any = new AnyDependency();

        all.evaluateDependency(cache);
        any.evaluateDependency(cache);

        assertThat(all.isChanged(cache)).isFalse();
        assertThat(any.isChanged(cache)).isFalse();
    }
}
