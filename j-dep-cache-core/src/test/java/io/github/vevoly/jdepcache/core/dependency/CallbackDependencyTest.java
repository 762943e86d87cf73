package io.github.vevoly.jdepcache.core.dependency;

import io.github.vevoly.jdepcache.api.JDepCache;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

class CallbackDependencyTest {

    @Test
    void shouldSnapshotCallbackResult() {
        JDepCache cache = Mockito.mock(JDepCache.class);
        when(cache.getKeyPrefix()).thenReturn("v1", "v1", "v2");
        CallbackDependency dependency = new CallbackDependency(JDepCache::getKeyPrefix);

        dependency.evaluateDependency(cache);

        assertThat(dependency.getData()).isEqualTo("v1");
        assertThat(dependency.isChanged(cache)).isFalse();
        assertThat(dependency.isChanged(cache)).isTrue();
    }

    @Test
    void shouldSurviveJavaSerialization() throws IOException, ClassNotFoundException {
        JDepCache cache = Mockito.mock(JDepCache.class);
        CallbackDependency dependency = new CallbackDependency(c -> "constant");
        dependency.evaluateDependency(cache);

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(dependency);
        }
        CallbackDependency restored;
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()))) {
            restored = (CallbackDependency) in.readObject();
        }

        assertThat(restored.isEvaluated()).isTrue();
        assertThat(restored.getData()).isEqualTo("constant");
        assertThat(restored.isChanged(cache)).isFalse();
    }
}
