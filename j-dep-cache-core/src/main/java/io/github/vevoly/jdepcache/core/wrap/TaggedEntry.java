package io.github.vevoly.jdepcache.core.wrap;

import io.github.vevoly.jdepcache.api.JDepCache;
import io.github.vevoly.jdepcache.api.dependency.Dependency;
import lombok.Getter;
import lombok.ToString;

/**
 * 带依赖快照的存储条目。依赖在写入前已完成计算。
 * <p>
 * A stored entry carrying a dependency snapshot. The dependency is evaluated before the write.
 *
 * @author vevoly
 */
@ToString
public final class TaggedEntry extends CacheEntry {

    private static final long serialVersionUID = 1L;

    private final Object value;

    @Getter
    private final Dependency dependency;

    public TaggedEntry(Object value, Dependency dependency) {
        this.value = value;
        this.dependency = dependency;
    }

    @Override
    public Object getValue() {
        return value;
    }

    @Override
    public boolean isDependencyChanged(JDepCache cache) {
        return dependency.isChanged(cache);
    }
}
