package io.github.vevoly.jdepcache.core.wrap;

import io.github.vevoly.jdepcache.api.JDepCache;
import io.github.vevoly.jdepcache.api.dependency.Dependency;

import java.io.Serializable;

/**
 * 后端中实际存储的条目 (框架内部使用)。
 * <p>
 * 只有两种形态：{@link PlainEntry} (无依赖的值) 和 {@link TaggedEntry} (值 + 已计算的依赖快照)。
 * 条目从不返回给调用方，读取时总是先检查 {@link #isDependencyChanged(JDepCache)} 再解包。
 * <p>
 * The unit actually stored in the backend (internal to the framework).
 * It has exactly two shapes: {@link PlainEntry} (a value without dependency) and {@link TaggedEntry} (a value plus its evaluated dependency).
 * Entries never reach the caller; reads check {@link #isDependencyChanged(JDepCache)} and then unwrap them.
 *
 * @author vevoly
 */
public abstract class CacheEntry implements Serializable {

    private static final long serialVersionUID = 1L;

    CacheEntry() {
    }

    /**
     * 为值创建条目。依赖为 null 时创建 {@link PlainEntry}。
     * <p>
     * Creates the entry for a value; a null dependency yields a {@link PlainEntry}.
     */
    public static CacheEntry of(Object value, Dependency dependency) {
        return dependency == null ? new PlainEntry(value) : new TaggedEntry(value, dependency);
    }

    public abstract Object getValue();

    /**
     * 条目的依赖自写入后是否已变化。无依赖的条目永远不会变化。
     * <p>
     * Whether the entry's dependency changed since the write. Entries without dependency never change.
     */
    public abstract boolean isDependencyChanged(JDepCache cache);
}
