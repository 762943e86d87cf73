package io.github.vevoly.jdepcache.core.wrap;

import io.github.vevoly.jdepcache.api.JDepCache;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 无依赖的存储条目。
 * <p>
 * A stored entry without dependency.
 *
 * @author vevoly
 */
@ToString
@EqualsAndHashCode(callSuper = false)
public final class PlainEntry extends CacheEntry {

    private static final long serialVersionUID = 1L;

    private final Object value;

    public PlainEntry(Object value) {
        this.value = value;
    }

    @Override
    public Object getValue() {
        return value;
    }

    @Override
    public boolean isDependencyChanged(JDepCache cache) {
        return false;
    }
}
