package io.github.vevoly.jdepcache.core.dependency;

import io.github.vevoly.jdepcache.api.JDepCache;
import io.github.vevoly.jdepcache.api.dependency.Dependency;

import java.util.List;

/**
 * 任意一个子依赖发生变化即视为变化。
 * <p>
 * Changed as soon as any child dependency changed.
 *
 * @author vevoly
 */
public class AnyDependency extends CompositeDependency {

    private static final long serialVersionUID = 1L;

    public AnyDependency(Dependency... dependencies) {
        super(dependencies);
    }

    public AnyDependency(List<? extends Dependency> dependencies) {
        super(dependencies);
    }

    @Override
    public boolean isChanged(JDepCache cache) {
        for (Dependency dependency : dependencies) {
            if (dependency.isChanged(cache)) {
                return true;
            }
        }
        return false;
    }
}
