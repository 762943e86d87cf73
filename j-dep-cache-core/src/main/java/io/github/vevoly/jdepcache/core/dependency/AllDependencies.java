package io.github.vevoly.jdepcache.core.dependency;

import io.github.vevoly.jdepcache.api.JDepCache;
import io.github.vevoly.jdepcache.api.dependency.Dependency;

import java.util.List;

/**
 * 仅当所有子依赖都发生变化时才视为变化。没有子依赖时永不变化。
 * <p>
 * Changed only when every child dependency changed. Never changes without children.
 *
 * @author vevoly
 */
public class AllDependencies extends CompositeDependency {

    private static final long serialVersionUID = 1L;

    public AllDependencies(Dependency... dependencies) {
        super(dependencies);
    }

    public AllDependencies(List<? extends Dependency> dependencies) {
        super(dependencies);
    }

    @Override
    public boolean isChanged(JDepCache cache) {
        if (dependencies.isEmpty()) {
            return false;
        }
        for (Dependency dependency : dependencies) {
            if (!dependency.isChanged(cache)) {
                return false;
            }
        }
        return true;
    }
}
