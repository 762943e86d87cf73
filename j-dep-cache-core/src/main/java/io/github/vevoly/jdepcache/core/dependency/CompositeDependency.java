package io.github.vevoly.jdepcache.core.dependency;

import io.github.vevoly.jdepcache.api.JDepCache;
import io.github.vevoly.jdepcache.api.dependency.Dependency;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 组合依赖的基类：计算时计算所有尚未计算的子依赖，如何判定“变化”由子类决定。
 * <p>
 * Base of composite dependencies: evaluation evaluates every child not evaluated yet; subclasses decide what "changed" means.
 *
 * @author vevoly
 */
public abstract class CompositeDependency implements Dependency {

    private static final long serialVersionUID = 1L;

    protected final List<Dependency> dependencies;

    private boolean evaluated;

    protected CompositeDependency(Dependency... dependencies) {
        this(Arrays.asList(dependencies));
    }

    protected CompositeDependency(List<? extends Dependency> dependencies) {
        Objects.requireNonNull(dependencies, "dependencies must not be null");
        this.dependencies = Collections.unmodifiableList(new ArrayList<>(dependencies));
    }

    public List<Dependency> getDependencies() {
        return dependencies;
    }

    @Override
    public boolean isEvaluated() {
        return evaluated;
    }

    @Override
    public void evaluateDependency(JDepCache cache) {
        for (Dependency dependency : dependencies) {
            if (!dependency.isEvaluated()) {
                dependency.evaluateDependency(cache);
            }
        }
        evaluated = true;
    }
}
