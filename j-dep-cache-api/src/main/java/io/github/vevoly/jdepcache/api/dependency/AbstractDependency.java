package io.github.vevoly.jdepcache.api.dependency;

import io.github.vevoly.jdepcache.api.JDepCache;

import java.util.Objects;

/**
 * {@link Dependency} 的基础实现，负责快照的保存与比较。
 * 子类只需实现 {@link #generateDependencyData(JDepCache)} 来决定快照的内容。
 * <p>
 * Base implementation of {@link Dependency} that keeps and compares the snapshot.
 * Subclasses only implement {@link #generateDependencyData(JDepCache)} to decide what the snapshot is.
 * <p>
 * {@code isEvaluated()} and the snapshot are plain fields: concurrent first-time evaluation of one instance is a data race.
 *
 * @author vevoly
 */
public abstract class AbstractDependency implements Dependency {

    private static final long serialVersionUID = 1L;

    /**
     * 写入时计算出的快照。
     * <p>
     * The snapshot computed at write time.
     */
    protected Object data;

    private boolean evaluated;

    @Override
    public boolean isEvaluated() {
        return evaluated;
    }

    @Override
    public void evaluateDependency(JDepCache cache) {
        data = generateDependencyData(cache);
        evaluated = true;
    }

    @Override
    public boolean isChanged(JDepCache cache) {
        return !Objects.equals(data, generateDependencyData(cache));
    }

    /**
     * 返回写入时计算出的快照，未计算时为 null。
     * <p>
     * Returns the snapshot computed at write time, or null if not evaluated yet.
     */
    public Object getData() {
        return data;
    }

    /**
     * 生成当前外部状态的快照。快照需要可序列化，以便持久化后端存储。
     * <p>
     * Generates a snapshot of the current external state. The snapshot should be serializable so that persistent backends can store it.
     *
     * @param cache 当前操作的缓存。/ The cache of the current operation.
     * @return 快照数据。/ The snapshot.
     */
    protected abstract Object generateDependencyData(JDepCache cache);
}
