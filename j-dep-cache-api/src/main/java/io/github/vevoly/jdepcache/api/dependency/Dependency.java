package io.github.vevoly.jdepcache.api.dependency;

import io.github.vevoly.jdepcache.api.JDepCache;

import java.io.Serializable;

/**
 * 缓存依赖。
 * <p>
 * 写入时，依赖会对某个外部状态做一次快照并与缓存值一起存储；读取时，依赖会重新计算当前状态并与快照比较，
 * 如果发生变化，缓存值将被视为不存在。
 * 依赖实例由调用方持有，可以跨调用复用，因此计算状态会在同一实例上保留。实例不是线程安全的。
 * <p>
 * A cache dependency.
 * On write, a dependency snapshots some external state and is stored together with the cached value; on read, it recomputes the
 * current state and compares it with the snapshot. If the state changed, the cached value reads as absent.
 * Instances are owned by the caller and may be reused across calls, so evaluation state persists on the instance. Instances are not thread-safe.
 *
 * @author vevoly
 * @see AbstractDependency
 */
public interface Dependency extends Serializable {

    /**
     * 是否已经计算过快照。
     * <p>
     * Whether a snapshot has been computed.
     */
    boolean isEvaluated();

    /**
     * 计算并保存当前状态的快照。
     * <p>
     * Computes and keeps a snapshot of the current state.
     *
     * @param cache 正在写入的缓存。/ The cache being written to.
     */
    void evaluateDependency(JDepCache cache);

    /**
     * 重新计算当前状态并与已保存的快照比较。
     * <p>
     * Recomputes the current state and compares it with the stored snapshot.
     *
     * @param cache 正在读取的缓存。/ The cache being read from.
     * @return {@code true} 如果状态已变化，缓存值应被视为不存在。/ {@code true} if the state changed and the cached value must be treated as absent.
     */
    boolean isChanged(JDepCache cache);
}
