package io.github.vevoly.jdepcache.core.dependency;

import io.github.vevoly.jdepcache.api.JDepCache;
import io.github.vevoly.jdepcache.api.constants.JDepCacheConstants;
import io.github.vevoly.jdepcache.api.dependency.AbstractDependency;
import io.github.vevoly.jdepcache.core.utils.I18nLogger;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * 基于标签的依赖。
 * <p>
 * 每个标签在缓存中保存一个版本戳 (Key 为 {@code ["__tag__", tag]})。写入时记录所有标签的当前版本戳，
 * 读取时比较。调用 {@link #invalidate(JDepCache, String...)} 会为标签生成新的版本戳，
 * 从而使所有带该标签的缓存项失效。
 * <p>
 * A tag-based dependency.
 * Every tag keeps a version stamp in the cache itself (raw key {@code ["__tag__", tag]}). The write records the current stamps of
 * all tags, the read compares them. {@link #invalidate(JDepCache, String...)} issues new stamps, which invalidates every entry
 * carrying one of the tags.
 *
 * <pre>{@code
 * cache.set(productId, product, null, new TagDependency("products"));
 * ...
 * TagDependency.invalidate(cache, "products");
 * }</pre>
 *
 * @author vevoly
 */
@Slf4j
public class TagDependency extends AbstractDependency {

    private static final long serialVersionUID = 1L;

    private static final I18nLogger I18N_LOG = new I18nLogger(log);

    private final List<String> tags;

    public TagDependency(String... tags) {
        this(Arrays.asList(tags));
    }

    public TagDependency(List<String> tags) {
        this.tags = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(tags, "tags must not be null")));
    }

    public List<String> getTags() {
        return tags;
    }

    /**
     * 读取各标签的版本戳，缺失的标签会先写入新的版本戳。
     * <p>
     * Reads the stamp of every tag; tags without a stamp get a fresh one first.
     */
    @Override
    protected Object generateDependencyData(JDepCache cache) {
        Map<String, Object> stamps = getStamps(cache, tags);
        List<String> missing = new ArrayList<>();
        stamps.forEach((tag, stamp) -> {
            if (stamp == null) {
                missing.add(tag);
            }
        });
        if (!missing.isEmpty()) {
            stamps.putAll(touchTags(cache, missing));
        }
        return stamps;
    }

    /**
     * 与写入时的版本戳比较，不会创建缺失的版本戳。
     * <p>
     * Compares with the stamps recorded at write time, without creating missing stamps.
     */
    @Override
    public boolean isChanged(JDepCache cache) {
        return !Objects.equals(data, getStamps(cache, tags));
    }

    /**
     * 使带有指定标签的所有缓存项失效。
     * <p>
     * Invalidates every cached entry carrying one of the given tags.
     *
     * @param cache 缓存实例。/ The cache.
     * @param tags  要失效的标签。/ The tags to invalidate.
     */
    public static void invalidate(JDepCache cache, String... tags) {
        touchTags(cache, Arrays.asList(tags));
        I18N_LOG.info("tag.invalidate", Arrays.toString(tags));
    }

    private static Map<String, Object> touchTags(JDepCache cache, List<String> tags) {
        Map<Object, Object> values = new LinkedHashMap<>();
        Map<String, Object> stamps = new LinkedHashMap<>();
        for (String tag : tags) {
            String stamp = UUID.randomUUID().toString();
            values.put(tagKey(tag), stamp);
            stamps.put(tag, stamp);
        }
        cache.setMultiple(values);
        return stamps;
    }

    private static Map<String, Object> getStamps(JDepCache cache, List<String> tags) {
        List<List<String>> keys = new ArrayList<>();
        for (String tag : tags) {
            keys.add(tagKey(tag));
        }
        Map<Object, Object> stored = cache.getMultiple(keys);
        Map<String, Object> stamps = new LinkedHashMap<>();
        for (String tag : tags) {
            stamps.put(tag, stored.get(tagKey(tag)));
        }
        return stamps;
    }

    private static List<String> tagKey(String tag) {
        return List.of(JDepCacheConstants.TAG_KEY_PREFIX, tag);
    }
}
