package com.fieldgrouping.infrastructure.grouping.cache;

import com.fieldgrouping.domain.grouping.model.GroupingStrategy;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Grouping output keyed by {@link GroupingCacheKeyBuilder} keys. Owned by the caller;
 * entries stay until invalidated.
 */
public class GroupingResultCache {

    private final Map<String, List<GroupingStrategy>> entries = new ConcurrentHashMap<>();

    public Optional<List<GroupingStrategy>> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public List<GroupingStrategy> getOrCompute(String key, Supplier<List<GroupingStrategy>> compute) {
        List<GroupingStrategy> cached = entries.get(key);
        if (cached != null) {
            return cached;
        }
        List<GroupingStrategy> computed = List.copyOf(compute.get());
        entries.put(key, computed);
        return computed;
    }

    public void invalidate(String key) {
        entries.remove(key);
    }

    public void invalidateAll() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }
}
