package com.novaware.catalog.service.index;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Key to records map built in one pass. Keys keep first-seen order and records keep
 * stream order within their key. The index is read-only once built.
 */
public final class GroupedIndex<T> {
    private final Map<String, List<T>> groups;

    private GroupedIndex(Map<String, List<T>> groups) {
        this.groups = groups;
    }

    /**
     * Groups a record stream by key. Records with a null key, or whose key the filter rejects,
     * are not retained.
     */
    public static <T> Mono<GroupedIndex<T>> collect(Flux<T> records, Function<T, String> keyFn, Predicate<String> keyFilter) {
        return records
                .collect(LinkedHashMap<String, List<T>>::new, (map, r) -> {
                    String key = keyFn.apply(r);
                    if (key == null || (keyFilter != null && !keyFilter.test(key))) return;
                    map.computeIfAbsent(key, k -> new ArrayList<>()).add(r);
                })
                .map(GroupedIndex::freeze);
    }

    private static <T> GroupedIndex<T> freeze(Map<String, List<T>> mutable) {
        Map<String, List<T>> frozen = new LinkedHashMap<>();
        mutable.forEach((k, v) -> frozen.put(k, Collections.unmodifiableList(v)));
        return new GroupedIndex<>(Collections.unmodifiableMap(frozen));
    }

    public List<T> get(String key) {
        List<T> list = key == null ? null : groups.get(key);
        return list != null ? list : Collections.emptyList();
    }

    public T first(String key) {
        List<T> list = get(key);
        return list.isEmpty() ? null : list.get(0);
    }

    public boolean contains(String key) {
        return key != null && groups.containsKey(key);
    }

    public Set<String> keys() {
        return groups.keySet();
    }

    public int size() {
        return groups.size();
    }
}
