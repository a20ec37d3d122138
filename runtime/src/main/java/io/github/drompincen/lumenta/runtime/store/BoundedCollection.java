package io.github.drompincen.lumenta.runtime.store;

import io.github.drompincen.lumenta.protocol.resource.StoredResource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Insertion-ordered, id-keyed collection with oldest-first eviction. Not thread-safe;
 * {@link ResourceStore} guards every instance with its read/write lock.
 */
class BoundedCollection<T extends StoredResource> {

    private final Map<String, T> entries = new LinkedHashMap<>();
    private final int capacity;

    BoundedCollection(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0, was " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Stores the entry at the most-recent position, replacing any entry with the same id.
     *
     * @return entries evicted to respect the capacity
     */
    List<T> put(T entry) {
        entries.remove(entry.id());
        entries.put(entry.id(), entry);
        if (capacity == 0 || entries.size() <= capacity) {
            return List.of();
        }
        List<T> evicted = new ArrayList<>();
        Iterator<T> it = entries.values().iterator();
        while (entries.size() > capacity && it.hasNext()) {
            evicted.add(it.next());
            it.remove();
        }
        return evicted;
    }

    Optional<T> get(String id) {
        return Optional.ofNullable(entries.get(id));
    }

    /** The {@code limit} most recent entries matching the filter, oldest first. */
    List<T> latest(int limit, Predicate<? super T> filter) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, was " + limit);
        }
        List<T> matching = new ArrayList<>();
        for (T entry : entries.values()) {
            if (filter.test(entry)) {
                matching.add(entry);
            }
        }
        int from = Math.max(0, matching.size() - limit);
        return Collections.unmodifiableList(new ArrayList<>(matching.subList(from, matching.size())));
    }

    List<T> all() {
        return List.copyOf(entries.values());
    }
}
