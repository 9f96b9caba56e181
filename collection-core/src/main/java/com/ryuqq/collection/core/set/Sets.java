package com.ryuqq.collection.core.set;

import com.ryuqq.collection.core.map.Backend;
import com.ryuqq.collection.core.map.Map;
import com.ryuqq.collection.core.map.Maps;

/**
 * Construction entry points for {@link Set} implementations.
 *
 * <p><strong>Quick Decision Guide:</strong></p>
 * <ul>
 *   <li>O(1) and order does not matter → {@link #newHashSet()}</li>
 *   <li>Small dataset and order matters → {@link #newArraySet()}</li>
 *   <li>Large dataset and order matters, or LRU bookkeeping → {@link #newLinkedSet()}</li>
 * </ul>
 *
 * @author Collections Team
 * @since 1.0.0
 */
public final class Sets {

    // Utility class - prevent instantiation
    private Sets() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Creates the default set (hash-backed).
     *
     * @return a new empty set with unspecified order
     */
    public static <T> Set<T> newSet() {
        return newHashSet();
    }

    /**
     * Creates a set over the requested backend.
     *
     * @param backend the storage strategy
     * @return a new empty set
     * @throws IllegalArgumentException if backend is null
     */
    public static <T> MapBackedSet<T> newSet(Backend backend) {
        if (backend == null) {
            throw new IllegalArgumentException("backend cannot be null");
        }
        return switch (backend) {
            case HASH -> newHashSet();
            case ARRAY -> newArraySet();
            case LINKED -> newLinkedSet();
        };
    }

    public static <T> MapBackedSet<T> newHashSet() {
        return new MapBackedSet<>(Maps.newHashMap());
    }

    public static <T> MapBackedSet<T> newArraySet() {
        return new MapBackedSet<>(Maps.newArrayMap());
    }

    public static <T> LinkedSet<T> newLinkedSet() {
        return new LinkedSet<>();
    }

    /**
     * Wraps an existing map as a set of its keys.
     *
     * @param data the map to adopt
     * @return a set view that owns the map from now on
     * @throws IllegalArgumentException if data is null
     */
    public static <T> MapBackedSet<T> backedBy(Map<T, Unit> data) {
        return new MapBackedSet<>(data);
    }
}
