package com.ryuqq.collection.core.set;

import com.ryuqq.collection.core.map.Reorderable;

import java.util.List;
import java.util.Optional;

/**
 * Uniform container of unique elements.
 *
 * <p>Every implementation composes a {@link com.ryuqq.collection.core.map.Map} backend,
 * so element order follows that backend: unspecified for hash, insertion order for
 * array and linked.</p>
 *
 * <p><strong>Implementations:</strong></p>
 * <ul>
 *   <li>{@link Sets#newHashSet()}: O(1), no order</li>
 *   <li>{@link Sets#newArraySet()}: insertion order, O(n), small datasets</li>
 *   <li>{@link Sets#newLinkedSet()}: insertion order, O(1), LRU-capable</li>
 * </ul>
 *
 * @param <T> element type
 * @author Collections Team
 * @since 1.0.0
 */
public interface Set<T> {

    /**
     * Adds an element. Adding a present element changes neither size nor order.
     *
     * @param element the element to add
     * @return this set, for method chaining
     * @throws IllegalArgumentException if element is null
     */
    Set<T> add(T element);

    /**
     * Removes an element if present.
     *
     * @param element the element to remove
     * @return this set, for method chaining
     * @throws IllegalArgumentException if element is null
     */
    Set<T> remove(T element);

    /**
     * @param element the element to test
     * @return {@code true} if the element is present
     * @throws IllegalArgumentException if element is null
     */
    boolean contains(T element);

    /**
     * Returns the elements in the backend's order.
     *
     * @return an independent snapshot
     */
    List<T> elems();

    /**
     * Removes all elements.
     *
     * @return this set, for method chaining
     */
    Set<T> clear();

    int size();

    boolean isEmpty();

    /**
     * Reordering capability of the embedded backend.
     *
     * @return the reordering view, or empty when the backend cannot reorder
     */
    default Optional<Reorderable<T>> reorderable() {
        return Optional.empty();
    }
}
