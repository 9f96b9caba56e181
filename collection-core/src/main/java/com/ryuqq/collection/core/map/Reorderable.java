package com.ryuqq.collection.core.map;

/**
 * O(1) reordering capability.
 *
 * <p>Implemented only by containers that can relink an entry without shifting
 * the others. This is the primitive behind LRU eviction: {@link #moveToEnd(Object)}
 * on access marks an entry most recently used, and the front holds the eviction
 * candidate.</p>
 *
 * <p><strong>Behavior:</strong></p>
 * <ul>
 *   <li>Absent key: returns {@code false}, order unchanged</li>
 *   <li>Key already at the target extreme: returns {@code true}, order unchanged</li>
 *   <li>Otherwise: relinks the entry and returns {@code true}</li>
 * </ul>
 *
 * @param <K> key type
 * @author Collections Team
 * @since 1.0.0
 * @see Map#reorderable()
 */
public interface Reorderable<K> {

    /**
     * Moves an existing key to the end (newest position).
     *
     * @param key the key to move
     * @return {@code true} if the key is present
     * @throws IllegalArgumentException if key is null
     */
    boolean moveToEnd(K key);

    /**
     * Moves an existing key to the front (oldest position).
     *
     * @param key the key to move
     * @return {@code true} if the key is present
     * @throws IllegalArgumentException if key is null
     */
    boolean moveToFront(K key);
}
