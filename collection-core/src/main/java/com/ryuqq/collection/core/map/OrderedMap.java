package com.ryuqq.collection.core.map;

import java.util.Optional;

/**
 * A {@link Map} whose traversal order is its insertion order.
 *
 * <p>Adds O(1) access to both ends of that order. Updating an existing key keeps
 * its position; deleting a key removes exactly one position without reordering
 * the rest.</p>
 *
 * @param <K> key type
 * @param <V> value type
 * @author Collections Team
 * @since 1.0.0
 */
public interface OrderedMap<K, V> extends Map<K, V> {

    /**
     * Oldest entry in traversal order.
     *
     * @return the first entry, or empty if the map is empty
     */
    Optional<Entry<K, V>> first();

    /**
     * Newest entry in traversal order.
     *
     * @return the last entry, or empty if the map is empty
     */
    Optional<Entry<K, V>> last();

    @Override
    OrderedMap<K, V> put(K key, V value);

    @Override
    OrderedMap<K, V> clear();
}
