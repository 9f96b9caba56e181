package com.ryuqq.collection.core.map;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Hash-only {@link Map} backend.
 *
 * <p>Direct pass-through to {@link HashMap}. This is the baseline, order-agnostic
 * backend: fastest for general use, but traversal order is unspecified and callers
 * must not depend on it.</p>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>put / get / del / contains:</strong> O(1) average</li>
 *   <li><strong>keys / values / entries / each:</strong> O(n), unspecified order</li>
 *   <li><strong>clear:</strong> O(1), replaces the table</li>
 * </ul>
 *
 * @param <K> key type
 * @param <V> value type
 * @author Collections Team
 * @since 1.0.0
 */
public class HashBackedMap<K, V> implements Map<K, V> {

    private HashMap<K, V> table;

    /**
     * Creates an empty map.
     */
    public HashBackedMap() {
        this.table = new HashMap<>();
    }

    @Override
    public HashBackedMap<K, V> put(K key, V value) {
        table.put(MapSupport.requireKey(key), MapSupport.requireValue(value));
        return this;
    }

    @Override
    public Optional<V> get(K key) {
        return Optional.ofNullable(table.get(MapSupport.requireKey(key)));
    }

    @Override
    public Optional<V> del(K key) {
        return Optional.ofNullable(table.remove(MapSupport.requireKey(key)));
    }

    @Override
    public List<K> keys() {
        return new ArrayList<>(table.keySet());
    }

    @Override
    public List<V> values() {
        return new ArrayList<>(table.values());
    }

    @Override
    public List<Entry<K, V>> entries() {
        List<Entry<K, V>> result = new ArrayList<>(table.size());
        table.forEach((key, value) -> result.add(Entry.of(key, value)));
        return result;
    }

    @Override
    public HashBackedMap<K, V> clear() {
        table = new HashMap<>();
        return this;
    }

    @Override
    public int size() {
        return table.size();
    }

    @Override
    public boolean isEmpty() {
        return table.isEmpty();
    }

    @Override
    public boolean contains(K key) {
        return table.containsKey(MapSupport.requireKey(key));
    }

    @Override
    public void each(BiConsumer<? super K, ? super V> action) {
        table.forEach(MapSupport.requireAction(action));
    }

    @Override
    public String toString() {
        return MapSupport.render(this);
    }
}
