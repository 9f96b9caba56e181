package com.ryuqq.collection.core.map;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Array-backed {@link OrderedMap}.
 *
 * <p>Keeps two index-aligned lists, one for keys and one for values. Position
 * {@code i} in both lists is one logical entry, so insertion order is array order
 * by construction.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>keys:</strong> ArrayList&lt;K&gt; - keys in insertion order</li>
 *   <li><strong>values:</strong> ArrayList&lt;V&gt; - values aligned with keys</li>
 * </ul>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>put:</strong> O(1) amortized for a new key (append), O(n) for an existing key (scan)</li>
 *   <li><strong>get / contains:</strong> O(n) linear scan</li>
 *   <li><strong>del:</strong> O(n) scan plus O(n) shift to close the gap</li>
 *   <li><strong>first / last:</strong> O(1)</li>
 *   <li><strong>clear:</strong> truncates both lists, capacity is reused</li>
 * </ul>
 *
 * <p>Suited to small datasets where order matters and lookups are infrequent.
 * For large datasets use {@link LinkedHashBackedMap}.</p>
 *
 * @param <K> key type
 * @param <V> value type
 * @author Collections Team
 * @since 1.0.0
 */
public class ArrayBackedMap<K, V> implements OrderedMap<K, V> {

    private final ArrayList<K> keys;
    private final ArrayList<V> values;

    /**
     * Creates an empty map.
     */
    public ArrayBackedMap() {
        this.keys = new ArrayList<>();
        this.values = new ArrayList<>();
    }

    /**
     * {@inheritDoc}
     *
     * <p>An existing key is overwritten at its current index.</p>
     */
    @Override
    public ArrayBackedMap<K, V> put(K key, V value) {
        int index = indexOf(key);
        MapSupport.requireValue(value);
        if (index >= 0) {
            values.set(index, value);
        } else {
            keys.add(key);
            values.add(value);
        }
        return this;
    }

    @Override
    public Optional<V> get(K key) {
        int index = indexOf(key);
        return index >= 0 ? Optional.of(values.get(index)) : Optional.empty();
    }

    /**
     * {@inheritDoc}
     *
     * <p>Remaining entries keep their relative order.</p>
     */
    @Override
    public Optional<V> del(K key) {
        int index = indexOf(key);
        if (index < 0) {
            return Optional.empty();
        }
        keys.remove(index);
        return Optional.of(values.remove(index));
    }

    @Override
    public List<K> keys() {
        return new ArrayList<>(keys);
    }

    @Override
    public List<V> values() {
        return new ArrayList<>(values);
    }

    @Override
    public List<Entry<K, V>> entries() {
        List<Entry<K, V>> result = new ArrayList<>(keys.size());
        for (int i = 0; i < keys.size(); i++) {
            result.add(Entry.of(keys.get(i), values.get(i)));
        }
        return result;
    }

    @Override
    public ArrayBackedMap<K, V> clear() {
        keys.clear();
        values.clear();
        return this;
    }

    @Override
    public int size() {
        return keys.size();
    }

    @Override
    public boolean isEmpty() {
        return keys.isEmpty();
    }

    @Override
    public boolean contains(K key) {
        return indexOf(key) >= 0;
    }

    @Override
    public void each(BiConsumer<? super K, ? super V> action) {
        MapSupport.requireAction(action);
        for (int i = 0; i < keys.size(); i++) {
            action.accept(keys.get(i), values.get(i));
        }
    }

    @Override
    public Optional<Entry<K, V>> first() {
        if (keys.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Entry.of(keys.get(0), values.get(0)));
    }

    @Override
    public Optional<Entry<K, V>> last() {
        if (keys.isEmpty()) {
            return Optional.empty();
        }
        int lastIndex = keys.size() - 1;
        return Optional.of(Entry.of(keys.get(lastIndex), values.get(lastIndex)));
    }

    @Override
    public String toString() {
        return MapSupport.render(this);
    }

    private int indexOf(K key) {
        MapSupport.requireKey(key);
        for (int i = 0; i < keys.size(); i++) {
            if (key.equals(keys.get(i))) {
                return i;
            }
        }
        return -1;
    }
}
