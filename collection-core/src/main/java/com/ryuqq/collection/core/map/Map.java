package com.ryuqq.collection.core.map;

import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Uniform key-value container contract shared by every map backend.
 *
 * <p>This interface lets callers swap storage strategies (hash, array, linked-hash)
 * without touching call sites. Each backend trades lookup cost against ordering
 * guarantees; the operation set is identical.</p>
 *
 * <p><strong>Backends:</strong></p>
 * <ul>
 *   <li>{@link HashBackedMap}: O(1) average, no ordering guarantee</li>
 *   <li>{@link ArrayBackedMap}: insertion order, O(n) lookup, small datasets</li>
 *   <li>{@link LinkedHashBackedMap}: insertion order, O(1) lookup, LRU-capable</li>
 * </ul>
 *
 * <p><strong>Absence:</strong></p>
 * <ul>
 *   <li>Missing keys are reported through {@link Optional#empty()} or {@code false}, never an exception</li>
 *   <li>{@code null} keys and values are rejected with {@link IllegalArgumentException}</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> Not thread-safe. Callers sharing an instance across
 * threads must provide their own mutual exclusion.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * Map&lt;String, Integer&gt; map = Maps.newLinkedMap();
 * map.put("a", 1).put("b", 2);
 *
 * map.get("a").ifPresent(value -&gt; ...);
 * map.each((key, value) -&gt; ...);   // a=1, b=2
 * </pre>
 *
 * @param <K> key type
 * @param <V> value type
 * @author Collections Team
 * @since 1.0.0
 */
public interface Map<K, V> {

    /**
     * Inserts a new key or overwrites the value of an existing key.
     *
     * <p>Overwriting never changes the position of an existing key in ordered backends.</p>
     *
     * @param key the key to insert or update
     * @param value the value to associate with the key
     * @return this map, for method chaining
     * @throws IllegalArgumentException if key or value is null
     */
    Map<K, V> put(K key, V value);

    /**
     * Looks up the value stored for a key.
     *
     * @param key the key to look up
     * @return the stored value, or empty if the key is absent
     * @throws IllegalArgumentException if key is null
     */
    Optional<V> get(K key);

    /**
     * Removes a key if present.
     *
     * <p>Removing an absent key is a no-op, not an error.</p>
     *
     * @param key the key to remove
     * @return the value the key held before removal, or empty if the key was absent
     * @throws IllegalArgumentException if key is null
     */
    Optional<V> del(K key);

    /**
     * Returns the keys in backend order.
     *
     * @return an independent snapshot, safe to hold across later mutation
     */
    List<K> keys();

    /**
     * Returns the values in backend order.
     *
     * @return an independent snapshot, safe to hold across later mutation
     */
    List<V> values();

    /**
     * Returns the key-value pairs in backend order.
     *
     * @return an independent snapshot of {@link Entry} pairs
     */
    List<Entry<K, V>> entries();

    /**
     * Removes all entries.
     *
     * <p>Idempotent. The map remains usable and behaves as freshly constructed.</p>
     *
     * @return this map, for method chaining
     */
    Map<K, V> clear();

    /**
     * Number of entries. O(1) for every backend.
     *
     * @return entry count
     */
    int size();

    /**
     * Whether the map holds no entries.
     *
     * @return {@code true} when {@link #size()} is zero
     */
    boolean isEmpty();

    /**
     * Membership test without retrieving the value.
     *
     * @param key the key to test
     * @return {@code true} if the key is present
     * @throws IllegalArgumentException if key is null
     */
    boolean contains(K key);

    /**
     * Invokes the action once per entry, in backend order.
     *
     * <p>Traverses live state. Mutating the map from inside the action is undefined.</p>
     *
     * @param action callback receiving each key and value
     * @throws IllegalArgumentException if action is null
     */
    void each(BiConsumer<? super K, ? super V> action);

    /**
     * Reordering capability of this backend.
     *
     * <p>Only backends that can move entries in O(1) expose this capability;
     * the default is empty.</p>
     *
     * @return the reordering view of this map, or empty when unsupported
     */
    default Optional<Reorderable<K>> reorderable() {
        return Optional.empty();
    }
}
