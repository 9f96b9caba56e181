package com.ryuqq.collection.adapter.cache;

/**
 * Callback invoked when {@link LruCache} evicts its least recently used entry.
 *
 * <p>The entry has already been removed when the callback runs. An exception thrown
 * here propagates to the caller of {@link LruCache#put(Object, Object)}; the new entry
 * is not inserted in that case.</p>
 *
 * @param <K> key type
 * @param <V> value type
 * @author Collections Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EvictionListener<K, V> {

    /**
     * @param key evicted key
     * @param value value the key held
     */
    void onEviction(K key, V value);

    /**
     * Listener that ignores every eviction.
     *
     * @return a no-op listener
     */
    static <K, V> EvictionListener<K, V> noOp() {
        return (key, value) -> {
            // NoOp
        };
    }
}
