package com.ryuqq.collection.core.map;

/**
 * Construction entry points for {@link Map} backends.
 *
 * <p>Backend-specific extensions ({@code first}, {@code last}, {@code moveToEnd},
 * {@code moveToFront}) live on the concrete types, so the typed factories return
 * those types. {@link #newMap(Backend)} returns the uniform contract only.</p>
 *
 * @author Collections Team
 * @since 1.0.0
 */
public final class Maps {

    // Utility class - prevent instantiation
    private Maps() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Creates the default backend (hash-backed).
     *
     * @return a new empty map with unspecified order
     */
    public static <K, V> Map<K, V> newMap() {
        return newHashMap();
    }

    /**
     * Creates a map of the requested backend.
     *
     * @param backend the storage strategy
     * @return a new empty map
     * @throws IllegalArgumentException if backend is null
     */
    public static <K, V> Map<K, V> newMap(Backend backend) {
        if (backend == null) {
            throw new IllegalArgumentException("backend cannot be null");
        }
        return switch (backend) {
            case HASH -> newHashMap();
            case ARRAY -> newArrayMap();
            case LINKED -> newLinkedMap();
        };
    }

    public static <K, V> HashBackedMap<K, V> newHashMap() {
        return new HashBackedMap<>();
    }

    public static <K, V> ArrayBackedMap<K, V> newArrayMap() {
        return new ArrayBackedMap<>();
    }

    public static <K, V> LinkedHashBackedMap<K, V> newLinkedMap() {
        return new LinkedHashBackedMap<>();
    }
}
