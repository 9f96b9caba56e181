package com.ryuqq.collection.core.set;

import com.ryuqq.collection.core.map.Map;
import com.ryuqq.collection.core.map.Reorderable;

import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * {@link Set} adapter over any {@link Map} backend.
 *
 * <p>Every element is one key of the embedded {@code Map<T, Unit>}; the value is
 * always {@link Unit#INSTANCE}. All operations forward to the embedded map.</p>
 *
 * <p><strong>Forwarding:</strong></p>
 * <pre>
 * add(t)        → put(t, Unit.INSTANCE)
 * remove(t)     → del(t), value discarded
 * contains(t)   → contains(t)
 * elems()       → keys()
 * moveToEnd(t)  → reorderable().moveToEnd(t), false when unsupported
 * </pre>
 *
 * <p>Reordering never downcasts the embedded map: it goes through
 * {@link Map#reorderable()}, which only the linked backend provides.</p>
 *
 * @param <T> element type
 * @author Collections Team
 * @since 1.0.0
 */
public class MapBackedSet<T> implements Set<T> {

    private final Map<T, Unit> data;

    /**
     * Creates a set over the given map.
     *
     * <p>The map is adopted, not copied: existing keys become elements.</p>
     *
     * @param data embedded map
     * @throws IllegalArgumentException if data is null
     */
    public MapBackedSet(Map<T, Unit> data) {
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        this.data = data;
    }

    @Override
    public MapBackedSet<T> add(T element) {
        data.put(element, Unit.INSTANCE);
        return this;
    }

    @Override
    public MapBackedSet<T> remove(T element) {
        data.del(element);
        return this;
    }

    @Override
    public boolean contains(T element) {
        return data.contains(element);
    }

    @Override
    public List<T> elems() {
        return data.keys();
    }

    @Override
    public MapBackedSet<T> clear() {
        data.clear();
        return this;
    }

    @Override
    public int size() {
        return data.size();
    }

    @Override
    public boolean isEmpty() {
        return data.isEmpty();
    }

    @Override
    public Optional<Reorderable<T>> reorderable() {
        return data.reorderable();
    }

    /**
     * Moves an element to the end when the backend supports it.
     *
     * @param element the element to move
     * @return {@code true} if moved (or already last); {@code false} if absent or unsupported
     * @throws IllegalArgumentException if element is null
     */
    public boolean moveToEnd(T element) {
        requireElement(element);
        return data.reorderable()
            .map(reorderable -> reorderable.moveToEnd(element))
            .orElse(false);
    }

    /**
     * Moves an element to the front when the backend supports it.
     *
     * @param element the element to move
     * @return {@code true} if moved (or already first); {@code false} if absent or unsupported
     * @throws IllegalArgumentException if element is null
     */
    public boolean moveToFront(T element) {
        requireElement(element);
        return data.reorderable()
            .map(reorderable -> reorderable.moveToFront(element))
            .orElse(false);
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(" ", "set[", "]");
        data.each((element, unit) -> joiner.add(String.valueOf(element)));
        return joiner.toString();
    }

    private static void requireElement(Object element) {
        if (element == null) {
            throw new IllegalArgumentException("element cannot be null");
        }
    }
}
