package com.ryuqq.collection.core.map;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Linked-hash {@link OrderedMap} with O(1) reordering.
 *
 * <p>Combines a hash index with an intrusive doubly linked list. The list owns every
 * node exactly once and threads them from {@code head} (oldest) to {@code tail}
 * (newest); the index maps each key to its node without owning it.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>index:</strong> HashMap&lt;K, Node&gt; - O(1) key → node lookup</li>
 *   <li><strong>head / tail:</strong> ends of the node chain, null when empty</li>
 * </ul>
 *
 * <p><strong>Invariants:</strong></p>
 * <ul>
 *   <li>index size == list length == {@link #size()}</li>
 *   <li>{@code head.prev == null}, {@code tail.next == null}, no cycles</li>
 *   <li>one node per key: updating a key mutates its node in place</li>
 * </ul>
 *
 * <p><strong>Key Lifecycle:</strong></p>
 * <pre>
 * absent ──put──▶ present (indexed, linked head..tail) ──del──▶ absent
 *                   │  ▲
 *                   └──┘ put (value only) / moveToEnd / moveToFront
 * </pre>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>put / get / del / contains:</strong> O(1) average</li>
 *   <li><strong>moveToEnd / moveToFront / first / last:</strong> O(1)</li>
 *   <li><strong>keys / values / entries / each:</strong> O(n), head to tail</li>
 *   <li><strong>clear:</strong> O(1), index and list dropped wholesale</li>
 * </ul>
 *
 * <p><strong>LRU Usage Example:</strong></p>
 * <pre>
 * LinkedHashBackedMap&lt;String, Integer&gt; map = Maps.newLinkedMap();
 * map.put("x", 1).put("y", 2);
 *
 * // access marks "x" as most recently used
 * map.moveToEnd("x");                 // [y, x]
 *
 * // evict the least recently used entry before inserting
 * map.first().ifPresent(eldest -&gt; map.del(eldest.key()));
 * map.put("z", 3);                    // [x, z]
 * </pre>
 *
 * @param <K> key type
 * @param <V> value type
 * @author Collections Team
 * @since 1.0.0
 */
public class LinkedHashBackedMap<K, V> implements OrderedMap<K, V>, Reorderable<K> {

    private HashMap<K, Node<K, V>> index;
    private Node<K, V> head;
    private Node<K, V> tail;

    /**
     * Creates an empty map.
     */
    public LinkedHashBackedMap() {
        this.index = new HashMap<>();
    }

    /**
     * {@inheritDoc}
     *
     * <p>An existing key keeps its list position; a new key is linked after the tail.</p>
     */
    @Override
    public LinkedHashBackedMap<K, V> put(K key, V value) {
        MapSupport.requireKey(key);
        MapSupport.requireValue(value);

        Node<K, V> existing = index.get(key);
        if (existing != null) {
            existing.value = value;
            return this;
        }

        Node<K, V> node = new Node<>(key, value);
        linkLast(node);
        index.put(key, node);
        return this;
    }

    @Override
    public Optional<V> get(K key) {
        Node<K, V> node = index.get(MapSupport.requireKey(key));
        return node != null ? Optional.of(node.value) : Optional.empty();
    }

    @Override
    public Optional<V> del(K key) {
        Node<K, V> node = index.remove(MapSupport.requireKey(key));
        if (node == null) {
            return Optional.empty();
        }
        unlink(node);
        return Optional.of(node.value);
    }

    @Override
    public List<K> keys() {
        List<K> result = new ArrayList<>(index.size());
        for (Node<K, V> current = head; current != null; current = current.next) {
            result.add(current.key);
        }
        return result;
    }

    @Override
    public List<V> values() {
        List<V> result = new ArrayList<>(index.size());
        for (Node<K, V> current = head; current != null; current = current.next) {
            result.add(current.value);
        }
        return result;
    }

    @Override
    public List<Entry<K, V>> entries() {
        List<Entry<K, V>> result = new ArrayList<>(index.size());
        for (Node<K, V> current = head; current != null; current = current.next) {
            result.add(Entry.of(current.key, current.value));
        }
        return result;
    }

    @Override
    public LinkedHashBackedMap<K, V> clear() {
        index = new HashMap<>();
        head = null;
        tail = null;
        return this;
    }

    @Override
    public int size() {
        return index.size();
    }

    @Override
    public boolean isEmpty() {
        return index.isEmpty();
    }

    @Override
    public boolean contains(K key) {
        return index.containsKey(MapSupport.requireKey(key));
    }

    @Override
    public void each(BiConsumer<? super K, ? super V> action) {
        MapSupport.requireAction(action);
        for (Node<K, V> current = head; current != null; current = current.next) {
            action.accept(current.key, current.value);
        }
    }

    @Override
    public Optional<Entry<K, V>> first() {
        return head != null ? Optional.of(Entry.of(head.key, head.value)) : Optional.empty();
    }

    @Override
    public Optional<Entry<K, V>> last() {
        return tail != null ? Optional.of(Entry.of(tail.key, tail.value)) : Optional.empty();
    }

    /**
     * {@inheritDoc}
     *
     * <p>Marks the entry as most recently used.</p>
     */
    @Override
    public boolean moveToEnd(K key) {
        Node<K, V> node = index.get(MapSupport.requireKey(key));
        if (node == null) {
            return false;
        }
        if (node != tail) {
            unlink(node);
            linkLast(node);
        }
        return true;
    }

    /**
     * {@inheritDoc}
     *
     * <p>Marks the entry as the eviction candidate.</p>
     */
    @Override
    public boolean moveToFront(K key) {
        Node<K, V> node = index.get(MapSupport.requireKey(key));
        if (node == null) {
            return false;
        }
        if (node != head) {
            unlink(node);
            linkFirst(node);
        }
        return true;
    }

    @Override
    public Optional<Reorderable<K>> reorderable() {
        return Optional.of(this);
    }

    /**
     * Renders entries in list order, e.g. {@code map[a:1 b:2]}.
     *
     * @return the rendered map, {@code map[]} when empty
     */
    @Override
    public String toString() {
        return MapSupport.render(this);
    }

    private void linkLast(Node<K, V> node) {
        node.prev = tail;
        node.next = null;
        if (tail != null) {
            tail.next = node;
        } else {
            head = node;
        }
        tail = node;
    }

    private void linkFirst(Node<K, V> node) {
        node.prev = null;
        node.next = head;
        if (head != null) {
            head.prev = node;
        } else {
            tail = node;
        }
        head = node;
    }

    // Splices node out of the chain; index membership is the caller's concern.
    private void unlink(Node<K, V> node) {
        if (node.prev != null) {
            node.prev.next = node.next;
        } else {
            head = node.next;
        }
        if (node.next != null) {
            node.next.prev = node.prev;
        } else {
            tail = node.prev;
        }
        node.prev = null;
        node.next = null;
    }

    private static final class Node<K, V> {

        private final K key;
        private V value;
        private Node<K, V> prev;
        private Node<K, V> next;

        private Node(K key, V value) {
            this.key = key;
            this.value = value;
        }
    }
}
