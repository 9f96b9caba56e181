/**
 * Map contract and storage backends.
 *
 * <p>This package defines the uniform {@link com.ryuqq.collection.core.map.Map} contract
 * and its three interchangeable backends.</p>
 *
 * <h2>Backends</h2>
 * <ul>
 *   <li>{@link com.ryuqq.collection.core.map.HashBackedMap} - hash table, unspecified order</li>
 *   <li>{@link com.ryuqq.collection.core.map.ArrayBackedMap} - parallel arrays, insertion order</li>
 *   <li>{@link com.ryuqq.collection.core.map.LinkedHashBackedMap} - hash index + doubly linked list, insertion order, O(1) reordering</li>
 * </ul>
 *
 * <h2>Capabilities</h2>
 * <ul>
 *   <li>{@link com.ryuqq.collection.core.map.OrderedMap} - {@code first()} / {@code last()} on ordered backends</li>
 *   <li>{@link com.ryuqq.collection.core.map.Reorderable} - {@code moveToEnd()} / {@code moveToFront()} on the linked backend</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Pluggability:</strong> Call sites depend on the contract, backends are chosen at construction</li>
 *   <li><strong>Explicit Absence:</strong> Lookups report absence with {@link java.util.Optional} or {@code false}</li>
 *   <li><strong>Single-threaded:</strong> No internal locking; callers synchronize externally</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Collections Team
 */
package com.ryuqq.collection.core.map;
