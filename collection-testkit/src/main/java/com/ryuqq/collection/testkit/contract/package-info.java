/**
 * Contract Test bases for Map and Set implementations.
 *
 * <p>Each backend proves its conformance by subclassing the matching base class
 * and supplying a factory method.</p>
 *
 * <h2>Base Classes</h2>
 * <ul>
 *   <li>{@link com.ryuqq.collection.testkit.contract.AbstractMapContractTest} - uniform Map contract</li>
 *   <li>{@link com.ryuqq.collection.testkit.contract.AbstractOrderedMapContractTest} - insertion-order guarantees</li>
 *   <li>{@link com.ryuqq.collection.testkit.contract.AbstractSetContractTest} - uniform Set contract</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Collections Team
 */
package com.ryuqq.collection.testkit.contract;
