/**
 * Set 계약 및 Map 기반 어댑터.
 *
 * <p>모든 Set은 {@code Map<T, Unit>}을 내장하여 구성됩니다. 원소 순서는 내장 백엔드를 따릅니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.collection.core.set.Set} - Set 계약</li>
 *   <li>{@link com.ryuqq.collection.core.set.MapBackedSet} - 임의의 Map 백엔드 위임 어댑터</li>
 *   <li>{@link com.ryuqq.collection.core.set.LinkedSet} - 재정렬 기능이 타입으로 보장되는 Set</li>
 *   <li>{@link com.ryuqq.collection.core.set.Unit} - 값 자리 센티널</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Collections Team
 */
package com.ryuqq.collection.core.set;
