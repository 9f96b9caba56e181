/**
 * Cache Adapter Layer - LinkedHashBackedMap 기반 LRU 캐시.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.collection.adapter.cache.LruCache} - 용량 제한 LRU 캐시</li>
 *   <li>{@link com.ryuqq.collection.adapter.cache.LruCacheConfig} - 캐시 설정 (불변 record)</li>
 *   <li>{@link com.ryuqq.collection.adapter.cache.EvictionListener} - 축출 콜백</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-cache (LruCache)
 *   ↓ depends on
 * core/map (LinkedHashBackedMap: moveToEnd, first, del)
 * </pre>
 *
 * @author Collections Team
 * @since 1.0.0
 */
package com.ryuqq.collection.adapter.cache;
