package com.ryuqq.collection.adapter.cache;

import com.ryuqq.collection.core.map.Entry;
import com.ryuqq.collection.core.map.LinkedHashBackedMap;
import com.ryuqq.collection.core.map.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * 용량 제한 LRU 캐시.
 *
 * <p>{@link LinkedHashBackedMap}의 리스트 순서를 사용 순서로 해석합니다:
 * front = 가장 오래 사용되지 않은 항목, end = 가장 최근 사용된 항목.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <pre>
 * get(k)    : 조회 성공 시 moveToEnd(k) → 최근 사용으로 표시
 * put(k, v) : 기존 키 → 값 갱신 + moveToEnd(k)
 *             신규 키 → size ≥ capacity 이면 front 축출 → tail에 삽입
 * remove(k) : 즉시 삭제 (리스너 호출 없음)
 * </pre>
 *
 * <p><strong>예시 (capacity=2):</strong></p>
 * <pre>
 * put("x"), put("y")   → [x, y]
 * get("x")             → [y, x]
 * put("z")             → "y" 축출 → [x, z]
 * </pre>
 *
 * <p><strong>Thread Safety:</strong> 동기화하지 않습니다. 여러 스레드에서 공유하려면
 * 호출자가 외부에서 상호 배제를 제공해야 합니다.</p>
 *
 * @param <K> 키 타입
 * @param <V> 값 타입
 * @author Collections Team
 * @since 1.0.0
 */
public final class LruCache<K, V> {

    private static final Logger log = LoggerFactory.getLogger(LruCache.class);

    private final LinkedHashBackedMap<K, V> entries;
    private final LruCacheConfig config;
    private final EvictionListener<K, V> evictionListener;

    /**
     * 리스너 없이 생성.
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public LruCache(LruCacheConfig config) {
        this(config, EvictionListener.noOp());
    }

    /**
     * 생성자.
     *
     * @param config 설정
     * @param evictionListener 축출 리스너
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public LruCache(LruCacheConfig config, EvictionListener<K, V> evictionListener) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (evictionListener == null) {
            throw new IllegalArgumentException("evictionListener cannot be null");
        }
        this.entries = Maps.newLinkedMap();
        this.config = config;
        this.evictionListener = evictionListener;
        log.info("LruCache created with capacity {}", config.capacity());
    }

    /**
     * 값 조회 및 최근 사용 표시.
     *
     * @param key 키
     * @return 저장된 값 (없으면 empty)
     * @throws IllegalArgumentException key가 null인 경우
     */
    public Optional<V> get(K key) {
        Optional<V> value = entries.get(key);
        if (value.isPresent()) {
            entries.moveToEnd(key);
        }
        return value;
    }

    /**
     * 값 저장.
     *
     * <p>신규 키이고 캐시가 가득 찬 경우 가장 오래 사용되지 않은 항목을 먼저 축출합니다.</p>
     *
     * @param key 키
     * @param value 값
     * @return 이 캐시 (메서드 체이닝)
     * @throws IllegalArgumentException key 또는 value가 null인 경우
     */
    public LruCache<K, V> put(K key, V value) {
        if (entries.contains(key)) {
            entries.put(key, value);
            entries.moveToEnd(key);
            return this;
        }

        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        while (entries.size() >= config.capacity()) {
            evictEldest();
        }
        entries.put(key, value);
        return this;
    }

    /**
     * 항목 삭제.
     *
     * @param key 키
     * @return 삭제된 값 (없었으면 empty)
     * @throws IllegalArgumentException key가 null인 경우
     */
    public Optional<V> remove(K key) {
        return entries.del(key);
    }

    /**
     * 존재 여부 확인 (사용 순서 변경 없음).
     *
     * @param key 키
     * @return 존재 여부
     * @throws IllegalArgumentException key가 null인 경우
     */
    public boolean contains(K key) {
        return entries.contains(key);
    }

    /**
     * 키 목록 조회.
     *
     * @return 가장 오래 사용되지 않은 키부터 가장 최근 사용된 키 순서의 스냅샷
     */
    public List<K> keys() {
        return entries.keys();
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return config.capacity();
    }

    /**
     * 모든 항목 삭제 (리스너 호출 없음).
     */
    public void clear() {
        entries.clear();
        log.debug("LruCache cleared");
    }

    private void evictEldest() {
        Entry<K, V> eldest = entries.first()
            .orElseThrow(() -> new IllegalStateException("Cannot evict from an empty cache"));
        entries.del(eldest.key());
        log.debug("LruCache evicted {} (capacity {})", eldest.key(), config.capacity());
        evictionListener.onEviction(eldest.key(), eldest.value());
    }

    @Override
    public String toString() {
        return "LruCache{capacity=" + config.capacity() + ", entries=" + entries + '}';
    }
}
