package com.ryuqq.collection.adapter.cache;

/**
 * LruCache 설정 (불변 record).
 *
 * <p>이 record는 LruCache의 동작을 제어하는 설정값을 담고 있습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>capacity: 최대 항목 수 (기본 128)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>높은 적중률: capacity 증가 (메모리 사용량 증가)</li>
 *   <li>메모리 절약: capacity 감소 (축출 빈도 증가)</li>
 * </ul>
 *
 * @author Collections Team
 * @since 1.0.0
 * @param capacity 최대 항목 수 (1 이상이어야 함)
 */
public record LruCacheConfig(int capacity) {

    /** 기본 최대 항목 수 */
    public static final int DEFAULT_CAPACITY = 128;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: capacity=128</p>
     */
    public LruCacheConfig() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public LruCacheConfig {
        if (capacity <= 0) {
            throw new IllegalArgumentException(
                "capacity must be positive (current: " + capacity + ")"
            );
        }
    }

    /**
     * capacity만 변경한 새 인스턴스 생성.
     *
     * @param capacity 새로운 최대 항목 수
     * @return 새 LruCacheConfig 인스턴스
     */
    public LruCacheConfig withCapacity(int capacity) {
        return new LruCacheConfig(capacity);
    }
}
