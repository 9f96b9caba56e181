package com.ryuqq.collection.core.map;

/**
 * 저장 백엔드 종류.
 *
 * <p>백엔드 집합은 고정되어 있으며, 각 상수는 순서 보장 여부와 재정렬 지원 여부를 함께 표현합니다.</p>
 *
 * <p><strong>선택 가이드:</strong></p>
 * <ul>
 *   <li>HASH: 순서 불필요, O(1) 연산</li>
 *   <li>ARRAY: 삽입 순서 필요, 소규모 데이터 (O(n) 조회)</li>
 *   <li>LINKED: 삽입 순서 + O(1) 연산, LRU 캐시 구성 가능</li>
 * </ul>
 *
 * @author Collections Team
 * @since 1.0.0
 */
public enum Backend {

    /** 해시 테이블, 순서 보장 없음 */
    HASH(false, false),

    /** 병렬 배열, 삽입 순서 보장 */
    ARRAY(true, false),

    /** 해시 인덱스 + 이중 연결 리스트, 삽입 순서 보장 및 O(1) 재정렬 */
    LINKED(true, true);

    private final boolean ordered;
    private final boolean reorderable;

    Backend(boolean ordered, boolean reorderable) {
        this.ordered = ordered;
        this.reorderable = reorderable;
    }

    /**
     * 순회 순서가 삽입 순서인지 확인.
     *
     * @return 삽입 순서 보장 여부
     */
    public boolean isOrdered() {
        return ordered;
    }

    /**
     * moveToEnd/moveToFront 지원 여부 확인.
     *
     * @return O(1) 재정렬 지원 여부
     */
    public boolean isReorderable() {
        return reorderable;
    }
}
