package com.ryuqq.collection.core.map;

/**
 * 키-값 스냅샷.
 *
 * <p>열거 연산({@code entries()}, {@code first()}, {@code last()})이 반환하는 불변 쌍입니다.
 * 저장 단위가 아니므로 Entry를 보관해도 원본 Map의 이후 변경이 반영되지 않습니다.</p>
 *
 * @param key 키 (null 불가)
 * @param value 값 (null 불가)
 *
 * @author Collections Team
 * @since 1.0.0
 */
public record Entry<K, V>(
    K key,
    V value
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException key 또는 value가 null인 경우
     */
    public Entry {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    /**
     * Entry 생성.
     *
     * @param key 키
     * @param value 값
     * @return Entry 인스턴스
     * @throws IllegalArgumentException key 또는 value가 null인 경우
     */
    public static <K, V> Entry<K, V> of(K key, V value) {
        return new Entry<>(key, value);
    }

    @Override
    public String toString() {
        return key + ":" + value;
    }
}
