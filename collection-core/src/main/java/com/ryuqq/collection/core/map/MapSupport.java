package com.ryuqq.collection.core.map;

import java.util.StringJoiner;

/**
 * 백엔드 공통 검증 및 렌더링.
 *
 * <p><strong>렌더링 형식:</strong></p>
 * <pre>
 * map[k1:v1 k2:v2]   // each() 순서
 * map[]              // 비어 있는 경우
 * </pre>
 *
 * @author Collections Team
 * @since 1.0.0
 */
final class MapSupport {

    // Utility class - prevent instantiation
    private MapSupport() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static <K> K requireKey(K key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return key;
    }

    static <V> V requireValue(V value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        return value;
    }

    static <T> T requireAction(T action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        return action;
    }

    /**
     * Map을 each() 순서대로 문자열로 변환.
     *
     * @param map 대상 Map
     * @return {@code map[k1:v1 k2:v2]} 형식 문자열
     */
    static String render(Map<?, ?> map) {
        StringJoiner joiner = new StringJoiner(" ", "map[", "]");
        map.each((key, value) -> joiner.add(key + ":" + value));
        return joiner.toString();
    }
}
