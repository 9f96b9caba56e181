package com.ryuqq.collection.core.set;

/**
 * 정보를 담지 않는 센티널 값.
 *
 * <p>{@code Map<T, Unit>}의 값 자리에 사용되어 키-값 Map을 순수 Set으로 변환합니다.</p>
 *
 * @author Collections Team
 * @since 1.0.0
 */
public enum Unit {

    INSTANCE;

    @Override
    public String toString() {
        return "{}";
    }
}
