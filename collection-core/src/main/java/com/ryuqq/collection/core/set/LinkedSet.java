package com.ryuqq.collection.core.set;

import com.ryuqq.collection.core.map.Entry;
import com.ryuqq.collection.core.map.LinkedHashBackedMap;
import com.ryuqq.collection.core.map.Reorderable;

import java.util.Optional;

/**
 * 삽입 순서를 유지하고 O(1) 재정렬을 지원하는 Set.
 *
 * <p>{@link LinkedHashBackedMap}을 내장하므로 재정렬 기능이 타입으로 보장됩니다.
 * 런타임 타입 검사 없이 {@link #moveToEnd(Object)}, {@link #moveToFront(Object)}를
 * 바로 위임합니다.</p>
 *
 * <p><strong>LRU 사용 예시:</strong></p>
 * <pre>
 * LinkedSet&lt;String&gt; recent = Sets.newLinkedSet();
 * recent.add("a").add("b").add("c");
 *
 * recent.moveToEnd("a");              // [b, c, a] - "a" 최근 사용
 * recent.first().ifPresent(recent::remove);   // [c, a] - 가장 오래된 항목 제거
 * </pre>
 *
 * @param <T> 원소 타입
 * @author Collections Team
 * @since 1.0.0
 */
public class LinkedSet<T> extends MapBackedSet<T> implements Reorderable<T> {

    private final LinkedHashBackedMap<T, Unit> linked;

    /**
     * 빈 LinkedSet 생성.
     */
    public LinkedSet() {
        this(new LinkedHashBackedMap<>());
    }

    private LinkedSet(LinkedHashBackedMap<T, Unit> linked) {
        super(linked);
        this.linked = linked;
    }

    @Override
    public LinkedSet<T> add(T element) {
        super.add(element);
        return this;
    }

    @Override
    public LinkedSet<T> remove(T element) {
        super.remove(element);
        return this;
    }

    @Override
    public LinkedSet<T> clear() {
        super.clear();
        return this;
    }

    @Override
    public boolean moveToEnd(T element) {
        return linked.moveToEnd(element);
    }

    @Override
    public boolean moveToFront(T element) {
        return linked.moveToFront(element);
    }

    /**
     * 가장 오래된 원소 조회.
     *
     * @return 첫 번째 원소 (비어 있으면 empty)
     */
    public Optional<T> first() {
        return linked.first().map(Entry::key);
    }

    /**
     * 가장 최근 원소 조회.
     *
     * @return 마지막 원소 (비어 있으면 empty)
     */
    public Optional<T> last() {
        return linked.last().map(Entry::key);
    }
}
