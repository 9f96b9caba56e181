package com.ryuqq.collection.core.map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * LinkedHashBackedMap 유닛 테스트.
 *
 * <p>연결 리스트 + 해시 인덱스 동작을 검증합니다:</p>
 * <ul>
 *   <li>삽입 순서 유지, 갱신 시 위치 유지</li>
 *   <li>head/중간/tail 삭제 시 리스트 재연결</li>
 *   <li>moveToEnd / moveToFront (LRU 기본 연산)</li>
 *   <li>무작위 연산 시퀀스에서 java.util.LinkedHashMap과 동일한 결과</li>
 * </ul>
 *
 * @author Collections Team
 * @since 1.0.0
 */
class LinkedHashBackedMapTest {

    private LinkedHashBackedMap<String, Integer> map;

    @BeforeEach
    void setUp() {
        map = new LinkedHashBackedMap<>();
    }

    // ============================================================
    // 1. 삽입 순서 및 갱신
    // ============================================================

    @Test
    void put_세_개_삽입_후_갱신해도_순서_유지() {
        // given
        map.put("a", 1).put("b", 2).put("c", 3);
        assertThat(map.keys()).containsExactly("a", "b", "c");

        // when
        map.put("b", 99);

        // then
        assertThat(map.keys()).containsExactly("a", "b", "c");
        assertThat(map.get("b")).contains(99);
        assertThat(map.size()).isEqualTo(3);
    }

    @Test
    void put_체이닝은_동일_인스턴스를_반환함() {
        // when
        LinkedHashBackedMap<String, Integer> returned = map.put("a", 1).put("b", 2);

        // then
        assertThat(returned).isSameAs(map);
    }

    // ============================================================
    // 2. 삭제
    // ============================================================

    @Test
    void del_중간_노드_삭제_시_앞뒤가_재연결됨() {
        // given
        map.put("a", 1).put("b", 2).put("c", 3);

        // when
        Optional<Integer> removed = map.del("b");

        // then
        assertThat(removed).contains(2);
        assertThat(map.keys()).containsExactly("a", "c");
        assertThat(map.size()).isEqualTo(2);
        assertThat(map.first()).contains(Entry.of("a", 1));
        assertThat(map.last()).contains(Entry.of("c", 3));
    }

    @Test
    void del_head_삭제_시_다음_노드가_head가_됨() {
        // given
        map.put("a", 1).put("b", 2).put("c", 3);

        // when
        map.del("a");

        // then
        assertThat(map.first()).contains(Entry.of("b", 2));
        assertThat(map.keys()).containsExactly("b", "c");
    }

    @Test
    void del_tail_삭제_시_이전_노드가_tail이_됨() {
        // given
        map.put("a", 1).put("b", 2).put("c", 3);

        // when
        map.del("c");

        // then
        assertThat(map.last()).contains(Entry.of("b", 2));
        map.put("d", 4);
        assertThat(map.keys()).containsExactly("a", "b", "d");
    }

    @Test
    void del_유일한_노드_삭제_시_비어있음() {
        // given
        map.put("only", 1);

        // when
        map.del("only");

        // then
        assertThat(map.isEmpty()).isTrue();
        assertThat(map.first()).isEmpty();
        assertThat(map.last()).isEmpty();
        assertThat(map.toString()).isEqualTo("map[]");

        // 재사용 가능
        map.put("next", 2);
        assertThat(map.first()).contains(Entry.of("next", 2));
        assertThat(map.last()).contains(Entry.of("next", 2));
    }

    // ============================================================
    // 3. moveToEnd / moveToFront
    // ============================================================

    @Test
    void moveToEnd_후_moveToFront_순서_변경() {
        // given
        map.put("a", 1).put("b", 2).put("c", 3);

        // when & then
        assertThat(map.moveToEnd("a")).isTrue();
        assertThat(map.keys()).containsExactly("b", "c", "a");

        assertThat(map.moveToFront("c")).isTrue();
        assertThat(map.keys()).containsExactly("c", "b", "a");
        assertThat(map.values()).containsExactly(3, 2, 1);
    }

    @Test
    void moveToEnd_후_last는_해당_키와_현재_값() {
        // given
        map.put("a", 1).put("b", 2).put("c", 3).put("a", 10);

        // when
        map.moveToEnd("a");

        // then
        assertThat(map.last()).contains(Entry.of("a", 10));
    }

    @Test
    void moveToFront_후_first는_해당_키와_현재_값() {
        // given
        map.put("a", 1).put("b", 2).put("c", 3);

        // when
        map.moveToFront("b");

        // then
        assertThat(map.first()).contains(Entry.of("b", 2));
        assertThat(map.keys()).containsExactly("b", "a", "c");
    }

    @Test
    void moveToEnd_이미_tail이면_true_및_순서_불변() {
        // given
        map.put("a", 1).put("b", 2).put("c", 3);

        // when
        boolean moved = map.moveToEnd("c");

        // then
        assertThat(moved).isTrue();
        assertThat(map.keys()).containsExactly("a", "b", "c");
    }

    @Test
    void moveToFront_이미_head이면_true_및_순서_불변() {
        // given
        map.put("a", 1).put("b", 2).put("c", 3);

        // when
        boolean moved = map.moveToFront("a");

        // then
        assertThat(moved).isTrue();
        assertThat(map.keys()).containsExactly("a", "b", "c");
    }

    @Test
    void move_존재하지_않는_키는_false_및_순서_불변() {
        // given
        map.put("a", 1).put("b", 2);

        // when & then
        assertThat(map.moveToEnd("missing")).isFalse();
        assertThat(map.moveToFront("missing")).isFalse();
        assertThat(map.keys()).containsExactly("a", "b");

        assertThat(new LinkedHashBackedMap<String, Integer>().moveToEnd("missing")).isFalse();
    }

    @Test
    void move_두_원소_사이에서_head와_tail이_올바르게_교체됨() {
        // given
        map.put("a", 1).put("b", 2);

        // when
        map.moveToEnd("a");

        // then
        assertThat(map.first()).contains(Entry.of("b", 2));
        assertThat(map.last()).contains(Entry.of("a", 1));

        // when
        map.moveToFront("a");

        // then
        assertThat(map.keys()).containsExactly("a", "b");
        map.del("b");
        assertThat(map.first()).isEqualTo(map.last());
    }

    @Test
    void moveToEnd_tail에서_삭제_후에도_리스트_일관성_유지() {
        // given
        map.put("a", 1).put("b", 2).put("c", 3);
        map.moveToEnd("a");   // b, c, a

        // when
        map.del("a");
        map.put("d", 4);

        // then
        assertThat(map.keys()).containsExactly("b", "c", "d");
        assertThat(map.last()).contains(Entry.of("d", 4));
    }

    @Test
    void reorderable_자기_자신을_반환함() {
        assertThat(map.reorderable()).containsSame(map);
    }

    // ============================================================
    // 4. LRU 시나리오
    // ============================================================

    @Test
    void lru_용량2_접근된_키는_유지되고_가장_오래된_키가_축출됨() {
        // given
        int capacity = 2;
        map.put("x", 1).put("y", 2);

        // when: "x" 접근
        assertThat(map.get("x")).contains(1);
        map.moveToEnd("x");
        assertThat(map.keys()).containsExactly("y", "x");

        // when: "z" 삽입 전 front 축출
        if (map.size() >= capacity) {
            map.first().ifPresent(eldest -> map.del(eldest.key()));
        }
        map.put("z", 3);

        // then
        assertThat(map.keys()).containsExactly("x", "z");
    }

    // ============================================================
    // 5. clear / toString
    // ============================================================

    @Test
    void clear_후_새로_생성한_것처럼_동작함() {
        // given
        map.put("a", 1).put("b", 2);

        // when
        map.clear();

        // then
        assertThat(map.isEmpty()).isTrue();
        assertThat(map.first()).isEmpty();
        assertThat(map.keys()).isEmpty();
        assertThat(map.contains("a")).isFalse();

        map.put("b", 5).put("c", 6);
        assertThat(map.keys()).containsExactly("b", "c");
        assertThat(map.toString()).isEqualTo("map[b:5 c:6]");
    }

    @Test
    void toString_순서는_each_순서와_같음() {
        // given
        map.put("a", 1).put("b", 2).put("c", 3);
        map.moveToFront("c");

        // when
        StringBuilder expected = new StringBuilder("map[");
        map.each((key, value) -> {
            if (expected.length() > 4) {
                expected.append(' ');
            }
            expected.append(key).append(':').append(value);
        });
        expected.append(']');

        // then
        assertThat(map.toString()).isEqualTo(expected.toString()).isEqualTo("map[c:3 a:1 b:2]");
    }

    // ============================================================
    // 6. 무작위 연산 시퀀스 검증
    // ============================================================

    @Test
    void 무작위_연산_시퀀스에서_참조_구현과_동일한_순서와_크기() {
        // given: java.util.LinkedHashMap을 참조 구현으로 사용
        java.util.LinkedHashMap<String, Integer> reference = new java.util.LinkedHashMap<>();
        Random random = new Random(42);

        // when
        for (int step = 0; step < 5_000; step++) {
            String key = "k" + random.nextInt(40);
            int op = random.nextInt(5);
            switch (op) {
                case 0, 1 -> {
                    map.put(key, step);
                    reference.put(key, step);
                }
                case 2 -> assertThat(map.del(key)).isEqualTo(Optional.ofNullable(reference.remove(key)));
                case 3 -> {
                    boolean expected = reference.containsKey(key);
                    if (expected) {
                        Integer value = reference.remove(key);
                        reference.put(key, value);
                    }
                    assertThat(map.moveToEnd(key)).isEqualTo(expected);
                }
                default -> {
                    boolean expected = reference.containsKey(key);
                    if (expected) {
                        java.util.LinkedHashMap<String, Integer> reordered = new java.util.LinkedHashMap<>();
                        reordered.put(key, reference.get(key));
                        reference.forEach(reordered::putIfAbsent);
                        reference.clear();
                        reference.putAll(reordered);
                    }
                    assertThat(map.moveToFront(key)).isEqualTo(expected);
                }
            }

            // then: 인덱스 크기 == 리스트 길이 == 참조 크기
            assertThat(map.size()).isEqualTo(reference.size());
        }

        assertThat(map.keys()).containsExactlyElementsOf(new ArrayList<>(reference.keySet()));
        assertThat(map.values()).containsExactlyElementsOf(new ArrayList<>(reference.values()));
        assertLinksConsistent();
    }

    // ============================================================
    // 7. null 처리
    // ============================================================

    @Test
    void null_키나_값은_예외_발생() {
        assertThatThrownBy(() -> map.put(null, 1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("key cannot be null");
        assertThatThrownBy(() -> map.put("a", null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("value cannot be null");
        assertThatThrownBy(() -> map.moveToEnd(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> map.moveToFront(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // 정방향 순회와 first/last가 일치하는지 확인
    private void assertLinksConsistent() {
        List<Entry<String, Integer>> entries = map.entries();
        assertThat(entries).hasSize(map.size());
        if (entries.isEmpty()) {
            assertThat(map.first()).isEmpty();
            assertThat(map.last()).isEmpty();
            return;
        }
        assertThat(map.first()).contains(entries.get(0));
        assertThat(map.last()).contains(entries.get(entries.size() - 1));
    }
}
