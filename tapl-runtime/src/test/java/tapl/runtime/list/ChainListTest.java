package tapl.runtime.list;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

/**
 * ChainList 单元测试：结构不变量、访问缓存与越界行为。
 */
@DisplayName("ChainList 测试")
class ChainListTest {

    private ChainList<Integer> list;

    @BeforeEach
    void setUp() {
        list = new ChainList<>();
    }

    // ============================================================
    //  辅助方法
    // ============================================================

    private static ChainList<Integer> listOf(int... values) {
        ChainList<Integer> result = new ChainList<>();
        for (int v : values) {
            result.add(v);
        }
        return result;
    }

    /** 通过索引读取全部元素（经过缓存路径） */
    private static List<Integer> readByIndex(TaplList<Integer> list) {
        List<Integer> values = new ArrayList<>();
        for (long i = 0; i < list.size(); i++) {
            values.add(list.get(i));
        }
        return values;
    }

    /** 从 head 走到末尾计数 */
    private static long walkCount(TaplList<Integer> list) {
        long count = 0;
        for (Integer ignored : list) {
            count++;
        }
        return count;
    }

    // ============================================================
    //  测试用例
    // ============================================================

    @Nested
    @DisplayName("生命周期与追加")
    class Lifecycle {

        @Test
        @DisplayName("新建列表为空")
        void testCreateIsEmpty() {
            assertThat(list.size()).isZero();
            assertThat(list.isEmpty()).isTrue();
            assertThat(list.iterator().hasNext()).isFalse();
        }

        @Test
        @DisplayName("追加保持顺序")
        void testAppendKeepsOrder() {
            list.add(1);
            list.add(2);
            list.add(3);
            assertThat(list.size()).isEqualTo(3);
            assertThat(list).containsExactly(1, 2, 3);
        }

        @Test
        @DisplayName("清空后可继续使用")
        void testClear() {
            list.add(1);
            list.add(2);
            list.get(1);
            list.clear();
            assertThat(list.size()).isZero();
            assertThat(list).isEmpty();
            list.add(7);
            assertThat(list.get(0)).isEqualTo(7);
        }

        @Test
        @DisplayName("toString")
        void testToString() {
            assertThat(listOf(1, 2, 3).toString()).isEqualTo("[1, 2, 3]");
            assertThat(list.toString()).isEqualTo("[]");
        }
    }

    @Test
    @DisplayName("完整场景：追加、插入、删除、覆写、越界")
    void testConcreteScenario() {
        list.add(1);
        list.add(2);
        list.add(3);
        assertThat(list.size()).isEqualTo(3);
        assertThat(list).containsExactly(1, 2, 3);

        list.insert(1, 9);
        assertThat(list).containsExactly(1, 9, 2, 3);

        list.delete(0);
        assertThat(list).containsExactly(9, 2, 3);

        list.set(2, 7);
        assertThat(list).containsExactly(9, 2, 7);

        assertThatThrownBy(() -> list.get(5))
                .isInstanceOf(BoundsFault.class)
                .hasMessageContaining("get");
    }

    @Nested
    @DisplayName("索引读写")
    class IndexedAccess {

        @Test
        @DisplayName("set 后 get 返回新值，其他位置不变")
        void testSetGetRoundTrip() {
            ChainList<Integer> chain = listOf(10, 20, 30, 40);
            for (int i = 0; i < 4; i++) {
                ChainList<Integer> copy = listOf(10, 20, 30, 40);
                copy.set(i, -1);
                assertThat(copy.get(i)).isEqualTo(-1);
                for (int j = 0; j < 4; j++) {
                    if (j != i) {
                        assertThat(copy.get(j)).isEqualTo(chain.get(j));
                    }
                }
            }
        }

        @Test
        @DisplayName("递增访问与无缓存版本结果一致")
        void testForwardCacheMatchesUncached() {
            ChainList<Integer> cached = new ChainList<>();
            ChainList<Integer> uncached = ChainList.uncached();
            for (int i = 0; i < 50; i++) {
                cached.add(i * 3);
                uncached.add(i * 3);
            }
            assertThat(readByIndex(cached)).isEqualTo(readByIndex(uncached));
            assertThat(uncached.getCacheHits()).isZero();
        }

        @Test
        @DisplayName("递增遍历总步数为 n-1")
        void testAscendingTraversalIsLinear() {
            int n = 1000;
            ChainList<Integer> cached = new ChainList<>();
            ChainList<Integer> uncached = ChainList.uncached();
            for (int i = 0; i < n; i++) {
                cached.add(i);
                uncached.add(i);
            }
            readByIndex(cached);
            readByIndex(uncached);
            assertThat(cached.getTraversalSteps()).isEqualTo(n - 1);
            assertThat(cached.getCacheHits()).isEqualTo(n - 1);
            assertThat(uncached.getTraversalSteps()).isEqualTo((long) n * (n - 1) / 2);
        }

        @Test
        @DisplayName("向后访问不使用缓存但结果正确")
        void testBackwardAccess() {
            ChainList<Integer> chain = listOf(5, 6, 7, 8);
            assertThat(chain.get(3)).isEqualTo(8);
            long hits = chain.getCacheHits();
            assertThat(chain.get(1)).isEqualTo(6);
            assertThat(chain.getCacheHits()).isEqualTo(hits);
            assertThat(chain.get(2)).isEqualTo(7);
            assertThat(chain.getCacheHits()).isEqualTo(hits + 1);
        }

        @Test
        @DisplayName("随机访问序列下缓存不可观测")
        void testCacheTransparency() {
            Random random = new Random(42);
            ChainList<Integer> cached = new ChainList<>();
            ChainList<Integer> uncached = ChainList.uncached();
            List<Integer> model = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                cached.add(i);
                uncached.add(i);
                model.add(i);
            }
            for (int step = 0; step < 2000; step++) {
                int index = random.nextInt(model.size());
                switch (random.nextInt(3)) {
                    case 0:
                        cached.set(index, step);
                        uncached.set(index, step);
                        model.set(index, step);
                        break;
                    default:
                        assertThat(cached.get(index)).isEqualTo(model.get(index));
                        assertThat(uncached.get(index)).isEqualTo(model.get(index));
                        break;
                }
            }
        }
    }

    @Nested
    @DisplayName("结构修改")
    class StructuralMutation {

        @Test
        @DisplayName("插入后读取不会得到旧缓存值")
        void testInsertInvalidatesCache() {
            ChainList<Integer> chain = listOf(1, 2, 3, 4);
            assertThat(chain.get(2)).isEqualTo(3);
            chain.insert(1, 99);
            assertThat(chain.get(2)).isEqualTo(2);
            assertThat(chain.get(3)).isEqualTo(3);
        }

        @Test
        @DisplayName("删除后读取不会得到旧缓存值")
        void testDeleteInvalidatesCache() {
            ChainList<Integer> chain = listOf(1, 2, 3, 4);
            assertThat(chain.get(2)).isEqualTo(3);
            chain.delete(2);
            assertThat(chain.get(2)).isEqualTo(4);
            chain.delete(0);
            assertThat(chain.get(1)).isEqualTo(4);
            assertThat(chain).containsExactly(2, 4);
        }

        @Test
        @DisplayName("删除缓存所在元素后不会读到已删除元素")
        void testDeleteCachedElement() {
            ChainList<Integer> chain = listOf(1, 2, 3);
            assertThat(chain.get(2)).isEqualTo(3);
            chain.delete(2);
            assertThatThrownBy(() -> chain.get(2)).isInstanceOf(BoundsFault.class);
            chain.add(4);
            assertThat(chain.get(2)).isEqualTo(4);
        }

        @Test
        @DisplayName("insert 与 delete 互逆")
        void testInsertDeleteInverse() {
            int[] original = {4, 8, 15, 16, 23, 42};
            for (int i = 0; i <= original.length; i++) {
                ChainList<Integer> chain = listOf(original);
                chain.get(original.length - 1);
                chain.insert(i, 0);
                assertThat(chain.size()).isEqualTo(original.length + 1);
                assertThat(chain.get(i)).isZero();
                chain.delete(i);
                assertThat(chain).containsExactly(4, 8, 15, 16, 23, 42);
            }
        }

        @Test
        @DisplayName("index == size 的插入等同于追加，tail 随之更新")
        void testInsertAtSizeAppends() {
            ChainList<Integer> chain = listOf(1, 2);
            chain.insert(2, 3);
            chain.add(4);
            assertThat(chain).containsExactly(1, 2, 3, 4);
        }

        @Test
        @DisplayName("向空列表插入后可以继续追加")
        void testInsertIntoEmptySetsTail() {
            list.insert(0, 1);
            list.add(2);
            assertThat(list).containsExactly(1, 2);
        }

        @Test
        @DisplayName("删除最后一个元素后 tail 正确")
        void testDeleteLastUpdatesTail() {
            ChainList<Integer> chain = listOf(1, 2, 3);
            chain.delete(2);
            chain.add(9);
            assertThat(chain).containsExactly(1, 2, 9);
            chain.delete(0);
            chain.delete(0);
            chain.delete(0);
            assertThat(chain.isEmpty()).isTrue();
            chain.add(5);
            assertThat(chain).containsExactly(5);
        }

        @Test
        @DisplayName("任意修改序列后 size 等于链长")
        void testSizeInvariant() {
            Random random = new Random(7);
            List<Integer> model = new ArrayList<>();
            for (int step = 0; step < 3000; step++) {
                int op = random.nextInt(4);
                if (op == 0 || model.isEmpty()) {
                    list.add(step);
                    model.add(step);
                } else if (op == 1) {
                    int index = random.nextInt(model.size() + 1);
                    list.insert(index, step);
                    model.add(index, step);
                } else if (op == 2) {
                    int index = random.nextInt(model.size());
                    list.delete(index);
                    model.remove(index);
                } else {
                    int index = random.nextInt(model.size());
                    assertThat(list.get(index)).isEqualTo(model.get(index));
                }
                assertThat(list.size()).isEqualTo(model.size());
                assertThat(walkCount(list)).isEqualTo(list.size());
            }
            assertThat(readByIndex(list)).isEqualTo(model);
        }
    }

    @Nested
    @DisplayName("越界")
    class Bounds {

        @Test
        @DisplayName("空列表上的 get/set/delete 越界")
        void testEmptyListFaults() {
            assertThatThrownBy(() -> list.get(0)).isInstanceOf(BoundsFault.class);
            assertThatThrownBy(() -> list.set(0, 1)).isInstanceOf(BoundsFault.class);
            assertThatThrownBy(() -> list.delete(0)).isInstanceOf(BoundsFault.class);
        }

        @Test
        @DisplayName("index >= size 越界")
        void testIndexAtSizeFaults() {
            ChainList<Integer> chain = listOf(1, 2, 3);
            assertThatThrownBy(() -> chain.get(3)).isInstanceOf(BoundsFault.class);
            assertThatThrownBy(() -> chain.set(3, 0)).isInstanceOf(BoundsFault.class);
            assertThatThrownBy(() -> chain.delete(3)).isInstanceOf(BoundsFault.class);
            assertThatThrownBy(() -> chain.insert(4, 0)).isInstanceOf(BoundsFault.class);
            assertThatThrownBy(() -> chain.get(-1)).isInstanceOf(BoundsFault.class);
            assertThatThrownBy(() -> chain.insert(-1, 0)).isInstanceOf(BoundsFault.class);
        }

        @Test
        @DisplayName("越界携带操作名、索引与大小")
        void testFaultDetails() {
            ChainList<Integer> chain = listOf(1, 2);
            BoundsFault fault = catchThrowableOfType(() -> chain.delete(5), BoundsFault.class);
            assertThat(fault.getOperation()).isEqualTo("del");
            assertThat(fault.getIndex()).isEqualTo(5);
            assertThat(fault.getSize()).isEqualTo(2);
            assertThat(fault).isNotInstanceOf(RuntimeException.class);
        }

        @Test
        @DisplayName("越界不改变列表状态")
        void testFaultLeavesStateIntact() {
            ChainList<Integer> chain = listOf(1, 2, 3);
            assertThat(chain.get(1)).isEqualTo(2);
            assertThatThrownBy(() -> chain.insert(7, 0)).isInstanceOf(BoundsFault.class);
            assertThatThrownBy(() -> chain.delete(3)).isInstanceOf(BoundsFault.class);
            assertThatThrownBy(() -> chain.get(10)).isInstanceOf(BoundsFault.class);
            assertThat(chain.size()).isEqualTo(3);
            assertThat(readByIndex(chain)).containsExactly(1, 2, 3);
            chain.add(4);
            assertThat(chain).containsExactly(1, 2, 3, 4);
        }

        @Test
        @DisplayName("越界的访问不计入缓存命中，缓存保持原位")
        void testFaultIsNotCacheHit() {
            ChainList<Integer> chain = listOf(1, 2, 3);
            chain.get(1);
            assertThat(chain.getCacheHits()).isZero();

            assertThatThrownBy(() -> chain.get(5)).isInstanceOf(BoundsFault.class);
            assertThatThrownBy(() -> chain.set(3, 0)).isInstanceOf(BoundsFault.class);
            assertThat(chain.getCacheHits()).isZero();

            assertThat(chain.get(2)).isEqualTo(3);
            assertThat(chain.getCacheHits()).isEqualTo(1);
        }
    }
}
