package tapl.runtime.list;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * 单向链表实现的 TAPL 列表，与生成的 C 代码 {@code list_T_*} 使用同一套算法。
 *
 * <p>结构：</p>
 * <ul>
 *   <li>{@code head} 拥有第一个元素，每个元素拥有它的后继</li>
 *   <li>{@code tail} 只用于 O(1) 追加，不拥有元素</li>
 *   <li>访问缓存记录最近一次解析的 (索引 → 元素)，只能向前复用</li>
 * </ul>
 *
 * <p>按递增索引遍历（{@code for i in 0..size}）时每次访问只前进一步，
 * 整个循环为 O(n)；递减或随机访问最坏为 O(n)。
 * 任何结构性修改（追加、插入、删除、清空）都会使缓存失效。</p>
 *
 * <p>非线程安全。</p>
 *
 * @param <T> 元素类型
 */
public final class ChainList<T> implements TaplList<T> {

    private static final class Element<T> {
        T value;
        Element<T> next;

        Element(T value, Element<T> next) {
            this.value = value;
            this.next = next;
        }
    }

    private Element<T> head;
    private Element<T> tail;
    private long size;

    private final boolean cacheEnabled;
    private boolean cacheValid;
    private long cacheIndex;
    private Element<T> cacheElement;

    /** 诊断计数：缓存命中次数 */
    private long cacheHits;
    /** 诊断计数：get/set 沿链前进的总步数 */
    private long traversalSteps;

    public ChainList() {
        this(true);
    }

    private ChainList(boolean cacheEnabled) {
        this.cacheEnabled = cacheEnabled;
    }

    /**
     * 创建不使用访问缓存的列表，每次 get/set 都从 head 开始遍历。
     * 用于对比验证缓存不影响结果。
     */
    public static <T> ChainList<T> uncached() {
        return new ChainList<>(false);
    }

    @Override
    public long size() {
        return size;
    }

    @Override
    public void add(T value) {
        invalidateCache();
        Element<T> element = new Element<>(value, null);
        if (head == null) {
            head = element;
        } else {
            tail.next = element;
        }
        tail = element;
        size++;
    }

    @Override
    public T get(long index) {
        return locate(index, "get").value;
    }

    @Override
    public void set(long index, T value) {
        locate(index, "set").value = value;
    }

    @Override
    public void insert(long index, T value) {
        invalidateCache();
        if (index == 0) {
            head = new Element<>(value, head);
            if (tail == null) {
                tail = head;
            }
            size++;
            return;
        }
        Element<T> previous = walk(index - 1);
        if (previous == null) {
            throw new BoundsFault("insert", index, size);
        }
        Element<T> element = new Element<>(value, previous.next);
        previous.next = element;
        if (element.next == null) {
            tail = element;
        }
        size++;
    }

    @Override
    public void delete(long index) {
        invalidateCache();
        if (index == 0) {
            if (head == null) {
                throw new BoundsFault("del", index, size);
            }
            Element<T> inner = head.next;
            head.next = null;
            head = inner;
            if (inner == null) {
                tail = null;
            }
            size--;
            return;
        }
        Element<T> previous = walk(index - 1);
        if (previous == null || previous.next == null) {
            throw new BoundsFault("del", index, size);
        }
        Element<T> removed = previous.next;
        previous.next = removed.next;
        removed.next = null;
        if (previous.next == null) {
            tail = previous;
        }
        size--;
    }

    @Override
    public void clear() {
        invalidateCache();
        head = null;
        tail = null;
        size = 0;
    }

    /**
     * 缓存命中次数（诊断用）。
     */
    public long getCacheHits() {
        return cacheHits;
    }

    /**
     * get/set 遍历的总步数（诊断用）。
     */
    public long getTraversalSteps() {
        return traversalSteps;
    }

    @Override
    public Iterator<T> iterator() {
        return new Iterator<T>() {
            private Element<T> cursor = head;

            @Override
            public boolean hasNext() {
                return cursor != null;
            }

            @Override
            public T next() {
                if (cursor == null) {
                    throw new NoSuchElementException();
                }
                T value = cursor.value;
                cursor = cursor.next;
                return value;
            }
        };
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (Element<T> e = head; e != null; e = e.next) {
            if (e != head) sb.append(", ");
            sb.append(e.value);
        }
        sb.append("]");
        return sb.toString();
    }

    // ============ 内部实现 ============

    private void invalidateCache() {
        cacheValid = false;
        cacheElement = null;
    }

    /**
     * get/set 共用的查找算法。
     * 缓存只在目标索引不小于缓存索引时可用；缓存键是请求的绝对索引。
     * 越界时不修改缓存。
     */
    private Element<T> locate(long index, String operation) {
        if (index < 0) {
            throw new BoundsFault(operation, index, size);
        }
        long remaining = index;
        Element<T> cursor = head;
        boolean fromCache = cacheValid && index >= cacheIndex;
        if (fromCache) {
            cursor = cacheElement;
            remaining -= cacheIndex;
        }
        while (cursor != null && remaining > 0) {
            cursor = cursor.next;
            remaining--;
            traversalSteps++;
        }
        if (remaining > 0 || cursor == null) {
            throw new BoundsFault(operation, index, size);
        }
        if (fromCache) {
            cacheHits++;
        }
        if (cacheEnabled) {
            cacheValid = true;
            cacheIndex = index;
            cacheElement = cursor;
        }
        return cursor;
    }

    /**
     * 从 head 前进到 position 处的元素，不存在返回 null。不使用缓存。
     */
    private Element<T> walk(long position) {
        if (position < 0) {
            return null;
        }
        Element<T> cursor = head;
        long remaining = position;
        while (cursor != null && remaining > 0) {
            cursor = cursor.next;
            remaining--;
        }
        return cursor;
    }
}
