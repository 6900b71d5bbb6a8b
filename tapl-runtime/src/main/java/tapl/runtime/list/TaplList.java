package tapl.runtime.list;

/**
 * TAPL 列表契约
 *
 * <p>有序序列，索引从 0 开始。所有具体列表实现（每种元素类型一个）
 * 都必须满足此契约。</p>
 *
 * <p>越界访问是被编译程序的缺陷，而不是可恢复的情况：
 * 实现必须抛出 {@link BoundsFault}，不得截断、回绕或返回哨兵值。</p>
 *
 * @param <T> 元素类型
 */
public interface TaplList<T> extends Iterable<T> {

    /**
     * 元素数量
     *
     * @return 当前元素个数，O(1)
     */
    long size();

    /**
     * 是否为空
     *
     * @return 如果没有元素返回 true
     */
    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * 在末尾追加一个元素
     *
     * @param value 新元素的值
     */
    void add(T value);

    /**
     * 读取元素
     *
     * @param index 有效范围 [0, size)
     * @return 该位置的值
     * @throws BoundsFault 索引越界
     */
    T get(long index);

    /**
     * 覆写元素，其余位置不变
     *
     * @param index 有效范围 [0, size)
     * @param value 新值
     * @throws BoundsFault 索引越界
     */
    void set(long index, T value);

    /**
     * 在指定位置插入元素，原位置及之后的元素后移一位
     *
     * @param index 有效范围 [0, size]，等于 size 时相当于追加
     * @param value 新元素的值
     * @throws BoundsFault 索引越界
     */
    void insert(long index, T value);

    /**
     * 删除指定位置的元素，之后的元素前移一位
     *
     * @param index 有效范围 [0, size)
     * @throws BoundsFault 索引越界
     */
    void delete(long index);

    /**
     * 释放所有元素，恢复到刚创建时的状态
     */
    void clear();
}
