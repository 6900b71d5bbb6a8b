package tapl.runtime.list;

/**
 * BoundsFault - 列表索引越界
 *
 * <p>对应生成的 C 代码中的 {@code panic("index out of bounds in ...")}，
 * 表示被编译程序本身的缺陷，程序应当终止而不是捕获后继续执行。
 * 因此继承 {@link Error} 而非 {@link RuntimeException}。</p>
 */
public class BoundsFault extends Error {

    private static final long serialVersionUID = 1L;

    private final String operation;
    private final long index;
    private final long size;

    /**
     * @param operation 发生越界的操作名（get、set、insert、del）
     * @param index     请求的索引
     * @param size      操作时列表的大小
     */
    public BoundsFault(String operation, long index, long size) {
        super("index out of bounds in " + operation + ": index " + index + ", size " + size);
        this.operation = operation;
        this.index = index;
        this.size = size;
    }

    public String getOperation() {
        return operation;
    }

    public long getIndex() {
        return index;
    }

    public long getSize() {
        return size;
    }
}
