package com.tapl.codegen.lowering;

import com.tapl.codegen.backend.ChainListEmitter;
import com.tapl.compiler.types.Types;

/**
 * 单次编译的降级上下文。
 *
 * <p>持有本次编译的类型集合和列表实例表，贯穿整个降级过程，
 * 编译结束即丢弃。不同编译之间不共享任何状态。</p>
 */
public class CompilationContext {

    private final Types types;
    private final MonomorphizationRegistry registry = new MonomorphizationRegistry();
    private final ListLoweringDriver listDriver;

    public CompilationContext(Types types, ChainListEmitter emitter) {
        this.types = types;
        this.listDriver = new ListLoweringDriver(registry, emitter);
    }

    public Types getTypes() {
        return types;
    }

    public MonomorphizationRegistry getRegistry() {
        return registry;
    }

    /**
     * 语句/表达式代码生成器使用的列表降级入口。
     */
    public ListLoweringDriver getListDriver() {
        return listDriver;
    }
}
