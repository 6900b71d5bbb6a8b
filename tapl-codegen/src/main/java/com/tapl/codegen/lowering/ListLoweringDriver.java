package com.tapl.codegen.lowering;

import com.tapl.codegen.InternalCompilerError;
import com.tapl.codegen.backend.ChainListEmitter;
import com.tapl.compiler.types.ListMethod;
import com.tapl.compiler.types.ListType;
import com.tapl.compiler.types.TaplType;

import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * 泛型列表降级。
 *
 * <p>语句/表达式代码生成器在降级列表声明、列表字面量或列表方法调用时调用此类。
 * 每个元素类型在一次编译中只生成一份 C 实现；之后的解析直接返回已有定义名。</p>
 *
 * <p>元素类型本身是列表时，先解析内层列表，保证内层定义在输出中位于外层之前。</p>
 */
public class ListLoweringDriver {

    private static final Logger LOG = Logger.getLogger(ListLoweringDriver.class.getName());

    private final MonomorphizationRegistry registry;
    private final ChainListEmitter emitter;

    public ListLoweringDriver(MonomorphizationRegistry registry, ChainListEmitter emitter) {
        this.registry = registry;
        this.emitter = emitter;
    }

    /**
     * 返回元素类型对应的列表定义名，首次遇到时生成并登记实现。
     *
     * @param elementType 类型检查后的具体元素类型
     * @return 定义名，例如 {@code list_u8}
     * @throws InternalCompilerError 元素类型缺失、未解析或不能作为元素
     */
    public String resolve(TaplType elementType) {
        String name = TypeMangler.definitionName(elementType);
        ListInstantiation existing = registry.lookup(elementType);
        if (existing != null) {
            return existing.getDefinitionName();
        }
        if (elementType instanceof ListType) {
            resolve(((ListType) elementType).getInnerType());
        }
        String source = emitter.emit(name, TypeMangler.elementCType(elementType));
        registry.register(new ListInstantiation(elementType, name, source));
        LOG.fine("Instantiated " + name + " for list[" + elementType.getKeyword() + "]");
        return name;
    }

    /**
     * 解析列表类型本身（等价于解析其元素类型）。
     */
    public String resolveList(ListType listType) {
        if (listType == null) {
            throw new InternalCompilerError("List type is missing");
        }
        return resolve(listType.getInnerType());
    }

    /**
     * 降级列表变量声明：声明并调用构造函数。
     *
     * @return 例如 {@code list_u8 xs; list_u8_constructor(&xs);}
     */
    public String declare(ListType listType, String variable) {
        String name = resolveList(listType);
        return name + " " + variable + "; " + name + "_constructor(&" + variable + ");";
    }

    /**
     * 降级列表方法调用。
     *
     * @param listType    接收者的列表类型
     * @param receiver    接收者表达式的 C 代码
     * @param isReference 接收者是否已经是指针（是则不再取地址）
     * @param method      源码中的方法名（add、get、set、del、insert、size）
     * @param arguments   已生成的参数 C 代码
     * @return 调用表达式，例如 {@code list_u8_get(&xs, i)}
     * @throws InternalCompilerError 方法名未知或参数个数不符
     */
    public String call(ListType listType, String receiver, boolean isReference,
                       String method, List<String> arguments) {
        ListMethod listMethod = ListMethod.fromName(method);
        if (listMethod == null) {
            throw new InternalCompilerError("Unknown list method '" + method + "' on " + listType);
        }
        List<String> args = arguments != null ? arguments : Collections.<String>emptyList();
        if (args.size() != listMethod.getArity()) {
            throw new InternalCompilerError("List method '" + method + "' expects "
                    + listMethod.getArity() + " argument(s), got " + args.size());
        }
        StringBuilder sb = new StringBuilder();
        sb.append(resolveList(listType)).append('_').append(listMethod.getMethodName()).append('(');
        sb.append(isReference ? "" : "&").append(receiver);
        for (String arg : args) {
            sb.append(", ").append(arg);
        }
        sb.append(')');
        return sb.toString();
    }

    /**
     * 降级作用域结束时的析构调用。
     */
    public String destroy(ListType listType, String receiver, boolean isReference) {
        return resolveList(listType) + "_destructor(" + (isReference ? "" : "&") + receiver + ");";
    }
}
