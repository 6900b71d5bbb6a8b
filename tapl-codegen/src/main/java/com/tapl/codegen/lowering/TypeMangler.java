package com.tapl.codegen.lowering;

import com.tapl.codegen.InternalCompilerError;
import com.tapl.compiler.types.BasicType;
import com.tapl.compiler.types.ClassType;
import com.tapl.compiler.types.ListType;
import com.tapl.compiler.types.TaplType;
import com.tapl.compiler.types.UnresolvedType;

import java.util.regex.Pattern;

/**
 * TAPL 类型到 C 标识符的映射工具。
 *
 * <p>编码规则（保证不同类型得到不同名字）：</p>
 * <ul>
 *   <li>基础类型：关键字本身，如 {@code u8}、{@code char}</li>
 *   <li>类类型：长度前缀 + 类名，如 {@code Point -> 5Point}，以数字开头，
 *       不会与基础类型关键字或列表编码重合</li>
 *   <li>列表类型：{@code list_} + 元素编码，如 {@code list[u8] -> list_u8}</li>
 * </ul>
 */
public final class TypeMangler {

    public static final String LIST_PREFIX = "list_";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private TypeMangler() {}

    /**
     * 元素类型为 elementType 的列表实例的定义名。
     */
    public static String definitionName(TaplType elementType) {
        return LIST_PREFIX + mangle(elementType);
    }

    /**
     * 类型的无歧义编码。
     *
     * @throws InternalCompilerError 类型为 null、未解析、void 或名字不是合法标识符
     */
    public static String mangle(TaplType type) {
        checkConcrete(type);
        if (type instanceof ListType) {
            return definitionName(((ListType) type).getInnerType());
        }
        String keyword = type.getKeyword();
        if (!IDENTIFIER.matcher(keyword).matches()) {
            throw new InternalCompilerError("Type name is not a valid C identifier: '" + keyword + "'");
        }
        if (type instanceof ClassType) {
            return keyword.length() + keyword;
        }
        return keyword;
    }

    /**
     * 作为列表元素时使用的 C 类型名。
     */
    public static String elementCType(TaplType type) {
        checkConcrete(type);
        if (type instanceof ListType) {
            return definitionName(((ListType) type).getInnerType());
        }
        // 基础类型通过 types.h 的 typedef 使用关键字；类类型即结构体名
        return type.getKeyword();
    }

    private static void checkConcrete(TaplType type) {
        if (type == null) {
            throw new InternalCompilerError("List element type is missing");
        }
        if (type instanceof UnresolvedType) {
            throw new InternalCompilerError("List element type is unresolved: '" + type.getKeyword() + "'");
        }
        if (type instanceof BasicType && ((BasicType) type).isVoid()) {
            throw new InternalCompilerError("List element type cannot be void");
        }
        if (!(type instanceof BasicType) && !(type instanceof ClassType) && !(type instanceof ListType)) {
            throw new InternalCompilerError("Unsupported list element type: " + type.getClass().getSimpleName());
        }
    }
}
