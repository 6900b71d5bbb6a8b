package com.tapl.compiler.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 泛型列表类型 {@code list[T]}。
 */
public class ListType extends TaplType {

    private final TaplType innerType;

    public ListType(TaplType innerType) {
        super("list[" + innerType.getKeyword() + "]", Collections.emptyList(), null);
        this.innerType = innerType;
    }

    public TaplType getInnerType() {
        return innerType;
    }

    /**
     * 可调用方法名 → 返回值类型关键字，供类型检查使用。
     */
    public Map<String, String> callableFunctions() {
        Map<String, String> functions = new LinkedHashMap<>();
        for (ListMethod method : ListMethod.values()) {
            functions.put(method.getMethodName(), method.returnKeyword(this));
        }
        return functions;
    }

    @Override
    public boolean isBasicType() {
        return false;
    }
}
