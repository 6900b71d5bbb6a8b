package com.tapl.codegen.lowering;

import com.tapl.compiler.types.TaplType;

/**
 * 一个列表实例：元素类型 → 定义名及其生成的 C 源码。创建后不再修改。
 */
public final class ListInstantiation {

    private final TaplType elementType;
    private final String definitionName;
    private final String source;

    public ListInstantiation(TaplType elementType, String definitionName, String source) {
        this.elementType = elementType;
        this.definitionName = definitionName;
        this.source = source;
    }

    public TaplType getElementType() {
        return elementType;
    }

    public String getDefinitionName() {
        return definitionName;
    }

    public String getSource() {
        return source;
    }

    @Override
    public String toString() {
        return definitionName + " (list[" + elementType + "])";
    }
}
