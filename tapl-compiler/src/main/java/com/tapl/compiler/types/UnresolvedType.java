package com.tapl.compiler.types;

import java.util.Collections;

/**
 * 未解析类型，由类型检查阶段替换为具体类型。
 * 出现在代码生成阶段即表示上游错误。
 */
public class UnresolvedType extends TaplType {

    public UnresolvedType(String name) {
        super(name, Collections.emptyList(), null);
    }

    public String getName() {
        return keyword;
    }

    @Override
    public boolean isBasicType() {
        return false;
    }
}
