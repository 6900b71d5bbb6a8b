package com.tapl.compiler.types;

import java.util.Collections;

/**
 * 用户定义的类类型，生成为同名的 C 结构体。
 */
public class ClassType extends TaplType {

    public ClassType(String name) {
        super(name, Collections.emptyList(), name);
    }

    public String getName() {
        return keyword;
    }

    @Override
    public boolean isBasicType() {
        return false;
    }
}
