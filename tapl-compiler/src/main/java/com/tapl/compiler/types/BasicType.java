package com.tapl.compiler.types;

import java.util.Collections;
import java.util.List;

/**
 * 内建基础类型：void、string 以及数值/字符类型的父类。
 */
public class BasicType extends TaplType {

    public BasicType(String keyword, List<String> syntacticSugar, String underlyingType) {
        super(keyword, syntacticSugar, underlyingType);
    }

    public BasicType(String keyword, String underlyingType) {
        this(keyword, Collections.emptyList(), underlyingType);
    }

    public boolean isVoid() {
        return "void".equals(keyword);
    }

    @Override
    public boolean isBasicType() {
        return true;
    }
}
