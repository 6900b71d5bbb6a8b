package com.tapl.compiler.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * TAPL 类型基类。
 *
 * <p>类型的身份就是它的关键字（{@code u8}、{@code Point}、{@code list[u8]}），
 * 语法糖别名（如 {@code bool}）只用于查找，不参与身份比较。</p>
 */
public abstract class TaplType {

    protected final String keyword;
    private final List<String> syntacticSugar;
    private final String underlyingType;

    protected TaplType(String keyword, List<String> syntacticSugar, String underlyingType) {
        this.keyword = keyword;
        this.syntacticSugar = syntacticSugar != null ? syntacticSugar : Collections.emptyList();
        this.underlyingType = underlyingType != null ? underlyingType : keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    /**
     * 关键字加上所有语法糖别名。
     */
    public List<String> getAllKeywords() {
        List<String> all = new ArrayList<>(syntacticSugar.size() + 1);
        all.add(keyword);
        all.addAll(syntacticSugar);
        return all;
    }

    /**
     * 对应的 C 类型名（未指定时与关键字相同）。
     */
    public String getUnderlyingType() {
        return underlyingType;
    }

    /**
     * 是否为内建基础类型（数值、字符、字符串、void）。
     */
    public abstract boolean isBasicType();

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TaplType)) return false;
        return keyword.equals(((TaplType) o).keyword);
    }

    @Override
    public int hashCode() {
        return keyword.hashCode();
    }

    @Override
    public String toString() {
        return keyword;
    }
}
