package com.tapl.compiler.types;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 数值类型：u1..u64、s8..s64、f32、f64。
 *
 * <p>提升关系只向更宽的同类类型进行，例如 {@code u8 -> u16 -> u32 -> u64}。</p>
 */
public class NumericType extends BasicType {

    private final NumericKind kind;
    private final int numBits;
    private final List<NumericType> promotions = new ArrayList<>();

    public NumericType(String keyword, NumericKind kind, int numBits,
                       List<String> syntacticSugar, String underlyingType) {
        super(keyword, syntacticSugar, underlyingType);
        this.kind = kind;
        this.numBits = numBits;
    }

    public NumericType(String keyword, NumericKind kind, int numBits, String underlyingType) {
        this(keyword, kind, numBits, Collections.emptyList(), underlyingType);
    }

    public NumericKind getKind() {
        return kind;
    }

    public int getNumBits() {
        return numBits;
    }

    void addPromotions(NumericType... targets) {
        promotions.addAll(Arrays.asList(targets));
    }

    /**
     * 是否可以提升为 other（相同类型也视为可以）。
     */
    public boolean canPromoteTo(TaplType other) {
        return equals(other) || promotions.contains(other);
    }
}
