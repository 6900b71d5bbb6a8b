package com.tapl.compiler.types;

/**
 * 数值类型的种类。
 */
public enum NumericKind {
    UNSIGNED, SIGNED, FLOATING_POINT
}
