package com.tapl.compiler.types;

/**
 * 字符类型，直接映射 C 的 {@code char}。
 */
public class CharacterType extends BasicType {

    public CharacterType() {
        super("char", "char");
    }
}
