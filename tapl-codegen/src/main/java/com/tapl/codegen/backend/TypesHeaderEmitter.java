package com.tapl.codegen.backend;

import com.tapl.compiler.types.TaplType;
import com.tapl.compiler.types.Types;

/**
 * 生成 {@code types.h}：内建基础类型到 C 类型的 typedef。
 * 只输出 C 名与关键字不同的类型（{@code typedef uint8_t u8;}）。
 */
public class TypesHeaderEmitter {

    public static final String FILE_NAME = "types.h";

    private final EmitConfig config;

    public TypesHeaderEmitter(EmitConfig config) {
        this.config = config;
    }

    public String emit(Types types) {
        CSourceWriter w = new CSourceWriter(config);
        w.line("#pragma once");
        w.blankLine();
        w.line("#include <stdbool.h>");
        w.line("#include <stdint.h>");
        w.blankLine();
        w.line("// typedefs for the builtin basic types");
        for (TaplType type : types.values()) {
            if (type.isBasicType() && !type.getUnderlyingType().equals(type.getKeyword())) {
                w.line("typedef " + type.getUnderlyingType() + " " + type.getKeyword() + ";");
            }
        }
        return w.getOutput();
    }
}
