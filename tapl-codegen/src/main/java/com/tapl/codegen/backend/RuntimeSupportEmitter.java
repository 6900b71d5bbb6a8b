package com.tapl.codegen.backend;

/**
 * 生成 {@code utility_functions.h}：被编译程序共用的运行时支持函数。
 * 目前只有 {@code panic}：向 stderr 输出红色错误信息并以状态 1 退出。
 */
public class RuntimeSupportEmitter {

    public static final String FILE_NAME = "utility_functions.h";

    private final EmitConfig config;

    public RuntimeSupportEmitter(EmitConfig config) {
        this.config = config;
    }

    public String emit() {
        CSourceWriter w = new CSourceWriter(config);
        w.line("#pragma once");
        w.blankLine();
        w.line("#include <stdio.h>");
        w.line("#include <stdlib.h>");
        w.blankLine();
        w.line("#define RED   \"\\x1b[31m\"");
        w.line("#define RESET \"\\x1b[0m\"");
        w.blankLine();
        w.openBlock("void panic(const char* message)");
        w.line("fprintf(stderr, RED \"panic: %s!\\n\" RESET, message);");
        w.line("exit(1);");
        w.closeBlock();
        return w.getOutput();
    }
}
