package com.tapl.codegen.backend;

import com.tapl.codegen.lowering.ListInstantiation;
import com.tapl.compiler.types.ClassType;

import java.util.Collection;

/**
 * 生成 {@code list.h}：按首次解析顺序拼接所有列表实例的定义。
 * 有类类型元素时额外包含 {@code classes.h}。
 */
public class ListHeaderEmitter {

    public static final String FILE_NAME = "list.h";
    /** 类定义头文件，由语句代码生成器输出 */
    public static final String CLASSES_FILE_NAME = "classes.h";

    private final EmitConfig config;
    private final String headerDirectory;

    /**
     * @param headerDirectory include 路径中的头文件目录名，例如 {@code tapl_headers}
     */
    public ListHeaderEmitter(EmitConfig config, String headerDirectory) {
        this.config = config;
        this.headerDirectory = headerDirectory;
    }

    public String emit(Collection<ListInstantiation> instantiations) {
        CSourceWriter w = new CSourceWriter(config);
        w.line("#pragma once");
        w.blankLine();
        w.line("#include <stdio.h>");
        w.line("#include <stdlib.h>");
        w.blankLine();
        w.line("#include <" + headerDirectory + "/" + TypesHeaderEmitter.FILE_NAME + ">");
        w.line("#include <" + headerDirectory + "/" + RuntimeSupportEmitter.FILE_NAME + ">");
        for (ListInstantiation instantiation : instantiations) {
            if (instantiation.getElementType() instanceof ClassType) {
                w.line("#include <" + headerDirectory + "/" + CLASSES_FILE_NAME + ">");
                break;
            }
        }
        StringBuilder sb = new StringBuilder(w.getOutput());
        for (ListInstantiation instantiation : instantiations) {
            sb.append('\n').append(instantiation.getSource());
        }
        return sb.toString();
    }
}
