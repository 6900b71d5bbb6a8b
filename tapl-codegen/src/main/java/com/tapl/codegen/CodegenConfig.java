package com.tapl.codegen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 代码生成配置
 */
public class CodegenConfig {
    /** 每次编译开始时预先实例化的列表元素类型（文件标准库需要 list[char]） */
    private List<String> preloadedElementTypes = new ArrayList<>(Collections.singletonList("char"));
    /** include 路径中的头文件目录名 */
    private String headerDirectory = "tapl_headers";

    public CodegenConfig() {
    }

    public List<String> getPreloadedElementTypes() {
        return Collections.unmodifiableList(preloadedElementTypes);
    }

    public void setPreloadedElementTypes(List<String> preloadedElementTypes) {
        this.preloadedElementTypes = new ArrayList<>(preloadedElementTypes);
    }

    public String getHeaderDirectory() {
        return headerDirectory;
    }

    public void setHeaderDirectory(String headerDirectory) {
        if (headerDirectory == null || headerDirectory.isEmpty()) {
            throw new IllegalArgumentException("headerDirectory must not be empty");
        }
        this.headerDirectory = headerDirectory;
    }
}
