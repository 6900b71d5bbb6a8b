package com.tapl.codegen.backend;

/**
 * C 代码输出配置
 */
public class EmitConfig {
    private int indentSize = 4;
    private boolean useSpaces = true;

    public int getIndentSize() {
        return indentSize;
    }

    public void setIndentSize(int indentSize) {
        if (indentSize < 0) {
            throw new IllegalArgumentException("indentSize must not be negative");
        }
        this.indentSize = indentSize;
    }

    /**
     * false 时每层缩进一个制表符，忽略 indentSize
     */
    public boolean isUseSpaces() {
        return useSpaces;
    }

    public void setUseSpaces(boolean useSpaces) {
        this.useSpaces = useSpaces;
    }
}
