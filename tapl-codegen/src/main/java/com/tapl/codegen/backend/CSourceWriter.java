package com.tapl.codegen.backend;

/**
 * C 源码输出缓冲区，按行写入并跟踪块的嵌套深度。
 * 输出只依赖写入顺序和配置，相同输入总是得到相同文本。
 */
public class CSourceWriter {
    private final StringBuilder output = new StringBuilder();
    /** 单层缩进，构造时由配置确定 */
    private final String indentUnit;
    private int depth = 0;

    public CSourceWriter(EmitConfig config) {
        this.indentUnit = config.isUseSpaces() ? " ".repeat(config.getIndentSize()) : "\t";
    }

    public void indent() {
        depth++;
    }

    public void dedent() {
        if (depth > 0) {
            depth--;
        }
    }

    /**
     * 在当前深度输出一整行
     */
    public CSourceWriter line(String text) {
        output.append(indentUnit.repeat(depth)).append(text).append('\n');
        return this;
    }

    /**
     * 追加空行；文件开头和已有空行之后不再追加
     */
    public CSourceWriter blankLine() {
        int length = output.length();
        if (length > 0 && !(length >= 2 && output.charAt(length - 2) == '\n')) {
            output.append('\n');
        }
        return this;
    }

    /**
     * 输出 "header {" 并进入块
     */
    public CSourceWriter openBlock(String header) {
        line(header + " {");
        indent();
        return this;
    }

    public CSourceWriter closeBlock() {
        return closeBlock("}");
    }

    /**
     * 离开块并输出闭合文本，例如 "};"
     */
    public CSourceWriter closeBlock(String closing) {
        dedent();
        return line(closing);
    }

    /**
     * 在同一层级继续块，例如 "} else {"
     */
    public CSourceWriter continueBlock(String text) {
        dedent();
        line(text);
        indent();
        return this;
    }

    public String getOutput() {
        return output.toString();
    }
}
