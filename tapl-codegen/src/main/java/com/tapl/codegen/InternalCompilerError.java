package com.tapl.codegen;

/**
 * 编译器内部错误
 *
 * <p>表示上游阶段（类型检查）违反了代码生成的前提，例如把未解析的类型
 * 交给了列表降级。这是编译器自身的缺陷，不作为用户诊断报告。</p>
 */
public class InternalCompilerError extends Error {

    private static final long serialVersionUID = 1L;

    public InternalCompilerError(String message) {
        super(message);
    }

    public InternalCompilerError(String message, Throwable cause) {
        super(message, cause);
    }
}
