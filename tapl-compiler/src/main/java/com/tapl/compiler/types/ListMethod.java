package com.tapl.compiler.types;

/**
 * 列表类型在源码中可调用的方法。
 */
public enum ListMethod {
    ADD("add", 1),
    GET("get", 1),
    SET("set", 2),
    DEL("del", 1),
    INSERT("insert", 2),
    SIZE("size", 0);

    private final String methodName;
    private final int arity;

    ListMethod(String methodName, int arity) {
        this.methodName = methodName;
        this.arity = arity;
    }

    public String getMethodName() {
        return methodName;
    }

    /**
     * 参数个数（不含接收者本身）。
     */
    public int getArity() {
        return arity;
    }

    /**
     * 返回值类型关键字。
     */
    public String returnKeyword(ListType listType) {
        switch (this) {
            case GET:  return listType.getInnerType().getKeyword();
            case SIZE: return "u64";
            default:   return "void";
        }
    }

    /**
     * 按源码中的方法名查找，未知名称返回 null。
     */
    public static ListMethod fromName(String name) {
        for (ListMethod method : values()) {
            if (method.methodName.equals(name)) {
                return method;
            }
        }
        return null;
    }
}
