package com.symdiff.core.ast;

/**
 * 一元函数
 */
public enum FunctionKind {
    SIN("sin"),
    COS("cos"),
    LN("ln"),
    EXP("exp");

    private final String functionName;

    FunctionKind(String functionName) {
        this.functionName = functionName;
    }

    public String getFunctionName() {
        return functionName;
    }

    /**
     * 按函数名查找
     *
     * @return 对应的函数，不在 {sin, cos, exp, ln} 中时返回 null
     */
    public static FunctionKind fromName(String name) {
        for (FunctionKind kind : values()) {
            if (kind.functionName.equals(name)) {
                return kind;
            }
        }
        return null;
    }
}
