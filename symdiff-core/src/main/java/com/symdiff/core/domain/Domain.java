package com.symdiff.core.domain;

/**
 * 表达式所基于的数值域
 */
public enum Domain {
    REAL,
    COMPLEX;

    /** 该数值域对应的运算实现 */
    public NumericDomain<?> numeric() {
        switch (this) {
            case COMPLEX: return ComplexDomain.INSTANCE;
            case REAL:
            default:      return RealDomain.INSTANCE;
        }
    }
}
