package com.symdiff.core.ast;

/**
 * 节点变体
 */
public enum NodeKind {
    CONSTANT,
    VARIABLE,
    BINARY,
    FUNCTION
}
