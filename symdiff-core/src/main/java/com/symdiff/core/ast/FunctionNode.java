package com.symdiff.core.ast;

import java.util.Objects;

/**
 * 一元函数调用
 */
public final class FunctionNode<T> extends ExprNode<T> {
    private final FunctionKind function;
    private final ExprNode<T> argument;

    public FunctionNode(FunctionKind function, ExprNode<T> argument) {
        this.function = Objects.requireNonNull(function, "function");
        this.argument = Objects.requireNonNull(argument, "argument");
    }

    public FunctionKind getFunction() {
        return function;
    }

    public ExprNode<T> getArgument() {
        return argument;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FUNCTION;
    }

    @Override
    public FunctionNode<T> copy() {
        return new FunctionNode<>(function, argument.copy());
    }

    @Override
    public <R> R accept(NodeVisitor<T, R> visitor) {
        return visitor.visitFunction(this);
    }

    @Override
    public String toString() {
        return function.getFunctionName() + "(" + argument + ")";
    }
}
