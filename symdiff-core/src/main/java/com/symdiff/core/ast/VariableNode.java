package com.symdiff.core.ast;

import java.util.Objects;

/**
 * 变量
 */
public final class VariableNode<T> extends ExprNode<T> {
    private final String name;

    public VariableNode(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getName() {
        return name;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.VARIABLE;
    }

    @Override
    public VariableNode<T> copy() {
        return new VariableNode<>(name);
    }

    @Override
    public <R> R accept(NodeVisitor<T, R> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
