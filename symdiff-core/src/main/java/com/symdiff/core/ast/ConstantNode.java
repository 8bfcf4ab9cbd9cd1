package com.symdiff.core.ast;

import com.symdiff.core.domain.NumericDomain;

import java.util.Objects;

/**
 * 常量
 */
public final class ConstantNode<T> extends ExprNode<T> {
    private final NumericDomain<T> domain;
    private final T value;

    public ConstantNode(NumericDomain<T> domain, T value) {
        this.domain = Objects.requireNonNull(domain, "domain");
        this.value = Objects.requireNonNull(value, "value");
    }

    public T getValue() {
        return value;
    }

    public NumericDomain<T> getDomain() {
        return domain;
    }

    public boolean isZero() {
        return domain.isZero(value);
    }

    public boolean isOne() {
        return domain.isOne(value);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CONSTANT;
    }

    @Override
    public ConstantNode<T> copy() {
        return new ConstantNode<>(domain, value);
    }

    @Override
    public <R> R accept(NodeVisitor<T, R> visitor) {
        return visitor.visitConstant(this);
    }

    @Override
    public String toString() {
        return domain.format(value);
    }
}
