package com.symdiff.core.ast;

import java.util.Objects;

/**
 * 二元运算
 */
public final class BinaryOpNode<T> extends ExprNode<T> {
    private final BinaryOp operator;
    private final ExprNode<T> left;
    private final ExprNode<T> right;

    public BinaryOpNode(BinaryOp operator, ExprNode<T> left, ExprNode<T> right) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public ExprNode<T> getLeft() {
        return left;
    }

    public ExprNode<T> getRight() {
        return right;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BINARY;
    }

    @Override
    public BinaryOpNode<T> copy() {
        return new BinaryOpNode<>(operator, left.copy(), right.copy());
    }

    @Override
    public <R> R accept(NodeVisitor<T, R> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public String toString() {
        return "(" + left + operator.getSymbol() + right + ")";
    }
}
