package com.symdiff.core.ast;

/**
 * 表达式树节点基类。
 *
 * <p>变体集合是封闭的：构造器仅包内可见，只有 {@link ConstantNode}、{@link VariableNode}、
 * {@link BinaryOpNode}、{@link FunctionNode} 四种。节点创建后不可变，
 * 组合时总是先 {@link #copy()} 再挂到新父节点下，任何子树都不会被两棵树共享。</p>
 *
 * @param <T> 数值域标量类型
 */
public abstract class ExprNode<T> {

    ExprNode() {
    }

    public abstract NodeKind getKind();

    /** 深拷贝整棵子树 */
    public abstract ExprNode<T> copy();

    public abstract <R> R accept(NodeVisitor<T, R> visitor);

    public boolean isConstant() {
        return getKind() == NodeKind.CONSTANT;
    }

    @Override
    public abstract String toString();
}
