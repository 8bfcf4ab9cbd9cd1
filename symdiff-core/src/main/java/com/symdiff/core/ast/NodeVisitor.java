package com.symdiff.core.ast;

/**
 * 表达式树访问者。
 *
 * <p>每种节点变体一个方法，新增变体会让所有实现编译失败。</p>
 *
 * @param <T> 数值域标量类型
 * @param <R> 返回类型
 */
public interface NodeVisitor<T, R> {

    R visitConstant(ConstantNode<T> node);

    R visitVariable(VariableNode<T> node);

    R visitBinary(BinaryOpNode<T> node);

    R visitFunction(FunctionNode<T> node);
}
