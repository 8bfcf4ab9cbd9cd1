package com.symdiff.core;

import com.symdiff.core.ast.BinaryOp;
import com.symdiff.core.ast.BinaryOpNode;
import com.symdiff.core.ast.ConstantNode;
import com.symdiff.core.ast.ExprNode;
import com.symdiff.core.ast.FunctionKind;
import com.symdiff.core.ast.FunctionNode;
import com.symdiff.core.ast.VariableNode;
import com.symdiff.core.diff.Differentiator;
import com.symdiff.core.domain.NumericDomain;
import com.symdiff.core.eval.EvaluationException;
import com.symdiff.core.eval.Evaluator;

import java.util.Map;
import java.util.Objects;

/**
 * 值语义的表达式，独占一棵表达式树。
 *
 * <p>创建后不可变。所有组合操作（四则运算、乘方、函数、求导）都先深拷贝操作数的树
 * 再挂到新的父节点下，因此不同 Expression 之间从不共享节点，可以在多个线程间自由传递。</p>
 *
 * @param <T> 数值域标量类型
 */
public final class Expression<T> {
    private final NumericDomain<T> domain;
    private final ExprNode<T> root;

    /**
     * 包装一棵树的拷贝，传入的 root 仍归调用方所有
     */
    public Expression(NumericDomain<T> domain, ExprNode<T> root) {
        this(domain, Objects.requireNonNull(root, "root").copy(), true);
    }

    // owned: root 是新建的树，直接接管
    private Expression(NumericDomain<T> domain, ExprNode<T> root, boolean owned) {
        this.domain = Objects.requireNonNull(domain, "domain");
        this.root = root;
    }

    private static <T> Expression<T> own(NumericDomain<T> domain, ExprNode<T> root) {
        return new Expression<>(domain, root, true);
    }

    public static <T> Expression<T> constant(NumericDomain<T> domain, T value) {
        return own(domain, new ConstantNode<>(domain, value));
    }

    public static <T> Expression<T> variable(NumericDomain<T> domain, String name) {
        return own(domain, new VariableNode<>(name));
    }

    public NumericDomain<T> getDomain() {
        return domain;
    }

    /** 返回根节点的拷贝 */
    public ExprNode<T> getRoot() {
        return root.copy();
    }

    // ============ 组合 ============

    public Expression<T> add(Expression<T> other) {
        return combine(BinaryOp.ADD, other);
    }

    public Expression<T> subtract(Expression<T> other) {
        return combine(BinaryOp.SUBTRACT, other);
    }

    public Expression<T> multiply(Expression<T> other) {
        return combine(BinaryOp.MULTIPLY, other);
    }

    public Expression<T> divide(Expression<T> other) {
        return combine(BinaryOp.DIVIDE, other);
    }

    public Expression<T> pow(Expression<T> exponent) {
        return combine(BinaryOp.POWER, exponent);
    }

    public Expression<T> combine(BinaryOp operator, Expression<T> other) {
        return own(domain, new BinaryOpNode<>(operator, root.copy(), other.root.copy()));
    }

    public Expression<T> sin() {
        return apply(FunctionKind.SIN);
    }

    public Expression<T> cos() {
        return apply(FunctionKind.COS);
    }

    public Expression<T> exp() {
        return apply(FunctionKind.EXP);
    }

    public Expression<T> ln() {
        return apply(FunctionKind.LN);
    }

    public Expression<T> apply(FunctionKind function) {
        return own(domain, new FunctionNode<>(function, root.copy()));
    }

    // ============ 求值与求导 ============

    /**
     * 在给定绑定下求值
     *
     * @throws EvaluationException 变量未绑定、除以零或对数定义域错误
     */
    public T eval(Map<String, T> bindings) {
        return new Evaluator<>(domain, bindings).evaluate(root);
    }

    /**
     * 对单个变量求导，结果是新的表达式
     */
    public Expression<T> diff(String variable) {
        return own(domain, new Differentiator<>(domain, variable).differentiate(root));
    }

    @Override
    public String toString() {
        return root.toString();
    }
}
