package com.symdiff.core.diff;

import com.symdiff.core.ast.BinaryOp;
import com.symdiff.core.ast.BinaryOpNode;
import com.symdiff.core.ast.ConstantNode;
import com.symdiff.core.ast.ExprNode;
import com.symdiff.core.domain.NumericDomain;
import com.symdiff.core.eval.EvaluationException;

import java.util.Objects;

/**
 * 构造节点时的局部化简。
 *
 * <p>每个方法只做一步改写：消去单位元、零元，两侧都是常量时直接折叠。
 * 不会递归化简整棵树，嵌套的冗余结构可能保留。</p>
 */
public class Simplifier<T> {

    private final NumericDomain<T> domain;

    public Simplifier(NumericDomain<T> domain) {
        this.domain = Objects.requireNonNull(domain, "domain");
    }

    public ExprNode<T> simplifyAdd(ExprNode<T> left, ExprNode<T> right) {
        if (isZero(left)) return right;
        if (isZero(right)) return left;
        if (left.isConstant() && right.isConstant()) {
            return constant(domain.add(valueOf(left), valueOf(right)));
        }
        return new BinaryOpNode<>(BinaryOp.ADD, left, right);
    }

    public ExprNode<T> simplifyMultiply(ExprNode<T> left, ExprNode<T> right) {
        if (isOne(left)) return right;
        if (isOne(right)) return left;
        if (isZero(left) || isZero(right)) {
            return constant(domain.zero());
        }
        if (left.isConstant() && right.isConstant()) {
            return constant(domain.multiply(valueOf(left), valueOf(right)));
        }
        return new BinaryOpNode<>(BinaryOp.MULTIPLY, left, right);
    }

    /**
     * @throws EvaluationException 两侧都是常量且除数为 0 时
     */
    public ExprNode<T> simplifyDivide(ExprNode<T> left, ExprNode<T> right) {
        if (isOne(right)) return left;
        if (isZero(left)) {
            return constant(domain.zero());
        }
        if (left.isConstant() && right.isConstant()) {
            T divisor = valueOf(right);
            if (domain.isZero(divisor)) {
                throw new EvaluationException("division by zero");
            }
            return constant(domain.divide(valueOf(left), divisor));
        }
        return new BinaryOpNode<>(BinaryOp.DIVIDE, left, right);
    }

    public ExprNode<T> simplifyPower(ExprNode<T> base, ExprNode<T> exponent) {
        if (isOne(exponent)) return base;
        if (isZero(exponent)) {
            return constant(domain.one());
        }
        if (base.isConstant() && exponent.isConstant()) {
            return constant(domain.power(valueOf(base), valueOf(exponent)));
        }
        return new BinaryOpNode<>(BinaryOp.POWER, base, exponent);
    }

    ConstantNode<T> constant(T value) {
        return new ConstantNode<>(domain, value);
    }

    ConstantNode<T> constant(double value) {
        return constant(domain.fromDouble(value));
    }

    private static <T> boolean isZero(ExprNode<T> node) {
        return node.isConstant() && ((ConstantNode<T>) node).isZero();
    }

    private static <T> boolean isOne(ExprNode<T> node) {
        return node.isConstant() && ((ConstantNode<T>) node).isOne();
    }

    private static <T> T valueOf(ExprNode<T> node) {
        return ((ConstantNode<T>) node).getValue();
    }
}
