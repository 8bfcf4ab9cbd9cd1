package com.symdiff.core.diff;

import com.symdiff.core.ast.BinaryOpNode;
import com.symdiff.core.ast.ConstantNode;
import com.symdiff.core.ast.ExprNode;
import com.symdiff.core.ast.FunctionKind;
import com.symdiff.core.ast.FunctionNode;
import com.symdiff.core.ast.NodeVisitor;
import com.symdiff.core.ast.UnsupportedNodeException;
import com.symdiff.core.ast.VariableNode;
import com.symdiff.core.domain.NumericDomain;

import java.util.Objects;

/**
 * 符号求导。
 *
 * <p>按结构递归套用求导法则，每个中间结果都经过 {@link Simplifier} 构造。
 * 原表达式的子树在结果中出现时总是拷贝，原树不会被修改或共享。</p>
 */
public class Differentiator<T> implements NodeVisitor<T, ExprNode<T>> {

    private final String variable;
    private final Simplifier<T> simplifier;

    public Differentiator(NumericDomain<T> domain, String variable) {
        this.variable = Objects.requireNonNull(variable, "variable");
        this.simplifier = new Simplifier<>(domain);
    }

    public ExprNode<T> differentiate(ExprNode<T> node) {
        return node.accept(this);
    }

    @Override
    public ExprNode<T> visitConstant(ConstantNode<T> node) {
        return simplifier.constant(0);
    }

    @Override
    public ExprNode<T> visitVariable(VariableNode<T> node) {
        return simplifier.constant(node.getName().equals(variable) ? 1 : 0);
    }

    @Override
    public ExprNode<T> visitBinary(BinaryOpNode<T> node) {
        ExprNode<T> left = node.getLeft();
        ExprNode<T> right = node.getRight();
        ExprNode<T> dl = differentiate(left);
        ExprNode<T> dr = differentiate(right);
        Simplifier<T> s = simplifier;

        switch (node.getOperator()) {
            case ADD:
                return s.simplifyAdd(dl, dr);

            case SUBTRACT:
                return s.simplifyAdd(dl, s.simplifyMultiply(s.constant(-1), dr));

            case MULTIPLY:
                // (uv)' = u'v + uv'
                return s.simplifyAdd(
                        s.simplifyMultiply(dl, right.copy()),
                        s.simplifyMultiply(left.copy(), dr));

            case DIVIDE: {
                // (u/v)' = (u'v - uv') / v^2
                ExprNode<T> numerator = s.simplifyAdd(
                        s.simplifyMultiply(dl, right.copy()),
                        s.simplifyMultiply(s.constant(-1), s.simplifyMultiply(left.copy(), dr)));
                ExprNode<T> denominator = s.simplifyPower(right.copy(), s.constant(2));
                return s.simplifyDivide(numerator, denominator);
            }

            case POWER: {
                // (u^v)' = u^v * (v' ln u + v u'/u)，指数可以含变量
                ExprNode<T> lnBase = new FunctionNode<>(FunctionKind.LN, left.copy());
                ExprNode<T> factor = s.simplifyAdd(
                        s.simplifyMultiply(dr, lnBase),
                        s.simplifyMultiply(right.copy(), s.simplifyDivide(dl, left.copy())));
                return s.simplifyMultiply(s.simplifyPower(left.copy(), right.copy()), factor);
            }

            default:
                throw new UnsupportedNodeException("unsupported binary operator for diff: " + node.getOperator());
        }
    }

    @Override
    public ExprNode<T> visitFunction(FunctionNode<T> node) {
        ExprNode<T> arg = node.getArgument();
        ExprNode<T> da = differentiate(arg);
        Simplifier<T> s = simplifier;

        switch (node.getFunction()) {
            case SIN:
                return s.simplifyMultiply(new FunctionNode<>(FunctionKind.COS, arg.copy()), da);

            case COS: {
                ExprNode<T> negSin = s.simplifyMultiply(s.constant(-1),
                        new FunctionNode<>(FunctionKind.SIN, arg.copy()));
                return s.simplifyMultiply(negSin, da);
            }

            case EXP:
                return s.simplifyMultiply(new FunctionNode<>(FunctionKind.EXP, arg.copy()), da);

            case LN:
                return s.simplifyMultiply(s.simplifyDivide(s.constant(1), arg.copy()), da);

            default:
                throw new UnsupportedNodeException("unsupported function for diff: " + node.getFunction());
        }
    }
}
