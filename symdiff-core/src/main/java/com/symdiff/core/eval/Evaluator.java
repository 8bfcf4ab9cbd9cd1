package com.symdiff.core.eval;

import com.symdiff.core.ast.BinaryOpNode;
import com.symdiff.core.ast.ConstantNode;
import com.symdiff.core.ast.ExprNode;
import com.symdiff.core.ast.FunctionNode;
import com.symdiff.core.ast.NodeVisitor;
import com.symdiff.core.ast.UnsupportedNodeException;
import com.symdiff.core.ast.VariableNode;
import com.symdiff.core.domain.NumericDomain;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * 表达式求值器。
 *
 * <p>在给定的变量绑定下递归求值，错误在发现处以 {@link EvaluationException} 抛出。</p>
 */
public class Evaluator<T> implements NodeVisitor<T, T> {

    private final NumericDomain<T> domain;
    private final Map<String, T> bindings;

    public Evaluator(NumericDomain<T> domain, Map<String, T> bindings) {
        this.domain = Objects.requireNonNull(domain, "domain");
        this.bindings = bindings != null ? bindings : Collections.<String, T>emptyMap();
    }

    public T evaluate(ExprNode<T> node) {
        return node.accept(this);
    }

    @Override
    public T visitConstant(ConstantNode<T> node) {
        return node.getValue();
    }

    @Override
    public T visitVariable(VariableNode<T> node) {
        String name = node.getName();
        // 数值域内建常量（复数域的 i）优先于绑定
        T builtin = domain.resolveBuiltin(name);
        if (builtin != null) {
            return builtin;
        }
        T value = bindings.get(name);
        if (value == null) {
            throw new EvaluationException("variable not found: " + name);
        }
        return value;
    }

    @Override
    public T visitBinary(BinaryOpNode<T> node) {
        T left = evaluate(node.getLeft());
        T right = evaluate(node.getRight());
        switch (node.getOperator()) {
            case ADD:      return domain.add(left, right);
            case SUBTRACT: return domain.subtract(left, right);
            case MULTIPLY: return domain.multiply(left, right);
            case DIVIDE:
                if (domain.isZero(right)) {
                    throw new EvaluationException("division by zero");
                }
                return domain.divide(left, right);
            case POWER:    return domain.power(left, right);
            default:
                throw new UnsupportedNodeException("unsupported binary operator: " + node.getOperator());
        }
    }

    @Override
    public T visitFunction(FunctionNode<T> node) {
        T arg = evaluate(node.getArgument());
        switch (node.getFunction()) {
            case SIN: return domain.sin(arg);
            case COS: return domain.cos(arg);
            case EXP: return domain.exp(arg);
            case LN:
                if (domain.isOutsideLogDomain(arg)) {
                    throw new EvaluationException("logarithm domain error");
                }
                return domain.log(arg);
            default:
                throw new UnsupportedNodeException("unsupported function: " + node.getFunction());
        }
    }
}
