package com.symdiff.core;

import com.symdiff.core.domain.Complex;
import com.symdiff.core.domain.Domain;
import com.symdiff.core.domain.NumericDomain;
import com.symdiff.core.parser.ComplexLiteralParser;
import com.symdiff.core.parser.ExpressionParser;
import com.symdiff.core.parser.ParseException;

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 解析、求值、求导的统一入口。
 *
 * <p>{@code parse}/{@code detectDomain} 等方法在出错时抛出 {@link SymDiffException} 的子类；
 * {@code try*} 系列方法不抛异常，而是返回 {@link Outcome}，调用方按成功/失败分支处理。</p>
 */
public final class SymbolicEngine {

    private static final Logger LOG = Logger.getLogger(SymbolicEngine.class.getName());

    private SymbolicEngine() {}

    /**
     * 在指定数值域上解析表达式
     *
     * @throws ParseException 输入不是合法表达式时
     */
    public static <T> Expression<T> parse(String text, NumericDomain<T> domain) {
        return ExpressionParser.parse(text, domain);
    }

    /**
     * 在指定数值域上解析表达式，数值域仅在运行时确定
     */
    public static Expression<?> parse(String text, Domain domain) {
        return parse(text, domain.numeric());
    }

    /**
     * 按 {@link #detectDomain(String)} 的结果选择数值域后解析
     */
    public static Expression<?> parseAuto(String text) {
        Domain domain = detectDomain(text);
        LOG.fine("Detected " + domain + " domain for '" + text + "'");
        return parse(text, domain);
    }

    public static Domain detectDomain(String text) {
        return ComplexLiteralParser.detectDomain(text);
    }

    /**
     * @throws ParseException 文本不是合法的复数
     */
    public static Complex parseComplexLiteral(String text) {
        return ComplexLiteralParser.parseComplexLiteral(text);
    }

    // ============ 返回 Outcome 的版本 ============

    public static <T> Outcome<Expression<T>> tryParse(String text, NumericDomain<T> domain) {
        try {
            return Outcome.success(parse(text, domain));
        } catch (SymDiffException e) {
            LOG.log(Level.FINE, "Parse failed: " + text, e);
            return Outcome.failure(e);
        }
    }

    public static <T> Outcome<T> tryEvaluate(Expression<T> expression, Map<String, T> bindings) {
        try {
            return Outcome.success(expression.eval(bindings));
        } catch (SymDiffException e) {
            LOG.log(Level.FINE, "Evaluation failed: " + expression, e);
            return Outcome.failure(e);
        }
    }

    public static <T> Outcome<Expression<T>> tryDifferentiate(Expression<T> expression, String variable) {
        try {
            Expression<T> derivative = expression.diff(variable);
            LOG.fine("d/d" + variable + " " + expression + " = " + derivative);
            return Outcome.success(derivative);
        } catch (SymDiffException e) {
            LOG.log(Level.FINE, "Differentiation failed: " + expression, e);
            return Outcome.failure(e);
        }
    }
}
