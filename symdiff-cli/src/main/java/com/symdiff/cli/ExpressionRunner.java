package com.symdiff.cli;

import com.google.gson.JsonObject;
import com.symdiff.core.Expression;
import com.symdiff.core.Outcome;
import com.symdiff.core.SymbolicEngine;
import com.symdiff.core.domain.Domain;
import com.symdiff.core.domain.NumericDomain;

import java.io.PrintWriter;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 求值和求导的执行器，供子命令和 REPL 共用。
 *
 * <p>返回值是进程退出码：0 成功，1 解析或求值错误（消息写到 err）。
 * 绑定格式错误属于用法错误，以 {@link IllegalArgumentException} 抛给调用方。</p>
 */
public class ExpressionRunner {

    private static final Logger LOG = Logger.getLogger(ExpressionRunner.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;

    private final SessionConfig config;
    private final PrintWriter out;
    private final PrintWriter err;

    public ExpressionRunner(SessionConfig config, PrintWriter out, PrintWriter err) {
        this.config = config;
        this.out = out;
        this.err = err;
    }

    /**
     * 解析并求值，打印结果
     */
    public int evaluate(String text, List<String> bindingTokens) {
        return evaluate(text, resolveDomain(text, bindingTokens).numeric(), bindingTokens);
    }

    /**
     * 解析并对 variable 求导，打印导数；有绑定时再打印导数在该点的值
     */
    public int differentiate(String text, String variable, List<String> bindingTokens) {
        return differentiate(text, variable, resolveDomain(text, bindingTokens).numeric(), bindingTokens);
    }

    /**
     * 确定数值域。AUTO 模式下表达式或任一绑定值含独立的 i 时使用复数域。
     */
    Domain resolveDomain(String text, List<String> bindingTokens) {
        Domain fixed = config.getDomainMode().fixedDomain();
        if (fixed != null) {
            return fixed;
        }
        if (SymbolicEngine.detectDomain(text) == Domain.COMPLEX) {
            return Domain.COMPLEX;
        }
        if (bindingTokens != null) {
            for (String token : bindingTokens) {
                int eq = token.indexOf('=');
                if (eq >= 0 && SymbolicEngine.detectDomain(token.substring(eq + 1)) == Domain.COMPLEX) {
                    LOG.fine("Binding '" + token + "' requires complex domain");
                    return Domain.COMPLEX;
                }
            }
        }
        return Domain.REAL;
    }

    private <T> int evaluate(String text, NumericDomain<T> domain, List<String> bindingTokens) {
        Map<String, T> bindings = BindingParser.parse(bindingTokens, domain);

        Outcome<Expression<T>> parsed = SymbolicEngine.tryParse(text, domain);
        if (!parsed.isSuccess()) {
            return fail(parsed);
        }
        Expression<T> expression = parsed.getValue();

        Outcome<T> value = SymbolicEngine.tryEvaluate(expression, bindings);
        if (!value.isSuccess()) {
            return fail(value);
        }

        String formatted = domain.format(value.getValue());
        if (config.isJson()) {
            JsonObject document = document(text, domain, expression);
            document.addProperty("result", formatted);
            out.println(AstJsonWriter.print(document));
        } else {
            out.println(formatted);
        }
        out.flush();
        return EXIT_OK;
    }

    private <T> int differentiate(String text, String variable, NumericDomain<T> domain,
                                  List<String> bindingTokens) {
        Map<String, T> bindings = BindingParser.parse(bindingTokens, domain);

        Outcome<Expression<T>> parsed = SymbolicEngine.tryParse(text, domain);
        if (!parsed.isSuccess()) {
            return fail(parsed);
        }
        Expression<T> expression = parsed.getValue();

        Outcome<Expression<T>> derived = SymbolicEngine.tryDifferentiate(expression, variable);
        if (!derived.isSuccess()) {
            return fail(derived);
        }
        Expression<T> derivative = derived.getValue();

        String formatted = null;
        if (!bindings.isEmpty()) {
            Outcome<T> value = SymbolicEngine.tryEvaluate(derivative, bindings);
            if (!value.isSuccess()) {
                return fail(value);
            }
            formatted = domain.format(value.getValue());
        }

        if (config.isJson()) {
            JsonObject document = document(text, domain, expression);
            document.addProperty("variable", variable);
            document.addProperty("derivative", derivative.toString());
            document.add("derivativeAst", AstJsonWriter.toJson(derivative));
            if (formatted != null) {
                document.addProperty("result", formatted);
            }
            out.println(AstJsonWriter.print(document));
        } else {
            out.println(derivative);
            if (formatted != null) {
                out.println(formatted);
            }
        }
        out.flush();
        return EXIT_OK;
    }

    private static <T> JsonObject document(String text, NumericDomain<T> domain, Expression<T> expression) {
        JsonObject document = new JsonObject();
        document.addProperty("input", text);
        document.addProperty("domain", domain.toString());
        document.addProperty("parsed", expression.toString());
        document.add("ast", AstJsonWriter.toJson(expression));
        return document;
    }

    private int fail(Outcome<?> outcome) {
        err.println("错误: " + outcome.getMessage());
        err.flush();
        return EXIT_ERROR;
    }
}
