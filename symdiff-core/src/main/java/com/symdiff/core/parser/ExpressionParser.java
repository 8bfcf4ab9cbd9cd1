package com.symdiff.core.parser;

import com.symdiff.core.Expression;
import com.symdiff.core.ast.BinaryOp;
import com.symdiff.core.ast.FunctionKind;
import com.symdiff.core.domain.NumericDomain;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * 中缀表达式解析器（调度场算法）。
 *
 * <p>从左到右单遍扫描，数字和标识符在扫描中直接识别，没有独立的词法分析阶段：</p>
 * <ul>
 *   <li>数字和至多一个小数点组成数字字面量，作为常量压入值栈</li>
 *   <li>连续字母组成标识符；属于 {sin, cos, exp, ln} 时压入函数名栈（延迟应用），否则作为变量压入值栈</li>
 *   <li>{@code (} 作为标记压入运算符栈</li>
 *   <li>{@code )} 弹出并应用运算符直到遇到 {@code (}；此时若函数名栈非空，弹出一个函数名应用到栈顶的值</li>
 *   <li>{@code + - * / ^}：栈顶运算符优先级 &gt;= 当前运算符时先弹出应用，再压入当前运算符</li>
 * </ul>
 *
 * <p>因为比较用的是 &gt;=，{@code ^} 是左结合的：{@code 2^3^2} 解析为 {@code (2^3)^2}。
 * 函数名与括号之间只靠栈的先后顺序对应，不做显式配对。
 * 不支持一元负号和隐式乘法。</p>
 */
public class ExpressionParser<T> {

    private static final Logger LOG = Logger.getLogger(ExpressionParser.class.getName());

    private static final char OPEN_PAREN = '(';

    private final String source;
    private final NumericDomain<T> domain;

    private final Deque<Expression<T>> values = new ArrayDeque<>();
    private final Deque<Character> operators = new ArrayDeque<>();
    private final Deque<FunctionKind> functions = new ArrayDeque<>();

    private int current = 0;

    public ExpressionParser(String source, NumericDomain<T> domain) {
        this.source = Objects.requireNonNull(source, "source");
        this.domain = Objects.requireNonNull(domain, "domain");
    }

    /**
     * 解析整段输入
     *
     * @throws ParseException 输入不是合法表达式时
     */
    public static <T> Expression<T> parse(String source, NumericDomain<T> domain) {
        return new ExpressionParser<>(source, domain).parse();
    }

    public Expression<T> parse() {
        values.clear();
        operators.clear();
        functions.clear();
        current = 0;

        while (!isAtEnd()) {
            int start = current;
            char c = advance();

            if (Character.isWhitespace(c)) {
                continue;
            }
            if (isDigit(c) || c == '.') {
                number(start);
            } else if (Character.isLetter(c)) {
                identifier(start);
            } else if (c == OPEN_PAREN) {
                operators.push(OPEN_PAREN);
            } else if (c == ')') {
                closeParen(start);
            } else {
                BinaryOp op = BinaryOp.fromSymbol(c);
                if (op == null) {
                    throw new ParseException("invalid character '" + c + "'", start + 1);
                }
                operator(op);
            }
        }

        while (!operators.isEmpty()) {
            if (operators.peek() == OPEN_PAREN) {
                throw new ParseException("mismatched parentheses: unclosed '('");
            }
            applyOperator();
        }

        if (!functions.isEmpty()) {
            throw new ParseException("function call without parentheses: " + functions.peek().getFunctionName());
        }
        if (values.size() != 1) {
            throw new ParseException("invalid expression");
        }

        Expression<T> result = values.pop();
        LOG.fine("Parsed '" + source + "' over " + domain + " domain: " + result);
        return result;
    }

    // === 扫描 ===

    private void number(int start) {
        boolean seenDot = source.charAt(start) == '.';
        while (!isAtEnd() && (isDigit(peek()) || (peek() == '.' && !seenDot))) {
            if (peek() == '.') {
                seenDot = true;
            }
            advance();
        }

        String text = source.substring(start, current);
        try {
            values.push(Expression.constant(domain, domain.parseNumber(text)));
        } catch (NumberFormatException e) {
            throw new ParseException("invalid number literal '" + text + "'", start + 1);
        }
    }

    private void identifier(int start) {
        while (!isAtEnd() && Character.isLetter(peek())) {
            advance();
        }

        String name = source.substring(start, current);
        FunctionKind function = FunctionKind.fromName(name);
        if (function != null) {
            functions.push(function);
        } else {
            values.push(Expression.variable(domain, name));
        }
    }

    private void closeParen(int start) {
        while (!operators.isEmpty() && operators.peek() != OPEN_PAREN) {
            applyOperator();
        }
        if (operators.isEmpty()) {
            throw new ParseException("mismatched parentheses: unexpected ')'", start + 1);
        }
        operators.pop();

        if (!functions.isEmpty()) {
            applyFunction(start);
        }
    }

    private void operator(BinaryOp op) {
        while (!operators.isEmpty() && precedence(operators.peek()) >= op.getPrecedence()) {
            applyOperator();
        }
        operators.push(op.getSymbol());
    }

    // === 归约 ===

    private void applyOperator() {
        char symbol = operators.pop();
        if (values.size() < 2) {
            throw new ParseException("missing operand for '" + symbol + "'");
        }
        Expression<T> right = values.pop();
        Expression<T> left = values.pop();
        values.push(left.combine(BinaryOp.fromSymbol(symbol), right));
    }

    private void applyFunction(int start) {
        FunctionKind function = functions.pop();
        if (values.isEmpty()) {
            throw new ParseException("missing argument for function '" + function.getFunctionName() + "'", start + 1);
        }
        values.push(values.pop().apply(function));
    }

    private static int precedence(char symbol) {
        BinaryOp op = BinaryOp.fromSymbol(symbol);
        return op != null ? op.getPrecedence() : 0;
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        return source.charAt(current++);
    }

    private char peek() {
        return source.charAt(current);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
