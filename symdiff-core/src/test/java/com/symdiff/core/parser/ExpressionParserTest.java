package com.symdiff.core.parser;

import com.symdiff.core.Expression;
import com.symdiff.core.domain.Complex;
import com.symdiff.core.domain.ComplexDomain;
import com.symdiff.core.domain.RealDomain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ExpressionParser 单元测试
 */
class ExpressionParserTest {

    private Expression<Double> parse(String source) {
        return ExpressionParser.parse(source, RealDomain.INSTANCE);
    }

    private String tree(String source) {
        return parse(source).toString();
    }

    private double eval(String source) {
        return parse(source).eval(Collections.<String, Double>emptyMap());
    }

    private ParseException parseError(String source) {
        return assertThrows(ParseException.class, () -> parse(source));
    }

    // ============ 字面量与标识符 ============

    @Nested
    @DisplayName("字面量与标识符")
    class LiteralTests {

        @Test
        @DisplayName("整数和小数")
        void testNumbers() {
            assertEquals("42", tree("42"));
            assertEquals("3.5", tree("3.5"));
            assertEquals("0.5", tree("0.50"));
            assertEquals("0.25", tree(".25"));
        }

        @Test
        @DisplayName("变量名是连续的字母")
        void testVariable() {
            assertEquals("alpha", tree("alpha"));
            assertEquals("(x+y)", tree("x+y"));
        }

        @Test
        @DisplayName("空白被跳过")
        void testWhitespace() {
            assertEquals("(5+7)", tree("  5 +\t7 "));
        }

        @Test
        @DisplayName("第二个小数点开始一个新的数字")
        void testSecondDotStartsNewNumber() {
            ParseException e = parseError("1.2.3");
            assertTrue(e.getMessage().contains("invalid expression"));
        }

        @Test
        @DisplayName("单独的小数点不是数字")
        void testLoneDot() {
            ParseException e = parseError("1 + .");
            assertTrue(e.getMessage().contains("invalid number literal"));
            assertEquals(5, e.getColumn());
        }
    }

    // ============ 运算符优先级 ============

    @Nested
    @DisplayName("运算符优先级")
    class PrecedenceTests {

        @Test
        @DisplayName("乘法优先于加法")
        void testMulOverAdd() {
            assertEquals("(1+(2*3))", tree("1 + 2 * 3"));
            assertEquals(7.0, eval("1 + 2 * 3"));
        }

        @Test
        @DisplayName("括号改变优先级")
        void testParentheses() {
            assertEquals("((1+2)*3)", tree("(1 + 2) * 3"));
            assertEquals(9.0, eval("(1 + 2) * 3"));
        }

        @Test
        @DisplayName("同级运算左结合")
        void testLeftAssociative() {
            assertEquals("((8-4)-2)", tree("8 - 4 - 2"));
            assertEquals("((3*y)/6)", tree("3 * y / 6"));
        }

        @Test
        @DisplayName("乘方同样按左结合解析")
        void testPowerIsLeftAssociative() {
            assertEquals("((2^3)^2)", tree("2^3^2"));
            assertEquals(64.0, eval("2^3^2"));
        }

        @Test
        @DisplayName("乘方优先于乘法")
        void testPowerOverMul() {
            assertEquals("(2*(x^2))", tree("2 * x ^ 2"));
        }
    }

    // ============ 函数调用 ============

    @Nested
    @DisplayName("函数调用")
    class FunctionTests {

        @Test
        @DisplayName("四个内置函数")
        void testBuiltinFunctions() {
            assertEquals("sin(x)", tree("sin(x)"));
            assertEquals("cos(x)", tree("cos(x)"));
            assertEquals("exp(x)", tree("exp(x)"));
            assertEquals("ln(x)", tree("ln(x)"));
        }

        @Test
        @DisplayName("函数参数可以是表达式")
        void testCompoundArgument() {
            assertEquals("sin((x+1))", tree("sin(x + 1)"));
        }

        @Test
        @DisplayName("嵌套调用")
        void testNested() {
            assertEquals("sin(cos(x))", tree("sin(cos(x))"));
        }

        @Test
        @DisplayName("并列调用")
        void testSiblings() {
            assertEquals("(sin(x)+cos(y))", tree("sin(x) + cos(y)"));
        }

        @Test
        @DisplayName("函数名在遇到第一个右括号时应用")
        void testFunctionAppliedAtFirstClosingParen() {
            assertEquals("(sin((x+1))*2)", tree("sin((x + 1) * 2)"));
        }

        @Test
        @DisplayName("不在函数集合中的标识符是变量")
        void testUnknownNameIsVariable() {
            assertEquals("tan", tree("tan"));
        }

        @Test
        @DisplayName("函数名后缺少括号")
        void testMissingParentheses() {
            ParseException e = parseError("sin x");
            assertTrue(e.getMessage().contains("function call without parentheses"));
        }

        @Test
        @DisplayName("空参数")
        void testEmptyArgument() {
            ParseException e = parseError("sin()");
            assertTrue(e.getMessage().contains("missing argument"));
        }
    }

    // ============ 错误处理 ============

    @Nested
    @DisplayName("错误处理")
    class ErrorTests {

        @Test
        @DisplayName("非法字符")
        void testInvalidCharacter() {
            ParseException e = parseError("2 & 3");
            assertTrue(e.getMessage().contains("invalid character '&'"));
            assertEquals(3, e.getColumn());
        }

        @Test
        @DisplayName("未闭合的左括号")
        void testUnclosedParen() {
            ParseException e = parseError("(1 + 2");
            assertTrue(e.getMessage().contains("mismatched parentheses"));
        }

        @Test
        @DisplayName("多余的右括号")
        void testUnexpectedClosingParen() {
            ParseException e = parseError("1 + 2)");
            assertTrue(e.getMessage().contains("mismatched parentheses"));
            assertEquals(6, e.getColumn());
        }

        @Test
        @DisplayName("缺少操作数")
        void testMissingOperand() {
            assertTrue(parseError("1 +").getMessage().contains("missing operand"));
            assertTrue(parseError("*").getMessage().contains("missing operand"));
        }

        @Test
        @DisplayName("不支持一元负号")
        void testNoUnaryMinus() {
            assertThrows(ParseException.class, () -> parse("-x"));
        }

        @Test
        @DisplayName("值栈最终必须只剩一个值")
        void testLeftoverValues() {
            assertTrue(parseError("2 3").getMessage().contains("invalid expression"));
            assertTrue(parseError("").getMessage().contains("invalid expression"));
            assertTrue(parseError("2x").getMessage().contains("invalid expression"));
        }
    }

    // ============ 复数域 ============

    @Nested
    @DisplayName("复数域")
    class ComplexDomainTests {

        @Test
        @DisplayName("数字字面量是实部")
        void testLiteral() {
            Expression<Complex> expr = ExpressionParser.parse("2.5", ComplexDomain.INSTANCE);
            assertEquals(Complex.ofReal(2.5), expr.eval(new HashMap<String, Complex>()));
        }

        @Test
        @DisplayName("i 解析为变量，求值为虚数单位")
        void testImaginaryUnit() {
            Expression<Complex> expr = ExpressionParser.parse("3 + 2 * i", ComplexDomain.INSTANCE);
            assertEquals("(3+(2*i))", expr.toString());
            Map<String, Complex> vars = new HashMap<>();
            Complex value = expr.eval(vars);
            assertEquals(3.0, value.getReal());
            assertEquals(2.0, value.getImaginary());
        }
    }
}
