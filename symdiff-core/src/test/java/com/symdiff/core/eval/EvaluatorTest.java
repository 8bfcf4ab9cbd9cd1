package com.symdiff.core.eval;

import com.symdiff.core.Expression;
import com.symdiff.core.ast.BinaryOp;
import com.symdiff.core.ast.BinaryOpNode;
import com.symdiff.core.ast.ConstantNode;
import com.symdiff.core.ast.VariableNode;
import com.symdiff.core.domain.Complex;
import com.symdiff.core.domain.ComplexDomain;
import com.symdiff.core.domain.RealDomain;
import com.symdiff.core.parser.ExpressionParser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Evaluator 测试")
class EvaluatorTest {

    private static Map<String, Double> vars(Object... pairs) {
        Map<String, Double> map = new HashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], ((Number) pairs[i + 1]).doubleValue());
        }
        return map;
    }

    private static double eval(String source, Map<String, Double> bindings) {
        return ExpressionParser.parse(source, RealDomain.INSTANCE).eval(bindings);
    }

    private static Complex evalComplex(String source, Map<String, Complex> bindings) {
        return ExpressionParser.parse(source, ComplexDomain.INSTANCE).eval(bindings);
    }

    @Nested
    @DisplayName("实数域")
    class RealTests {

        @Test
        @DisplayName("常量加法")
        void testAddConstants() {
            assertThat(eval("5 + 7", vars())).isEqualTo(12.0);
        }

        @Test
        @DisplayName("变量查找")
        void testVariable() {
            assertThat(eval("y + 4", vars("y", 6))).isEqualTo(10.0);
        }

        @Test
        @DisplayName("乘除混合")
        void testMulDiv() {
            assertThat(eval("3 * y / 6", vars("y", 12))).isEqualTo(6.0);
        }

        @Test
        @DisplayName("乘方")
        void testPower() {
            assertThat(eval("y ^ 3", vars("y", 4))).isEqualTo(64.0);
            assertThat(eval("2 ^ 0.5", vars())).isCloseTo(Math.sqrt(2), within(1e-12));
            assertThat(eval("0 ^ 0", vars())).isEqualTo(1.0);
        }

        @Test
        @DisplayName("三角函数")
        void testTrig() {
            assertThat(eval("sin(y)", vars("y", Math.PI / 2))).isCloseTo(1.0, within(1e-9));
            assertThat(eval("cos(y)", vars("y", Math.PI))).isCloseTo(-1.0, within(1e-9));
        }

        @Test
        @DisplayName("指数与对数")
        void testExpLn() {
            assertThat(eval("exp(1)", vars())).isCloseTo(Math.E, within(1e-12));
            assertThat(eval("ln(exp(x))", vars("x", 2.5))).isCloseTo(2.5, within(1e-12));
        }

        @Test
        @DisplayName("实数域中 i 只是普通变量")
        void testIIsOrdinaryVariable() {
            assertThat(eval("i + 1", vars("i", 5))).isEqualTo(6.0);
        }
    }

    @Nested
    @DisplayName("错误")
    class ErrorTests {

        @Test
        @DisplayName("除以零")
        void testDivisionByZero() {
            assertThatThrownBy(() -> eval("1 / 0", vars()))
                    .isInstanceOf(EvaluationException.class)
                    .hasMessage("division by zero");
            assertThatThrownBy(() -> eval("x / (y - y)", vars("x", 1, "y", 3)))
                    .isInstanceOf(EvaluationException.class)
                    .hasMessage("division by zero");
        }

        @Test
        @DisplayName("变量未绑定")
        void testMissingVariable() {
            assertThatThrownBy(() -> eval("x + 1", vars()))
                    .isInstanceOf(EvaluationException.class)
                    .hasMessage("variable not found: x");
        }

        @Test
        @DisplayName("实数对数定义域")
        void testLogDomain() {
            assertThatThrownBy(() -> eval("ln(0)", vars()))
                    .isInstanceOf(EvaluationException.class)
                    .hasMessage("logarithm domain error");
            assertThatThrownBy(() -> eval("ln(x)", vars("x", -1)))
                    .isInstanceOf(EvaluationException.class)
                    .hasMessage("logarithm domain error");
        }

        @Test
        @DisplayName("复数除以零")
        void testComplexDivisionByZero() {
            assertThatThrownBy(() -> evalComplex("1 / (i - i)", new HashMap<String, Complex>()))
                    .isInstanceOf(EvaluationException.class)
                    .hasMessage("division by zero");
        }
    }

    @Nested
    @DisplayName("复数域")
    class ComplexTests {

        @Test
        @DisplayName("i 总是虚数单位，不受绑定影响")
        void testImaginaryUnit() {
            Map<String, Complex> bindings = new HashMap<>();
            bindings.put("i", Complex.ofReal(5));
            assertThat(evalComplex("i", bindings)).isEqualTo(Complex.I);
        }

        @Test
        @DisplayName("i * i = -1")
        void testISquared() {
            Complex value = evalComplex("i * i", new HashMap<String, Complex>());
            assertThat(value.getReal()).isEqualTo(-1.0);
            assertThat(value.getImaginary()).isCloseTo(0.0, within(1e-15));
        }

        @Test
        @DisplayName("欧拉公式")
        void testEuler() {
            Map<String, Complex> bindings = new HashMap<>();
            bindings.put("pi", Complex.ofReal(Math.PI));
            Complex value = evalComplex("exp(i * pi)", bindings);
            assertThat(value.getReal()).isCloseTo(-1.0, within(1e-12));
            assertThat(value.getImaginary()).isCloseTo(0.0, within(1e-12));
        }

        @Test
        @DisplayName("复数域中负数可以取对数")
        void testLogOfNegative() {
            Map<String, Complex> bindings = new HashMap<>();
            bindings.put("z", Complex.ofReal(-1));
            Complex value = evalComplex("ln(z)", bindings);
            assertThat(value.getReal()).isCloseTo(0.0, within(1e-12));
            assertThat(value.getImaginary()).isCloseTo(Math.PI, within(1e-12));
        }

        @Test
        @DisplayName("复数绑定参与运算")
        void testComplexBindings() {
            Map<String, Complex> bindings = new HashMap<>();
            bindings.put("z", new Complex(1, 2));
            bindings.put("w", new Complex(3, 4));
            assertThat(evalComplex("z * w", bindings)).isEqualTo(new Complex(-5, 10));
        }
    }

    @Test
    @DisplayName("直接对手工构造的树求值")
    void testHandBuiltTree() {
        BinaryOpNode<Double> node = new BinaryOpNode<>(BinaryOp.MULTIPLY,
                new ConstantNode<>(RealDomain.INSTANCE, 2.0),
                new VariableNode<Double>("x"));
        Evaluator<Double> evaluator = new Evaluator<>(RealDomain.INSTANCE, vars("x", 21));
        assertThat(evaluator.evaluate(node)).isEqualTo(42.0);
        assertThatThrownBy(() -> new Expression<>(RealDomain.INSTANCE, node).eval(null))
                .isInstanceOf(EvaluationException.class)
                .hasMessage("variable not found: x");
    }
}
