package com.symdiff.core.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("NumberFormats 测试")
class NumberFormatsTest {

    @Test
    @DisplayName("整数值不带小数部分")
    void testIntegral() {
        assertThat(NumberFormats.formatReal(5.0)).isEqualTo("5");
        assertThat(NumberFormats.formatReal(-1.0)).isEqualTo("-1");
        assertThat(NumberFormats.formatReal(100.0)).isEqualTo("100");
        assertThat(NumberFormats.formatReal(0.0)).isEqualTo("0");
        assertThat(NumberFormats.formatReal(-0.0)).isEqualTo("0");
    }

    @Test
    @DisplayName("小数去掉末尾的 0，不用科学计数法")
    void testFraction() {
        assertThat(NumberFormats.formatReal(2.5)).isEqualTo("2.5");
        assertThat(NumberFormats.formatReal(0.0000001)).isEqualTo("0.0000001");
        assertThat(NumberFormats.formatReal(1e20)).isEqualTo("100000000000000000000");
    }

    @Test
    @DisplayName("非有限值")
    void testNonFinite() {
        assertThat(NumberFormats.formatReal(Double.NaN)).isEqualTo("NaN");
        assertThat(NumberFormats.formatReal(Double.POSITIVE_INFINITY)).isEqualTo("Infinity");
    }

    @Test
    @DisplayName("虚部为 0 的复数只输出实部")
    void testComplex() {
        assertThat(NumberFormats.formatComplex(new Complex(2, 0))).isEqualTo("2");
        assertThat(NumberFormats.formatComplex(new Complex(0, 1))).isEqualTo("(0+1i)");
        assertThat(NumberFormats.formatComplex(new Complex(-1.5, -2))).isEqualTo("(-1.5-2i)");
    }
}
