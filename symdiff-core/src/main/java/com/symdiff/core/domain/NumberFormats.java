package com.symdiff.core.domain;

import java.math.BigDecimal;

/**
 * 标量的文本格式化
 */
public final class NumberFormats {

    private NumberFormats() {}

    /**
     * 普通十进制表示，去掉末尾的 0：5、2.5、-1、0.0000001。
     * 输出可以被表达式解析器重新读入（负数除外，解析器不支持一元负号）。
     */
    public static String formatReal(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /** 虚部为 0 时只输出实部，否则输出 (a+bi) / (a-bi) */
    public static String formatComplex(Complex value) {
        double im = value.getImaginary();
        if (im == 0) {
            return formatReal(value.getReal());
        }
        return "(" + formatReal(value.getReal())
                + (im < 0 ? "-" : "+")
                + formatReal(Math.abs(im)) + "i)";
    }
}
