package com.symdiff.core.parser;

import com.symdiff.core.domain.Complex;
import com.symdiff.core.domain.Domain;

/**
 * 复数字面量解析与数值域检测
 */
public final class ComplexLiteralParser {

    private static final char IMAGINARY_UNIT = 'i';

    private ComplexLiteralParser() {}

    /**
     * 判断表达式是否需要复数域。
     *
     * <p>存在一个不与其他字母相邻的 {@code i}，且左右两侧都是边界
     * （字符串首尾、空白、数字、{@code -}、{@code .}）时返回 {@link Domain#COMPLEX}。
     * 标识符中的 i（如 sin、pi）不算。</p>
     */
    public static Domain detectDomain(String text) {
        int length = text.length();
        for (int pos = text.indexOf(IMAGINARY_UNIT); pos >= 0; pos = text.indexOf(IMAGINARY_UNIT, pos + 1)) {
            boolean letterBefore = pos > 0 && Character.isLetter(text.charAt(pos - 1));
            boolean letterAfter = pos < length - 1 && Character.isLetter(text.charAt(pos + 1));
            if (letterBefore || letterAfter) {
                continue;
            }
            if (isBoundary(text, pos - 1) && isBoundary(text, pos + 1)) {
                return Domain.COMPLEX;
            }
        }
        return Domain.REAL;
    }

    /**
     * 解析 {@code <实部>±<虚部>i} 形式的复数。
     *
     * <p>在第一个 {@code i} 之前最后一个 {@code +}/{@code -} 处拆分；
     * 虚部为空或只有 {@code +} 时系数为 1，只有 {@code -} 时为 -1，缺少实部时实部为 0。
     * 不含 {@code i} 时按实数解析。空白会被忽略，允许外层带一对括号。</p>
     *
     * @throws ParseException 文本不是合法的复数
     */
    public static Complex parseComplexLiteral(String text) {
        String s = stripWhitespace(text);
        if (s.length() >= 2 && s.charAt(0) == '(' && s.charAt(s.length() - 1) == ')') {
            s = s.substring(1, s.length() - 1);
        }
        if (s.isEmpty()) {
            throw invalid(text, null);
        }

        int iPos = s.indexOf(IMAGINARY_UNIT);
        try {
            if (iPos < 0) {
                return Complex.ofReal(Double.parseDouble(s));
            }
            if (iPos != s.length() - 1) {
                throw invalid(text, null);
            }

            int signPos = lastSignBefore(s, iPos);
            String realPart = signPos < 0 ? "" : s.substring(0, signPos);
            String imagPart = signPos < 0 ? s.substring(0, iPos) : s.substring(signPos, iPos);

            double real = realPart.isEmpty() ? 0.0 : Double.parseDouble(realPart);
            double imag;
            if (imagPart.isEmpty() || imagPart.equals("+")) {
                imag = 1.0;
            } else if (imagPart.equals("-")) {
                imag = -1.0;
            } else {
                imag = Double.parseDouble(imagPart);
            }
            return new Complex(real, imag);
        } catch (NumberFormatException e) {
            throw invalid(text, e);
        }
    }

    // 科学计数法中的指数符号（1e-5）不作为拆分点
    private static int lastSignBefore(String s, int end) {
        for (int i = end - 1; i >= 0; i--) {
            char c = s.charAt(i);
            if (c != '+' && c != '-') {
                continue;
            }
            boolean exponentSign = i >= 2
                    && (s.charAt(i - 1) == 'e' || s.charAt(i - 1) == 'E')
                    && Character.isDigit(s.charAt(i - 2));
            if (!exponentSign) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isBoundary(String text, int index) {
        if (index < 0 || index >= text.length()) {
            return true;
        }
        char c = text.charAt(index);
        return Character.isWhitespace(c) || Character.isDigit(c) || c == '-' || c == '.';
    }

    private static String stripWhitespace(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isWhitespace(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static ParseException invalid(String text, NumberFormatException cause) {
        String message = "invalid complex literal: '" + text + "'";
        return cause != null ? new ParseException(message, cause) : new ParseException(message);
    }
}
