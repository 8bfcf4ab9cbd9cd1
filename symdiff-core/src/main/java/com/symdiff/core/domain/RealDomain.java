package com.symdiff.core.domain;

import com.symdiff.core.parser.ParseException;

/**
 * 实数域（double）
 */
public final class RealDomain implements NumericDomain<Double> {

    public static final RealDomain INSTANCE = new RealDomain();

    private static final Double ZERO = 0.0;
    private static final Double ONE = 1.0;

    private RealDomain() {}

    @Override
    public Domain kind() {
        return Domain.REAL;
    }

    @Override
    public Double zero() {
        return ZERO;
    }

    @Override
    public Double one() {
        return ONE;
    }

    @Override
    public Double fromDouble(double value) {
        return value;
    }

    @Override
    public Double parseNumber(String literal) {
        return Double.parseDouble(literal);
    }

    @Override
    public Double parseValue(String text) {
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            throw new ParseException("invalid real value: '" + text + "'", e);
        }
    }

    @Override
    public Double add(Double a, Double b) {
        return a + b;
    }

    @Override
    public Double subtract(Double a, Double b) {
        return a - b;
    }

    @Override
    public Double multiply(Double a, Double b) {
        return a * b;
    }

    @Override
    public Double divide(Double a, Double b) {
        return a / b;
    }

    @Override
    public Double power(Double base, Double exponent) {
        return Math.pow(base, exponent);
    }

    @Override
    public Double sin(Double value) {
        return Math.sin(value);
    }

    @Override
    public Double cos(Double value) {
        return Math.cos(value);
    }

    @Override
    public Double exp(Double value) {
        return Math.exp(value);
    }

    @Override
    public Double log(Double value) {
        return Math.log(value);
    }

    @Override
    public boolean equal(Double a, Double b) {
        // 基本类型比较：0.0 == -0.0
        return a.doubleValue() == b.doubleValue();
    }

    @Override
    public boolean isOutsideLogDomain(Double value) {
        return value <= 0;
    }

    @Override
    public Double resolveBuiltin(String name) {
        return null;
    }

    @Override
    public String format(Double value) {
        return NumberFormats.formatReal(value);
    }

    @Override
    public String toString() {
        return "real";
    }
}
