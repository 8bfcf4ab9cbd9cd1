package com.symdiff.core.domain;

import com.symdiff.core.parser.ComplexLiteralParser;

/**
 * 复数域。变量名 {@code i} 始终求值为虚数单位。
 */
public final class ComplexDomain implements NumericDomain<Complex> {

    public static final ComplexDomain INSTANCE = new ComplexDomain();

    /** 虚数单位的变量名 */
    public static final String IMAGINARY_UNIT = "i";

    private ComplexDomain() {}

    @Override
    public Domain kind() {
        return Domain.COMPLEX;
    }

    @Override
    public Complex zero() {
        return Complex.ZERO;
    }

    @Override
    public Complex one() {
        return Complex.ONE;
    }

    @Override
    public Complex fromDouble(double value) {
        return Complex.ofReal(value);
    }

    @Override
    public Complex parseNumber(String literal) {
        return Complex.ofReal(Double.parseDouble(literal));
    }

    @Override
    public Complex parseValue(String text) {
        return ComplexLiteralParser.parseComplexLiteral(text);
    }

    @Override
    public Complex add(Complex a, Complex b) {
        return a.add(b);
    }

    @Override
    public Complex subtract(Complex a, Complex b) {
        return a.subtract(b);
    }

    @Override
    public Complex multiply(Complex a, Complex b) {
        return a.multiply(b);
    }

    @Override
    public Complex divide(Complex a, Complex b) {
        return a.divide(b);
    }

    @Override
    public Complex power(Complex base, Complex exponent) {
        return base.pow(exponent);
    }

    @Override
    public Complex sin(Complex value) {
        return value.sin();
    }

    @Override
    public Complex cos(Complex value) {
        return value.cos();
    }

    @Override
    public Complex exp(Complex value) {
        return value.exp();
    }

    @Override
    public Complex log(Complex value) {
        return value.log();
    }

    @Override
    public boolean equal(Complex a, Complex b) {
        return a.getReal() == b.getReal() && a.getImaginary() == b.getImaginary();
    }

    @Override
    public boolean isOutsideLogDomain(Complex value) {
        return false;
    }

    @Override
    public Complex resolveBuiltin(String name) {
        return IMAGINARY_UNIT.equals(name) ? Complex.I : null;
    }

    @Override
    public String format(Complex value) {
        return NumberFormats.formatComplex(value);
    }

    @Override
    public String toString() {
        return "complex";
    }
}
