package com.symdiff.core.domain;

/**
 * 不可变复数
 */
public final class Complex {

    public static final Complex ZERO = new Complex(0, 0);
    public static final Complex ONE = new Complex(1, 0);
    public static final Complex I = new Complex(0, 1);

    // 超过此范围的整数指数走 exp(w * log z)
    private static final int MAX_EXACT_EXPONENT = 1 << 16;

    private final double real;
    private final double imaginary;

    public Complex(double real, double imaginary) {
        this.real = real;
        this.imaginary = imaginary;
    }

    public static Complex ofReal(double real) {
        return new Complex(real, 0);
    }

    public double getReal() {
        return real;
    }

    public double getImaginary() {
        return imaginary;
    }

    public boolean isZero() {
        return real == 0 && imaginary == 0;
    }

    public Complex add(Complex other) {
        return new Complex(real + other.real, imaginary + other.imaginary);
    }

    public Complex subtract(Complex other) {
        return new Complex(real - other.real, imaginary - other.imaginary);
    }

    public Complex multiply(Complex other) {
        double r = real * other.real - imaginary * other.imaginary;
        double i = real * other.imaginary + imaginary * other.real;
        return new Complex(r, i);
    }

    public Complex divide(Complex other) {
        double c = other.real, d = other.imaginary;
        double t = c * c + d * d;
        double r = real * c + imaginary * d;
        double i = imaginary * c - real * d;
        return new Complex(r / t, i / t);
    }

    public Complex negate() {
        return new Complex(-real, -imaginary);
    }

    /** 模 */
    public double abs() {
        return Math.hypot(real, imaginary);
    }

    /** 辐角，取值 (-pi, pi] */
    public double arg() {
        return Math.atan2(imaginary, real);
    }

    public Complex exp() {
        double m = Math.exp(real);
        return new Complex(m * Math.cos(imaginary), m * Math.sin(imaginary));
    }

    /** 主值分支的自然对数 */
    public Complex log() {
        return new Complex(Math.log(abs()), arg());
    }

    public Complex sin() {
        return new Complex(Math.sin(real) * Math.cosh(imaginary), Math.cos(real) * Math.sinh(imaginary));
    }

    public Complex cos() {
        return new Complex(Math.cos(real) * Math.cosh(imaginary), -Math.sin(real) * Math.sinh(imaginary));
    }

    /**
     * 整数次幂（反复平方）
     */
    public Complex pow(int n) {
        if (n == 0) {
            return ONE;
        }
        Complex base = n < 0 ? ONE.divide(this) : this;
        long e = Math.abs((long) n);
        Complex result = ONE;
        while (e > 0) {
            if ((e & 1) == 1) {
                result = result.multiply(base);
            }
            e >>= 1;
            if (e > 0) {
                base = base.multiply(base);
            }
        }
        return result;
    }

    /**
     * 广义幂 z^w = exp(w * log z)。
     * 实整数指数走精确的反复平方；0^w 在 Re(w) > 0 时为 0。
     */
    public Complex pow(Complex exponent) {
        if (exponent.imaginary == 0
                && exponent.real == Math.rint(exponent.real)
                && Math.abs(exponent.real) <= MAX_EXACT_EXPONENT) {
            return pow((int) exponent.real);
        }
        if (isZero()) {
            return exponent.real > 0 ? ZERO : new Complex(Double.NaN, Double.NaN);
        }
        return exponent.multiply(log()).exp();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Complex)) return false;
        Complex other = (Complex) obj;
        return Double.compare(real, other.real) == 0 && Double.compare(imaginary, other.imaginary) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(real) * 31 + Double.hashCode(imaginary);
    }

    @Override
    public String toString() {
        return NumberFormats.formatComplex(this);
    }
}
