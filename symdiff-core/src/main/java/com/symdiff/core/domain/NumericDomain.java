package com.symdiff.core.domain;

/**
 * 数值域能力集合。
 *
 * <p>表达式树、解析器、求值器和求导器都只依赖此接口，
 * 实数域和复数域各提供一个实现。</p>
 *
 * @param <T> 标量类型
 */
public interface NumericDomain<T> {

    Domain kind();

    T zero();

    T one();

    /** 由 double 构造标量（求导时的 -1、2 等常量） */
    T fromDouble(double value);

    /**
     * 解析数字字面量（仅由数字和至多一个小数点组成）
     *
     * @throws NumberFormatException 字面量无效时
     */
    T parseNumber(String literal);

    /**
     * 解析变量绑定的取值文本（命令行 name=value 中的 value）
     *
     * @throws com.symdiff.core.parser.ParseException 文本无效时
     */
    T parseValue(String text);

    T add(T a, T b);

    T subtract(T a, T b);

    T multiply(T a, T b);

    /** 不检查除数是否为零，由调用方负责 */
    T divide(T a, T b);

    /** 广义幂运算，底数和指数都可以是任意标量 */
    T power(T base, T exponent);

    T sin(T value);

    T cos(T value);

    T exp(T value);

    /** 自然对数，不检查定义域，由调用方负责 */
    T log(T value);

    /** 精确相等 */
    boolean equal(T a, T b);

    default boolean isZero(T value) {
        return equal(value, zero());
    }

    default boolean isOne(T value) {
        return equal(value, one());
    }

    /** 自然对数是否超出定义域（仅实数域对非正数返回 true） */
    boolean isOutsideLogDomain(T value);

    /**
     * 数值域内建的命名常量，不受变量绑定影响
     *
     * @return 常量值，不存在时返回 null
     */
    T resolveBuiltin(String name);

    String format(T value);
}
