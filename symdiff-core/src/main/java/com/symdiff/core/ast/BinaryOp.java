package com.symdiff.core.ast;

/**
 * 二元运算符
 */
public enum BinaryOp {
    ADD('+', 2),
    SUBTRACT('-', 2),
    MULTIPLY('*', 3),
    DIVIDE('/', 3),
    POWER('^', 4);

    private final char symbol;
    private final int precedence;

    BinaryOp(char symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public char getSymbol() {
        return symbol;
    }

    /** 优先级：^ = 4，* / = 3，+ - = 2 */
    public int getPrecedence() {
        return precedence;
    }

    /**
     * 按符号查找运算符
     *
     * @return 对应的运算符，不是运算符时返回 null
     */
    public static BinaryOp fromSymbol(char c) {
        for (BinaryOp op : values()) {
            if (op.symbol == c) {
                return op;
            }
        }
        return null;
    }
}
