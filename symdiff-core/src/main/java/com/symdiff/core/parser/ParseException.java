package com.symdiff.core.parser;

import com.symdiff.core.ErrorKind;
import com.symdiff.core.SymDiffException;

/**
 * 解析异常
 */
public class ParseException extends SymDiffException {
    private final int column;

    public ParseException(String message) {
        this(message, 0);
    }

    /**
     * @param column 出错位置（从 1 开始，0 表示未知）
     */
    public ParseException(String message, int column) {
        super(message);
        this.column = column;
    }

    public ParseException(String message, Throwable cause) {
        super(message, cause);
        this.column = 0;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.PARSE;
    }

    @Override
    public String getMessage() {
        if (column <= 0) {
            return super.getMessage();
        }
        return super.getMessage() + " at column " + column;
    }
}
