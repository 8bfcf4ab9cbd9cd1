package com.symdiff.core;

/**
 * SymDiff 基础异常。
 *
 * <p>解析、求值、求导过程中的所有错误都继承此类，在发现处抛出并原样传播给调用方。</p>
 */
public abstract class SymDiffException extends RuntimeException {

    protected SymDiffException(String message) {
        super(message);
    }

    protected SymDiffException(String message, Throwable cause) {
        super(message, cause);
    }

    /** 对应的错误分类 */
    public abstract ErrorKind getKind();
}
