package com.symdiff.core;

import java.util.Objects;

/**
 * 不抛异常的计算结果：要么携带值，要么携带错误分类和消息。
 *
 * @param <V> 成功时的值类型
 */
public final class Outcome<V> {
    private final V value;
    private final ErrorKind errorKind;
    private final String message;

    private Outcome(V value, ErrorKind errorKind, String message) {
        this.value = value;
        this.errorKind = errorKind;
        this.message = message;
    }

    public static <V> Outcome<V> success(V value) {
        return new Outcome<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <V> Outcome<V> failure(ErrorKind kind, String message) {
        return new Outcome<>(null, Objects.requireNonNull(kind, "kind"), message);
    }

    static <V> Outcome<V> failure(SymDiffException e) {
        return failure(e.getKind(), e.getMessage());
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    /**
     * 获取成功值
     *
     * @throws IllegalStateException 结果为失败时
     */
    public V getValue() {
        if (!isSuccess()) {
            throw new IllegalStateException("Outcome is a failure: " + errorKind + ": " + message);
        }
        return value;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return isSuccess() ? "Success(" + value + ")" : "Failure(" + errorKind + ": " + message + ")";
    }
}
