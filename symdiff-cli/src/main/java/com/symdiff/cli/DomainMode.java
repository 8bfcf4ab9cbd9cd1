package com.symdiff.cli;

import com.symdiff.core.domain.Domain;

import java.util.Locale;

/**
 * 命令行选择的数值域。AUTO 表示按输入内容检测。
 */
public enum DomainMode {
    AUTO,
    REAL,
    COMPLEX;

    /**
     * 固定模式对应的数值域
     *
     * @return AUTO 时返回 null
     */
    public Domain fixedDomain() {
        switch (this) {
            case REAL:    return Domain.REAL;
            case COMPLEX: return Domain.COMPLEX;
            default:      return null;
        }
    }

    /**
     * 按名称查找（忽略大小写）
     *
     * @return 未知名称返回 null
     */
    public static DomainMode fromName(String name) {
        if (name == null) return null;
        String upper = name.trim().toUpperCase(Locale.ROOT);
        for (DomainMode mode : values()) {
            if (mode.name().equals(upper)) {
                return mode;
            }
        }
        return null;
    }
}
