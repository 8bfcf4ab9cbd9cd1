package com.symdiff.core;

/**
 * 错误分类
 */
public enum ErrorKind {
    /** 非法字符、括号不匹配、记号序列错误 */
    PARSE,
    /** 变量未绑定、除以零、对数定义域错误 */
    EVALUATION,
    /** 节点携带了封闭集合之外的运算符（程序错误，而非用户输入） */
    UNSUPPORTED
}
