package com.symdiff.cli;

import com.symdiff.core.SymDiffException;
import com.symdiff.core.domain.NumericDomain;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 解析命令行上的 {@code name=value} 变量绑定
 */
public final class BindingParser {

    private BindingParser() {}

    /**
     * 解析一组绑定，值按给定数值域解析
     *
     * @throws IllegalArgumentException 格式错误、变量名重复或值无法解析
     */
    public static <T> Map<String, T> parse(List<String> tokens, NumericDomain<T> domain) {
        Map<String, T> bindings = new LinkedHashMap<>();
        if (tokens == null) {
            return bindings;
        }
        for (String token : tokens) {
            String[] pair = split(token);
            if (bindings.containsKey(pair[0])) {
                throw new IllegalArgumentException("duplicate binding for '" + pair[0] + "'");
            }
            bindings.put(pair[0], parseValue(pair[0], pair[1], domain));
        }
        return bindings;
    }

    /**
     * 在第一个 {@code =} 处拆分
     *
     * @return {名称, 值文本}
     * @throws IllegalArgumentException 缺少 {@code =}、名称不合法或值为空
     */
    public static String[] split(String token) {
        int eq = token.indexOf('=');
        if (eq < 0) {
            throw new IllegalArgumentException("invalid binding '" + token + "': expected name=value");
        }
        String name = token.substring(0, eq).trim();
        String value = token.substring(eq + 1).trim();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("invalid binding '" + token + "': empty name");
        }
        if (!isValidName(name)) {
            throw new IllegalArgumentException("invalid binding '" + token + "': name must consist of letters");
        }
        if (value.isEmpty()) {
            throw new IllegalArgumentException("invalid binding '" + token + "': empty value");
        }
        return new String[]{name, value};
    }

    /** 与解析器的标识符规则一致：非空且全部是字母 */
    public static boolean isValidName(String name) {
        if (name == null || name.isEmpty()) return false;
        for (int i = 0; i < name.length(); i++) {
            if (!Character.isLetter(name.charAt(i))) return false;
        }
        return true;
    }

    private static <T> T parseValue(String name, String text, NumericDomain<T> domain) {
        try {
            return domain.parseValue(text);
        } catch (SymDiffException e) {
            throw new IllegalArgumentException("invalid value for '" + name + "': " + e.getMessage(), e);
        }
    }
}
