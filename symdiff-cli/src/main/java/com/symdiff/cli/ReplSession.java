package com.symdiff.cli;

import com.symdiff.core.SymDiffException;
import com.symdiff.core.SymbolicEngine;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * REPL 会话状态：变量绑定和当前数值域模式。
 *
 * <p>绑定按原始文本保存，每次求值时再按当时选定的数值域解析，
 * 因此切换 {@code :domain} 后已有绑定仍然可用。</p>
 */
public class ReplSession {

    private final SessionConfig config;
    private final PrintWriter out;
    private final PrintWriter err;
    private final ExpressionRunner runner;
    private final Map<String, String> bindings = new LinkedHashMap<>();

    public ReplSession(SessionConfig config, PrintWriter out, PrintWriter err) {
        this.config = config;
        this.out = out;
        this.err = err;
        this.runner = new ExpressionRunner(config, out, err);
    }

    /**
     * 处理一行输入
     *
     * @return true 继续循环，false 退出
     */
    public boolean handleLine(String line) {
        String input = line.trim();
        if (input.isEmpty()) {
            return true;
        }
        if (input.startsWith(":")) {
            return handleCommand(input);
        }
        try {
            runner.evaluate(input, bindingTokens());
        } catch (IllegalArgumentException e) {
            printError(e.getMessage());
        }
        return true;
    }

    /** 当前绑定（只读视图） */
    public Map<String, String> getBindings() {
        return Collections.unmodifiableMap(bindings);
    }

    private boolean handleCommand(String input) {
        int space = input.indexOf(' ');
        String command = space < 0 ? input : input.substring(0, space);
        String argument = space < 0 ? "" : input.substring(space + 1).trim();

        switch (command) {
            case ":quit":
            case ":q":
            case ":exit":
                return false;

            case ":help":
            case ":h":
                printHelp();
                return true;

            case ":let":
                let(argument);
                return true;

            case ":vars":
                if (bindings.isEmpty()) {
                    out.println("（无变量）");
                }
                for (Map.Entry<String, String> entry : bindings.entrySet()) {
                    out.println(entry.getKey() + " = " + entry.getValue());
                }
                out.flush();
                return true;

            case ":clear":
                bindings.clear();
                out.println("变量已清空");
                out.flush();
                return true;

            case ":diff":
                diff(argument);
                return true;

            case ":domain":
                domain(argument);
                return true;

            default:
                out.println("未知命令: " + command);
                out.println("输入 :help 获取帮助");
                out.flush();
                return true;
        }
    }

    private void let(String argument) {
        try {
            String[] pair = BindingParser.split(argument);
            // 按值自身检测数值域校验，3+4i 之类的复数值也能接受
            SymbolicEngine.detectDomain(pair[1]).numeric().parseValue(pair[1]);
            bindings.put(pair[0], pair[1]);
            out.println(pair[0] + " = " + pair[1]);
            out.flush();
        } catch (IllegalArgumentException | SymDiffException e) {
            printError(e.getMessage());
        }
    }

    private void diff(String argument) {
        int space = argument.indexOf(' ');
        if (space < 0) {
            printError("usage: :diff <variable> <expression>");
            return;
        }
        String variable = argument.substring(0, space);
        String expression = argument.substring(space + 1).trim();
        if (!BindingParser.isValidName(variable)) {
            printError("invalid variable name '" + variable + "'");
            return;
        }
        try {
            runner.differentiate(expression, variable, bindingTokens());
        } catch (IllegalArgumentException e) {
            printError(e.getMessage());
        }
    }

    private void domain(String argument) {
        if (argument.isEmpty()) {
            out.println("当前数值域: " + config.getDomainMode().name().toLowerCase(Locale.ROOT));
            out.flush();
            return;
        }
        DomainMode mode = DomainMode.fromName(argument);
        if (mode == null) {
            printError("unknown domain '" + argument + "' (expected auto, real or complex)");
            return;
        }
        config.setDomainMode(mode);
        out.println("数值域已切换为 " + mode.name().toLowerCase(Locale.ROOT));
        out.flush();
    }

    private List<String> bindingTokens() {
        List<String> tokens = new ArrayList<>(bindings.size());
        for (Map.Entry<String, String> entry : bindings.entrySet()) {
            tokens.add(entry.getKey() + "=" + entry.getValue());
        }
        return tokens;
    }

    private void printError(String message) {
        err.println("错误: " + message);
        err.flush();
    }

    void printHelp() {
        out.println("REPL 命令:");
        out.println("  :let name=value     绑定变量（值可以是实数或复数，如 3+4i）");
        out.println("  :vars               列出已绑定的变量");
        out.println("  :clear              清空变量");
        out.println("  :diff <var> <expr>  对 var 求导");
        out.println("  :domain [mode]      查看或切换数值域（auto, real, complex）");
        out.println("  :help, :h           显示此帮助");
        out.println("  :quit, :q, :exit    退出 REPL");
        out.println();
        out.println("示例:");
        out.println("  x ^ 2 + sin(x)      在当前绑定下求值");
        out.println("  :diff x x ^ 3       求导，结果为 ((x^3)*(3*(1/x)))");
        out.flush();
    }
}
