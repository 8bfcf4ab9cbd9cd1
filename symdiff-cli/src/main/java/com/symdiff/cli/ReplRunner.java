package com.symdiff.cli;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * jline REPL 交互模式
 */
public class ReplRunner {

    private static final Logger LOG = Logger.getLogger(ReplRunner.class.getName());

    private static final String PROMPT = "symdiff> ";

    private final PrintWriter out;
    private final PrintWriter err;
    private final ReplSession session;

    public ReplRunner(SessionConfig config, PrintWriter out, PrintWriter err) {
        this.out = out;
        this.err = err;
        this.session = new ReplSession(config, out, err);
    }

    /**
     * 启动 REPL 交互模式
     */
    public void run() {
        out.println("symdiff " + Main.VERSION + " - 符号求导与求值");
        out.println("输入 :help 获取帮助，:quit 退出");
        out.println();
        out.flush();

        try {
            Terminal terminal = TerminalBuilder.builder().system(true).build();
            LineReader reader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .build();

            runLoop(reader);
        } catch (IOException e) {
            LOG.log(Level.FINE, "Terminal initialization failed", e);
            err.println("终端初始化失败: " + e.getMessage());
            err.flush();
            // 回退到简单模式
            runFallbackLoop(System.in);
        }

        out.println("再见！");
        out.flush();
    }

    /**
     * jline 主循环
     */
    private void runLoop(LineReader reader) {
        while (true) {
            try {
                String line = reader.readLine(PROMPT);
                if (line == null) break;
                if (!session.handleLine(line)) break;
            } catch (UserInterruptException e) {
                // Ctrl+C: 放弃当前输入
                LOG.fine("Input interrupted");
            } catch (EndOfFileException e) {
                // Ctrl+D: 退出
                break;
            }
        }
    }

    /**
     * 回退循环（jline 初始化失败时使用 BufferedReader）
     */
    void runFallbackLoop(InputStream in) {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        while (true) {
            try {
                out.print(PROMPT);
                out.flush();

                String line = reader.readLine();
                if (line == null) break;
                if (!session.handleLine(line)) break;
            } catch (IOException e) {
                err.println("读取输入时出错: " + e.getMessage());
                err.flush();
                break;
            }
        }
    }
}
