package com.symdiff.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.util.concurrent.Callable;

/**
 * symdiff CLI 入口点（picocli）。不带子命令时进入 REPL。
 */
@Command(name = "symdiff", version = "symdiff " + Main.VERSION,
         mixinStandardHelpOptions = true,
         description = "符号表达式求值与求导",
         subcommands = {EvaluateCommand.class, DifferentiateCommand.class})
public class Main implements Callable<Integer> {

    static final String VERSION = "0.1.0";

    @Spec
    CommandSpec spec;

    @Mixin
    CommonOptions options;

    @Override
    public Integer call() {
        SessionConfig config = options.toConfig();
        LoggingSetup.install(config.isVerbose());
        new ReplRunner(config, spec.commandLine().getOut(), spec.commandLine().getErr()).run();
        return ExpressionRunner.EXIT_OK;
    }

    /**
     * 创建配置好的命令行实例（枚举值忽略大小写）
     */
    public static CommandLine createCommandLine() {
        return new CommandLine(new Main())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        // Windows 控制台可能仍用 GBK，按 native.encoding 输出
        String charsetName = getConsoleCharsetName();

        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);
            System.setOut(out);
            System.setErr(err);

            Charset consoleCharset = Charset.forName(charsetName);
            CommandLine cmd = createCommandLine();
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
            System.exit(cmd.execute(args));
        } catch (UnsupportedEncodingException e) {
            System.exit(createCommandLine().execute(args));
        }
    }

    /**
     * 控制台使用的字符编码名。native.encoding（Java 17+）反映操作系统原生编码。
     */
    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        try {
            if (nativeEnc != null && Charset.isSupported(nativeEnc)) {
                return nativeEnc;
            }
        } catch (IllegalCharsetNameException e) {
            System.err.println("忽略无效的 native.encoding: " + nativeEnc);
        }
        return Charset.defaultCharset().name();
    }
}
