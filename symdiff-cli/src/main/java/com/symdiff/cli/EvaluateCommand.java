package com.symdiff.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * picocli evaluate 子命令：在给定绑定下求值
 */
@Command(name = "evaluate", aliases = "eval", description = "解析表达式并求值")
public class EvaluateCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @ParentCommand
    Main parent;

    @Mixin
    CommonOptions options;

    @Parameters(index = "0", paramLabel = "<expression>", description = "表达式，如 \"x ^ 2 + 1\"")
    String expression;

    @Parameters(index = "1..*", paramLabel = "name=value", description = "变量绑定")
    List<String> bindings;

    @Override
    public Integer call() {
        SessionConfig config = options.toConfig(parent != null ? parent.options : null);
        LoggingSetup.install(config.isVerbose());

        ExpressionRunner runner = new ExpressionRunner(config,
                spec.commandLine().getOut(), spec.commandLine().getErr());
        try {
            return runner.evaluate(expression, bindings);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }
}
