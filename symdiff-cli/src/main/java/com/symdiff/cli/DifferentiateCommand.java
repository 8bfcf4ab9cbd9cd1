package com.symdiff.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * picocli differentiate 子命令：对单个变量求导，给出绑定时同时求导数值
 */
@Command(name = "differentiate", aliases = "diff", description = "对单个变量符号求导")
public class DifferentiateCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @ParentCommand
    Main parent;

    @Mixin
    CommonOptions options;

    @Option(names = "--by", required = true, paramLabel = "<var>", description = "求导变量")
    String variable;

    @Parameters(index = "0", paramLabel = "<expression>", description = "表达式，如 \"sin(x) * x\"")
    String expression;

    @Parameters(index = "1..*", paramLabel = "name=value", description = "变量绑定（可选，用于求导数值）")
    List<String> bindings;

    @Override
    public Integer call() {
        SessionConfig config = options.toConfig(parent != null ? parent.options : null);
        LoggingSetup.install(config.isVerbose());

        if (!BindingParser.isValidName(variable)) {
            throw new ParameterException(spec.commandLine(), "invalid variable name '" + variable + "'");
        }

        ExpressionRunner runner = new ExpressionRunner(config,
                spec.commandLine().getOut(), spec.commandLine().getErr());
        try {
            return runner.differentiate(expression, variable, bindings);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }
}
