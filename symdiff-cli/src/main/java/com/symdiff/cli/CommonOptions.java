package com.symdiff.cli;

import picocli.CommandLine.Option;

/**
 * 各命令共用的选项（picocli mixin）。
 *
 * <p>顶层命令和子命令各有一份；子命令上未给出的选项沿用顶层命令的值，
 * 因此 {@code symdiff --json evaluate ...} 与 {@code symdiff evaluate --json ...} 等价。</p>
 */
public class CommonOptions {

    @Option(names = "--domain", paramLabel = "<domain>",
            description = "数值域: ${COMPLETION-CANDIDATES}（默认 auto，按输入检测）")
    DomainMode domain;

    @Option(names = "--json", description = "以 JSON 格式输出")
    boolean json;

    @Option(names = {"-v", "--verbose"}, description = "在 stderr 输出调试日志")
    boolean verbose;

    SessionConfig toConfig() {
        return toConfig(null);
    }

    /**
     * 合并顶层命令的选项，子命令上给出的 --domain 优先
     */
    SessionConfig toConfig(CommonOptions parent) {
        DomainMode mode = domain;
        boolean jsonOutput = json;
        boolean verboseLog = verbose;
        if (parent != null) {
            if (mode == null) mode = parent.domain;
            jsonOutput |= parent.json;
            verboseLog |= parent.verbose;
        }
        return new SessionConfig(mode != null ? mode : DomainMode.AUTO, jsonOutput, verboseLog);
    }
}
