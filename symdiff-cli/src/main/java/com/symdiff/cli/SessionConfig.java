package com.symdiff.cli;

/**
 * 一次命令行调用或一个 REPL 会话的配置
 */
public class SessionConfig {

    private DomainMode domainMode = DomainMode.AUTO;
    private boolean json = false;
    private boolean verbose = false;

    public SessionConfig() {}

    public SessionConfig(DomainMode domainMode, boolean json, boolean verbose) {
        this.domainMode = domainMode;
        this.json = json;
        this.verbose = verbose;
    }

    public DomainMode getDomainMode() { return domainMode; }
    public void setDomainMode(DomainMode domainMode) { this.domainMode = domainMode; }

    /** 输出 JSON 文档而不是纯文本 */
    public boolean isJson() { return json; }
    public void setJson(boolean json) { this.json = json; }

    public boolean isVerbose() { return verbose; }
    public void setVerbose(boolean verbose) { this.verbose = verbose; }
}
