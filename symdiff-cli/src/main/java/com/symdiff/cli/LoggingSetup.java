package com.symdiff.cli;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

/**
 * 日志只输出到 stderr，stdout 留给计算结果
 */
final class LoggingSetup {

    private LoggingSetup() {}

    static void install(boolean verbose) {
        Level level = verbose ? Level.FINE : Level.WARNING;

        Logger rootLogger = Logger.getLogger("");
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }
        Handler stderrHandler = new StreamHandler(System.err, new SimpleFormatter()) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        stderrHandler.setLevel(level);
        rootLogger.addHandler(stderrHandler);
        rootLogger.setLevel(level);
    }
}
