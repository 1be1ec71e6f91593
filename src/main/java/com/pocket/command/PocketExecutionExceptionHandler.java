package com.pocket.command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.IExecutionExceptionHandler;
import picocli.CommandLine.ParseResult;

/**
 * 命令中未被捕获的异常：记录日志，打印 fatal 并返回退出码 1。
 */
public class PocketExecutionExceptionHandler implements IExecutionExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(PocketExecutionExceptionHandler.class);

    @Override
    public int handleExecutionException(Exception ex, CommandLine commandLine, ParseResult parseResult) {
        log.error("{} failed unexpectedly", commandLine.getCommandName(), ex);
        String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
        commandLine.getErr().println("fatal: " + message);
        return 1;
    }
}
