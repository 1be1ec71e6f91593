package com.pocket.exception;

/**
 * pocket 所有业务异常的基类。
 * 命令层只捕获此类型并输出 "fatal: message"，其余异常视为程序错误。
 */
public class PocketException extends Exception {
    public PocketException(String message) {
        super(message);
    }

    public PocketException(String message, Throwable cause) {
        super(message, cause);
    }
}
