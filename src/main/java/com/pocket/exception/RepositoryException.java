package com.pocket.exception;

/** 仓库状态类错误：已存在、不是仓库、配置损坏等，对当前命令是终止性的。 */
public class RepositoryException extends PocketException {
    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
