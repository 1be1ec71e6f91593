package com.pocket.exception;

/** 工作区或 pile 中有未提交的修改，拒绝会覆盖它们的操作。 */
public class UncommittedChangesException extends RepositoryException {
    public UncommittedChangesException(String message) {
        super(message);
    }

    public UncommittedChangesException(String message, Throwable cause) {
        super(message, cause);
    }
}
