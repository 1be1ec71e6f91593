package com.pocket.exception;

/** 另一个进程持有 .pocket/lock。 */
public class RepositoryLockedException extends RepositoryException {
    public RepositoryLockedException(String message) {
        super(message);
    }

    public RepositoryLockedException(String message, Throwable cause) {
        super(message, cause);
    }
}
