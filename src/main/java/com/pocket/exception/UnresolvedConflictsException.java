package com.pocket.exception;

public class UnresolvedConflictsException extends MergeException {
    public UnresolvedConflictsException(String message) {
        super(message);
    }

    public UnresolvedConflictsException(String message, Throwable cause) {
        super(message, cause);
    }
}
