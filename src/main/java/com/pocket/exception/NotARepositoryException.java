package com.pocket.exception;

public class NotARepositoryException extends RepositoryException {
    public NotARepositoryException(String message) {
        super(message);
    }

    public NotARepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
