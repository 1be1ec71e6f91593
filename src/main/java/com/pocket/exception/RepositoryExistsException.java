package com.pocket.exception;

public class RepositoryExistsException extends RepositoryException {
    public RepositoryExistsException(String message) {
        super(message);
    }

    public RepositoryExistsException(String message, Throwable cause) {
        super(message, cause);
    }
}
