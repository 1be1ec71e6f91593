package com.pocket.exception;

public class EmptyPileException extends RepositoryException {
    public EmptyPileException(String message) {
        super(message);
    }

    public EmptyPileException(String message, Throwable cause) {
        super(message, cause);
    }
}
