package com.pocket.exception;

public class ObjectNotFoundException extends ObjectException {
    public ObjectNotFoundException(String message) {
        super(message);
    }

    public ObjectNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
