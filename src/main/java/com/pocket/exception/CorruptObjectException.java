package com.pocket.exception;

public class CorruptObjectException extends ObjectException {
    public CorruptObjectException(String message) {
        super(message);
    }

    public CorruptObjectException(String message, Throwable cause) {
        super(message, cause);
    }
}
