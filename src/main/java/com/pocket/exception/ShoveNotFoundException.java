package com.pocket.exception;

public class ShoveNotFoundException extends PocketException {
    public ShoveNotFoundException(String message) {
        super(message);
    }

    public ShoveNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
