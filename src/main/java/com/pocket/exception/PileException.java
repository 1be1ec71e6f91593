package com.pocket.exception;

public class PileException extends PocketException {
    public PileException(String message) {
        super(message);
    }

    public PileException(String message, Throwable cause) {
        super(message, cause);
    }
}
