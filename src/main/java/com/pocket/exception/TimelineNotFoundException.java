package com.pocket.exception;

public class TimelineNotFoundException extends PocketException {
    public TimelineNotFoundException(String message) {
        super(message);
    }

    public TimelineNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
