package com.pocket.exception;

public class TimelineExistsException extends PocketException {
    public TimelineExistsException(String message) {
        super(message);
    }

    public TimelineExistsException(String message, Throwable cause) {
        super(message, cause);
    }
}
