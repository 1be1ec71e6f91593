package com.pocket.exception;

public class RemoteNotFoundException extends RemoteException {
    public RemoteNotFoundException(String message) {
        super(message);
    }

    public RemoteNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
