package com.pocket.exception;

public class RemoteExistsException extends RemoteException {
    public RemoteExistsException(String message) {
        super(message);
    }

    public RemoteExistsException(String message, Throwable cause) {
        super(message, cause);
    }
}
