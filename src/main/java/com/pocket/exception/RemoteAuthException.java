package com.pocket.exception;

/** 认证失败，不重试。 */
public class RemoteAuthException extends RemoteException {
    public RemoteAuthException(String message) {
        super(message);
    }

    public RemoteAuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
