package com.pocket.exception;

/** 远端拒绝本次操作（如非 fast-forward push），不重试。 */
public class RemoteRejectedException extends RemoteException {
    public RemoteRejectedException(String message) {
        super(message);
    }

    public RemoteRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
