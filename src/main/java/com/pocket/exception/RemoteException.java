package com.pocket.exception;

/**
 * 远端操作错误的基类。只有 {@link RemoteNetworkException} 会被重试。
 */
public class RemoteException extends PocketException {
    public RemoteException(String message) {
        super(message);
    }

    public RemoteException(String message, Throwable cause) {
        super(message, cause);
    }
}
