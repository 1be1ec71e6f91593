package com.pocket.exception;

/** 传输层的暂时性故障，可按退避策略重试。 */
public class RemoteNetworkException extends RemoteException {
    public RemoteNetworkException(String message) {
        super(message);
    }

    public RemoteNetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
