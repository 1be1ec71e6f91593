package com.pocket.remote;

import com.pocket.exception.RemoteException;

/** 按远端配置打开连接。 */
@FunctionalInterface
public interface TransportFactory {
    RemoteTransport open(Remote remote) throws RemoteException;
}
