package com.pocket.remote;

import com.pocket.exception.RemoteException;
import com.pocket.obj.ObjectId;
import com.pocket.obj.Shove;
import com.pocket.obj.ShoveId;
import com.pocket.repo.Timeline;

import java.util.List;
import java.util.Optional;

/**
 * 与一个远端仓库的连接。实现需要保证：对象与 shove 的写入幂等，
 * head 的更新是 compare-and-set，且作为一次 push 的最后一步。
 * 可重试的瞬时错误抛 {@link com.pocket.exception.RemoteNetworkException}。
 */
public interface RemoteTransport extends AutoCloseable {

    /** 远端全部 timeline。 */
    List<Timeline> listTimelines() throws RemoteException;

    /** 远端 timeline 的 head；timeline 不存在或为空时返回空。 */
    Optional<ShoveId> getHead(String timeline) throws RemoteException;

    boolean hasObject(ObjectId id) throws RemoteException;

    byte[] getObject(ObjectId id) throws RemoteException;

    /** 写入对象，返回远端计算出的 id。 */
    ObjectId putObject(byte[] content) throws RemoteException;

    boolean hasShove(ShoveId id) throws RemoteException;

    Shove getShove(ShoveId id) throws RemoteException;

    void putShove(Shove shove) throws RemoteException;

    /**
     * 当远端 head 等于 expected（null 表示 timeline 不存在或为空）时更新为 newHead，否则不修改并返回 false。
     */
    boolean compareAndSetHead(String timeline, ShoveId expected, ShoveId newHead) throws RemoteException;

    @Override
    void close();
}
