package com.pocket.repo;

import com.pocket.exception.RepositoryLockedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * 对 .pocket/lock 加排他锁，修改仓库的命令在整个执行期间持有。
 * 锁文件本身保留在磁盘上，锁随 close 或进程退出释放。
 */
public final class RepositoryLock implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RepositoryLock.class);

    static final String LOCK_FILE = "lock";

    private final FileChannel channel;
    private final FileLock lock;

    private RepositoryLock(FileChannel channel, FileLock lock) {
        this.channel = channel;
        this.lock = lock;
    }

    /**
     * 获取锁；已被其它进程（或本进程其它调用）持有时抛 RepositoryLockedException。
     */
    public static RepositoryLock acquire(Path pocketDir) throws RepositoryLockedException, IOException {
        Path lockFile = pocketDir.resolve(LOCK_FILE);
        FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        FileLock lock;
        try {
            lock = channel.tryLock();
        } catch (OverlappingFileLockException e) {
            channel.close();
            throw new RepositoryLockedException("repository is locked by another operation: " + lockFile, e);
        } catch (IOException e) {
            channel.close();
            throw e;
        }
        if (lock == null) {
            channel.close();
            throw new RepositoryLockedException("repository is locked by another process: " + lockFile);
        }
        log.debug("acquired lock {}", lockFile);
        return new RepositoryLock(channel, lock);
    }

    @Override
    public void close() throws IOException {
        try {
            if (lock.isValid()) {
                lock.release();
            }
        } finally {
            channel.close();
        }
        log.debug("released repository lock");
    }
}
