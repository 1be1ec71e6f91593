package com.pocket.remote;

import com.pocket.exception.ObjectException;
import com.pocket.exception.PocketException;
import com.pocket.exception.RemoteException;
import com.pocket.exception.RemoteNetworkException;
import com.pocket.exception.RepositoryLockedException;
import com.pocket.obj.ObjectId;
import com.pocket.obj.Shove;
import com.pocket.obj.ShoveId;
import com.pocket.repo.ObjectStore;
import com.pocket.repo.Refs;
import com.pocket.repo.Repository;
import com.pocket.repo.RepositoryLock;
import com.pocket.repo.Timeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 本地文件系统上的另一个 pocket 仓库。I/O 错误与远端被锁视为可重试的网络错误。
 */
public final class LocalTransport implements RemoteTransport {

    private static final Logger log = LoggerFactory.getLogger(LocalTransport.class);

    private final Path pocketDir;
    private final ObjectStore objects;
    private final Refs refs;

    public LocalTransport(Path repoRoot) throws RemoteException {
        this.pocketDir = repoRoot.resolve(Repository.POCKET_DIR);
        if (!Files.isDirectory(pocketDir)) {
            throw new RemoteException("'" + repoRoot + "' does not appear to be a pocket repository");
        }
        this.objects = new ObjectStore(pocketDir);
        this.refs = new Refs(pocketDir);
        log.debug("opened local transport {}", repoRoot);
    }

    @Override
    public List<Timeline> listTimelines() throws RemoteException {
        try {
            return refs.listTimelines();
        } catch (IOException e) {
            throw io("list timelines", e);
        } catch (PocketException e) {
            throw new RemoteException("remote timeline is corrupt: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<ShoveId> getHead(String timeline) throws RemoteException {
        try {
            if (!refs.timelineExists(timeline)) {
                return Optional.empty();
            }
            return Optional.ofNullable(refs.loadTimeline(timeline).getHead());
        } catch (IOException e) {
            throw io("read head of " + timeline, e);
        } catch (PocketException e) {
            throw new RemoteException("cannot read remote timeline '" + timeline + "': " + e.getMessage(), e);
        }
    }

    @Override
    public boolean hasObject(ObjectId id) {
        return objects.has(id);
    }

    @Override
    public byte[] getObject(ObjectId id) throws RemoteException {
        try {
            return objects.get(id);
        } catch (IOException e) {
            throw io("read object " + id, e);
        } catch (ObjectException e) {
            throw new RemoteException("remote object " + id + ": " + e.getMessage(), e);
        }
    }

    @Override
    public ObjectId putObject(byte[] content) throws RemoteException {
        try {
            return objects.store(content);
        } catch (IOException e) {
            throw io("write object", e);
        }
    }

    @Override
    public boolean hasShove(ShoveId id) {
        return refs.hasShove(id);
    }

    @Override
    public Shove getShove(ShoveId id) throws RemoteException {
        try {
            return refs.loadShove(id);
        } catch (IOException e) {
            throw io("read shove " + id, e);
        } catch (PocketException e) {
            throw new RemoteException("remote shove " + id + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void putShove(Shove shove) throws RemoteException {
        try {
            refs.saveShove(shove);
        } catch (IOException e) {
            throw io("write shove " + shove.getId(), e);
        }
    }

    @Override
    public boolean compareAndSetHead(String timeline, ShoveId expected, ShoveId newHead) throws RemoteException {
        try (RepositoryLock lock = RepositoryLock.acquire(pocketDir)) {
            Timeline current = refs.timelineExists(timeline) ? refs.loadTimeline(timeline) : new Timeline(timeline, null);
            if (!Objects.equals(current.getHead(), expected)) {
                log.debug("remote head of {} is {} (expected {})", timeline, current.getHead(), expected);
                return false;
            }
            current.updateHead(newHead);
            refs.saveTimeline(current);
            log.debug("remote head of {} set to {}", timeline, newHead);
            return true;
        } catch (RepositoryLockedException e) {
            throw new RemoteNetworkException("remote repository is busy: " + e.getMessage(), e);
        } catch (IOException e) {
            throw io("update head of " + timeline, e);
        } catch (PocketException e) {
            throw new RemoteException("cannot update remote timeline '" + timeline + "': " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        log.debug("closed local transport {}", pocketDir);
    }

    private static RemoteNetworkException io(String operation, IOException e) {
        return new RemoteNetworkException("failed to " + operation + ": " + e.getMessage(), e);
    }
}
