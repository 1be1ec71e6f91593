package com.pocket.remote;

import com.pocket.config.RemoteConfig;
import com.pocket.exception.PocketException;
import com.pocket.exception.RemoteException;
import com.pocket.exception.RemoteExistsException;
import com.pocket.exception.RemoteNotFoundException;
import com.pocket.exception.RemoteRejectedException;
import com.pocket.exception.TimelineNotFoundException;
import com.pocket.merge.MergeEngine;
import com.pocket.merge.MergeResult;
import com.pocket.merge.MergeStrategy;
import com.pocket.obj.ObjectId;
import com.pocket.obj.Shove;
import com.pocket.obj.ShoveId;
import com.pocket.obj.Tree;
import com.pocket.repo.ObjectStore;
import com.pocket.repo.Refs;
import com.pocket.repo.Repository;
import com.pocket.repo.Timeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 远端管理与同步：增删远端，push / fetch / pull。
 * <p>
 * push 先上传对象，再上传 shove，最后 compare-and-set 远端 head；
 * 中途失败时远端只多出一些不可达的对象，不会出现指向缺失对象的 head。
 * fetch 同样先落对象与 shove，最后才更新本地的远端跟踪 timeline。
 */
public class RemoteManager {

    private static final Logger log = LoggerFactory.getLogger(RemoteManager.class);

    public static final String DEFAULT_REMOTE_NAME = "origin";

    private final Repository repo;
    private final TransportFactory transportFactory;
    private final RetryPolicy retryPolicy;

    public RemoteManager(Repository repo) {
        this(repo, Transports.defaultFactory(repo.getRoot()), RetryPolicy.defaults());
    }

    public RemoteManager(Repository repo, TransportFactory transportFactory, RetryPolicy retryPolicy) {
        this.repo = repo;
        this.transportFactory = transportFactory;
        this.retryPolicy = retryPolicy;
    }

    // ---------- 远端配置 ----------

    /** 添加远端；第一个远端自动成为默认远端。 */
    public Remote addRemote(String name, String url) throws PocketException, IOException {
        if (!Timeline.isValidName(name)) {
            throw new RemoteException("invalid remote name '" + name + "'");
        }
        Transports.validateUrl(url);
        RemoteConfig remotes = repo.getConfig().getRemote();
        if (remotes.find(name).isPresent()) {
            throw new RemoteExistsException("remote '" + name + "' already exists");
        }
        Remote remote = Remote.of(name, url);
        remotes.getRemotes().add(remote);
        if (remotes.getDefaultRemote() == null) {
            remotes.setDefaultRemote(name);
        }
        repo.saveConfig();
        log.info("added remote {} -> {}", name, url);
        return remote;
    }

    /** 删除远端及其全部远端跟踪 timeline。 */
    public void removeRemote(String name) throws PocketException, IOException {
        RemoteConfig remotes = repo.getConfig().getRemote();
        Remote remote = getRemote(name);
        remotes.getRemotes().remove(remote);
        if (name.equals(remotes.getDefaultRemote())) {
            remotes.setDefaultRemote(remotes.getRemotes().isEmpty() ? null : remotes.getRemotes().get(0).getName());
        }
        repo.saveConfig();
        repo.getRefs().deleteRemoteTimelines(name);
        log.info("removed remote {}", name);
    }

    public List<Remote> listRemotes() {
        return List.copyOf(repo.getConfig().getRemote().getRemotes());
    }

    public Remote getRemote(String name) throws RemoteNotFoundException {
        return repo.getConfig().getRemote().find(name)
                .orElseThrow(() -> new RemoteNotFoundException("remote '" + name + "' not found"));
    }

    /**
     * 未指定远端时依次取：默认远端、唯一的远端、名为 origin 的远端。
     */
    public String resolveRemoteName(String name) throws RemoteException {
        if (name != null) {
            return name;
        }
        RemoteConfig remotes = repo.getConfig().getRemote();
        if (remotes.getDefaultRemote() != null) {
            return remotes.getDefaultRemote();
        }
        if (remotes.getRemotes().size() == 1) {
            return remotes.getRemotes().get(0).getName();
        }
        if (remotes.find(DEFAULT_REMOTE_NAME).isPresent()) {
            return DEFAULT_REMOTE_NAME;
        }
        throw new RemoteException("no remote specified and no default remote configured");
    }

    // ---------- push ----------

    /**
     * 把本地 timeline 推送到远端同名 timeline。远端 head 不是本地 head 的祖先时拒绝，
     * 除非 force。timelineName 为 null 时推送当前 timeline。
     */
    public PushResult push(String remoteName, String timelineName, boolean force) throws PocketException, IOException {
        Remote remote = getRemote(resolveRemoteName(remoteName));
        Refs refs = repo.getRefs();
        Timeline local = timelineName == null ? repo.getCurrentTimeline() : refs.loadTimeline(timelineName);
        if (!local.hasHead()) {
            throw new RemoteException("timeline '" + local.getName() + "' has no shoves to push");
        }
        String name = local.getName();
        ShoveId newHead = local.getHead();
        try (RemoteTransport transport = transportFactory.open(remote)) {
            ShoveId remoteHead = retryPolicy.execute("read remote head", () -> transport.getHead(name)).orElse(null);
            if (newHead.equals(remoteHead)) {
                recordPushed(remote, local);
                log.info("push {}/{}: up to date", remote.getName(), name);
                return PushResult.builder().remote(remote.getName()).timeline(name)
                        .oldHead(remoteHead).newHead(newHead).upToDate(true).build();
            }
            boolean forced = false;
            if (remoteHead != null && !isFastForward(remoteHead, newHead)) {
                if (!force) {
                    throw new RemoteRejectedException("rejected: '" + remote.getName() + "/" + name
                            + "' is not an ancestor of the local timeline (fish and merge first, or use --force)");
                }
                forced = true;
                log.warn("forcing push of {} over remote head {}", name, remoteHead);
            }

            ObjectStore objects = repo.getObjects();
            ShoveCollector collector = new ShoveCollector(new ShoveCollector.Source() {
                @Override
                public Shove shove(ShoveId id) throws PocketException, IOException {
                    return refs.loadShove(id);
                }

                @Override
                public Tree tree(ObjectId id) throws PocketException, IOException {
                    return objects.getTree(id);
                }
            });
            ShoveCollector.Collected collected = collector.collect(newHead,
                    id -> retryPolicy.execute("check remote shove", () -> transport.hasShove(id)));

            int objectsSent = 0;
            for (ObjectId id : collected.getObjects()) {
                if (retryPolicy.execute("check remote object", () -> transport.hasObject(id))) {
                    continue;
                }
                byte[] content = objects.get(id);
                ObjectId stored = retryPolicy.execute("upload object " + id.shortHex(), () -> transport.putObject(content));
                if (!stored.equals(id)) {
                    throw new RemoteException("remote stored object " + id + " as " + stored);
                }
                objectsSent++;
            }
            for (Shove shove : collected.getShoves()) {
                retryPolicy.execute("upload shove " + shove.getId().shortId(), () -> {
                    transport.putShove(shove);
                    return null;
                });
            }
            boolean updated = retryPolicy.execute("update remote head",
                    () -> transport.compareAndSetHead(name, remoteHead, newHead));
            if (!updated) {
                throw new RemoteRejectedException("rejected: remote timeline '" + name + "' changed during push, fish and retry");
            }
            recordPushed(remote, local);
            log.info("pushed {} to {}: {} shove(s), {} object(s)", name, remote.getName(),
                    collected.getShoves().size(), objectsSent);
            return PushResult.builder().remote(remote.getName()).timeline(name)
                    .oldHead(remoteHead).newHead(newHead)
                    .shovesSent(collected.getShoves().size()).objectsSent(objectsSent)
                    .forced(forced).build();
        }
    }

    /** 远端 head 在本地已知且是新 head 的祖先。 */
    private boolean isFastForward(ShoveId remoteHead, ShoveId newHead) throws PocketException, IOException {
        return repo.getRefs().hasShove(remoteHead) && new MergeEngine(repo).isAncestor(remoteHead, newHead);
    }

    private void recordPushed(Remote remote, Timeline local) throws IOException {
        local.setRemoteTracking(remote.getName(), local.getName());
        repo.getRefs().saveTimeline(local);
        Timeline tracking = new Timeline(local.getName(), local.getHead());
        tracking.setRemoteTracking(remote.getName(), local.getName());
        repo.getRefs().saveRemoteTimeline(remote.getName(), tracking);
    }

    // ---------- fetch ----------

    /**
     * 下载远端全部 timeline 的 shove 与对象，更新本地的远端跟踪 timeline（remote/name）。
     * 远端已删除的 timeline 对应的跟踪 timeline 一并删除。
     */
    public FetchResult fetch(String remoteName) throws PocketException, IOException {
        Remote remote = getRemote(resolveRemoteName(remoteName));
        Refs refs = repo.getRefs();
        ObjectStore objects = repo.getObjects();
        Map<String, ShoveId> updated = new LinkedHashMap<>();
        List<String> pruned = new ArrayList<>();
        int shovesFetched = 0;
        int objectsFetched = 0;
        try (RemoteTransport transport = transportFactory.open(remote)) {
            List<Timeline> remoteTimelines = retryPolicy.execute("list remote timelines", transport::listTimelines);
            ShoveCollector collector = new ShoveCollector(new ShoveCollector.Source() {
                @Override
                public Shove shove(ShoveId id) throws PocketException {
                    Shove shove = retryPolicy.execute("download shove " + id.shortId(), () -> transport.getShove(id));
                    if (!shove.getId().equals(id)) {
                        throw new RemoteException("remote returned shove " + shove.getId() + " for " + id);
                    }
                    return shove;
                }

                @Override
                public Tree tree(ObjectId id) throws PocketException, IOException {
                    download(transport, objects, id);
                    return objects.getTree(id);
                }
            });

            Set<String> seen = new HashSet<>();
            for (Timeline rt : remoteTimelines) {
                seen.add(rt.getName());
                if (!rt.hasHead()) {
                    continue;
                }
                ShoveCollector.Collected collected = collector.collect(rt.getHead(), refs::hasShove);
                for (ObjectId id : collected.getObjects()) {
                    if (download(transport, objects, id)) {
                        objectsFetched++;
                    }
                }
                for (Shove shove : collected.getShoves()) {
                    refs.saveShove(shove);
                }
                shovesFetched += collected.getShoves().size();

                ShoveId previous = refs.remoteTimelineExists(remote.getName(), rt.getName())
                        ? refs.loadRemoteTimeline(remote.getName(), rt.getName()).getHead() : null;
                if (!rt.getHead().equals(previous)) {
                    Timeline tracking = new Timeline(rt.getName(), rt.getHead());
                    tracking.setRemoteTracking(remote.getName(), rt.getName());
                    refs.saveRemoteTimeline(remote.getName(), tracking);
                    updated.put(rt.getName(), rt.getHead());
                    log.info("fished {}: {} -> {}", Refs.remoteTimelineName(remote.getName(), rt.getName()),
                            previous == null ? "(new)" : previous.shortId(), rt.getHead().shortId());
                }
            }
            for (Timeline existing : refs.listRemoteTimelines(remote.getName())) {
                if (!seen.contains(existing.getName())) {
                    refs.deleteRemoteTimeline(remote.getName(), existing.getName());
                    pruned.add(existing.getName());
                    log.info("pruned {}", Refs.remoteTimelineName(remote.getName(), existing.getName()));
                }
            }
        }
        return FetchResult.builder().remote(remote.getName()).updated(updated).pruned(pruned)
                .shovesFetched(shovesFetched).objectsFetched(objectsFetched).build();
    }

    /** 下载缺失的对象并校验哈希；本地已有时返回 false。 */
    private boolean download(RemoteTransport transport, ObjectStore objects, ObjectId id) throws PocketException, IOException {
        if (objects.has(id)) {
            return false;
        }
        byte[] content = retryPolicy.execute("download object " + id.shortHex(), () -> transport.getObject(id));
        ObjectId actual = ObjectStore.hash(content);
        if (!actual.equals(id)) {
            throw new RemoteException("remote sent corrupt object " + id + " (content hashes to " + actual + ")");
        }
        objects.store(content);
        return true;
    }

    // ---------- pull ----------

    /**
     * fetch 后把 remote/timeline 合并进当前 timeline。timelineName 为 null 时取当前 timeline 的名称。
     */
    public MergeResult pull(String remoteName, String timelineName) throws PocketException, IOException {
        String remote = resolveRemoteName(remoteName);
        fetch(remote);
        Timeline current = repo.getCurrentTimeline();
        String name = timelineName != null ? timelineName : current.getName();
        if (!repo.getRefs().remoteTimelineExists(remote, name)) {
            throw new TimelineNotFoundException("remote timeline '" + Refs.remoteTimelineName(remote, name) + "' not found");
        }
        MergeResult result = new MergeEngine(repo).merge(Refs.remoteTimelineName(remote, name), MergeStrategy.AUTO);
        if (result.isSuccess()) {
            Timeline after = repo.getCurrentTimeline();
            after.setRemoteTracking(remote, name);
            repo.getRefs().saveTimeline(after);
        }
        return result;
    }

    /** 远端跟踪 timeline 的 head，未 fetch 过时为空。 */
    public Optional<ShoveId> trackedHead(String remote, String name) throws PocketException, IOException {
        Refs refs = repo.getRefs();
        if (!refs.remoteTimelineExists(remote, name)) {
            return Optional.empty();
        }
        return Optional.ofNullable(refs.loadRemoteTimeline(remote, name).getHead());
    }
}
