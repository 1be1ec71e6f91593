package com.pocket.merge;

import com.pocket.diff.DiffEngine;
import com.pocket.exception.MergeException;
import com.pocket.exception.PocketException;
import com.pocket.exception.UncommittedChangesException;
import com.pocket.exception.UnrelatedHistoriesException;
import com.pocket.obj.ObjectId;
import com.pocket.obj.Shove;
import com.pocket.obj.ShoveId;
import com.pocket.obj.TreeEntry;
import com.pocket.repo.ObjectStore;
import com.pocket.repo.Pile;
import com.pocket.repo.PileEntry;
import com.pocket.repo.RepoStatus;
import com.pocket.repo.Repository;
import com.pocket.repo.Snapshot;
import com.pocket.repo.Timeline;
import com.pocket.repo.TreeWalker;
import com.pocket.repo.Workspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 合并引擎：查找最近公共祖先，判断快进/无操作，否则按路径做三路合并。
 * 冲突不抛异常，以 MergeResult 返回，并记录在 .pocket/MERGE.toml 中等待解决。
 */
public final class MergeEngine {

    private static final Logger log = LoggerFactory.getLogger(MergeEngine.class);

    private final Repository repo;
    private final TextMerger textMerger;

    public MergeEngine(Repository repo) {
        this.repo = repo;
        this.textMerger = new TextMerger(new DiffEngine());
    }

    /**
     * 把 timeline theirsName（可为 remote/name）合并到当前 timeline。
     */
    public MergeResult merge(String theirsName, MergeStrategy strategy) throws PocketException, IOException {
        if (MergeState.load(repo.getPocketDir()).isPresent()) {
            throw new MergeException("a merge is already in progress (resolve conflicts and shove, or use merge --abort)");
        }
        Timeline ours = repo.getCurrentTimeline();
        Timeline theirs = repo.getRefs().resolveTimeline(theirsName);
        if (theirs.getHead() == null) {
            throw new MergeException("timeline '" + theirsName + "' has no shoves to merge");
        }
        RepoStatus status = repo.status();
        if (!status.getPiledEntries().isEmpty() || !status.getModifiedFiles().isEmpty()
                || !status.getDeletedFiles().isEmpty()) {
            throw new UncommittedChangesException("cannot merge: you have uncommitted changes (shove or unpile them first)");
        }
        log.debug("merge {} ({}) into {} ({}) strategy={}", theirsName, theirs.getHead(), ours.getName(),
                ours.getHead(), strategy);
        return mergeInto(ours, theirsName, theirs.getHead(), strategy, status);
    }

    private MergeResult mergeInto(Timeline ours, String theirsName, ShoveId theirsHead, MergeStrategy strategy,
                                  RepoStatus status)
            throws PocketException, IOException {
        ShoveId oursHead = ours.getHead();
        if (theirsHead.equals(oursHead)) {
            return MergeResult.builder().success(true).fastForward(true).head(oursHead).base(oursHead)
                    .message("Already up to date.").build();
        }
        String action = "merge '" + theirsName + "'";
        if (oursHead == null) {
            fastForward(ours, theirsHead, status, action);
            return MergeResult.builder().success(true).fastForward(true).head(theirsHead)
                    .message("Fast-forward").build();
        }
        ShoveId base = findCommonAncestor(oursHead, theirsHead)
                .orElseThrow(() -> new UnrelatedHistoriesException("refusing to merge unrelated histories: '"
                        + ours.getName() + "' and '" + theirsName + "' have no common ancestor"));

        if (base.equals(oursHead)) {
            if (strategy == MergeStrategy.ALWAYS_CREATE_SHOVE) {
                Snapshot theirsSnap = repo.snapshot(theirsHead);
                repo.checkUntrackedOverwrite(status, theirsSnap.getFiles(), Set.of(), action);
                Shove shove = createMergeShove(ours, theirsName, theirsHead, theirsSnap.getFiles());
                repo.checkout(repo.snapshot(oursHead), theirsSnap);
                return MergeResult.builder().success(true).fastForward(false).newShove(shove.getId())
                        .head(shove.getId()).base(base).message("Merge made by always-create-shove").build();
            }
            fastForward(ours, theirsHead, status, action);
            return MergeResult.builder().success(true).fastForward(true).head(theirsHead).base(base)
                    .message("Fast-forward").build();
        }
        if (base.equals(theirsHead)) {
            return MergeResult.builder().success(true).fastForward(false).head(oursHead).base(base)
                    .message("Already up to date.").build();
        }
        if (strategy == MergeStrategy.FAST_FORWARD_ONLY) {
            return MergeResult.builder().success(false).fastForward(false).head(oursHead).base(base)
                    .message("Not possible to fast-forward, aborting.").build();
        }

        Snapshot baseSnap = repo.snapshot(base);
        Snapshot oursSnap = repo.snapshot(oursHead);
        Snapshot theirsSnap = repo.snapshot(theirsHead);
        TreeMerge merged = threeWay(baseSnap, oursSnap, theirsSnap, strategy);

        List<MergeConflict> unresolved = new ArrayList<>();
        for (MergeConflict c : merged.conflicts) {
            if (!c.isResolved()) {
                unresolved.add(c);
            }
        }
        if (unresolved.isEmpty()) {
            SortedMap<String, TreeEntry> files = new TreeMap<>(merged.files);
            for (MergeConflict c : merged.conflicts) {
                applyResolution(files, c, oursSnap, theirsSnap);
            }
            repo.checkUntrackedOverwrite(status, files, Set.of(), action);
            Shove shove = createMergeShove(ours, theirsName, theirsHead, files);
            repo.checkout(oursSnap, new Snapshot(shove.getId(), files));
            log.info("merged {} into {} as {} ({} conflicts pre-resolved)", theirsName, ours.getName(),
                    shove.getId().shortId(), merged.conflicts.size());
            return MergeResult.builder().success(true).fastForward(false).newShove(shove.getId())
                    .head(shove.getId()).base(base).conflicts(merged.conflicts)
                    .message("Merge made by the '" + strategy.name().toLowerCase(Locale.ROOT) + "' strategy.").build();
        }

        // 冲突：干净的部分写入工作区并暂存，冲突文件写入冲突标记
        repo.checkUntrackedOverwrite(status, merged.files, merged.conflictContent.keySet(), action);
        Snapshot cleanSnap = new Snapshot(null, merged.files);
        repo.checkout(oursSnap, cleanSnap);
        Pile pile = repo.getPile();
        pile.clear();
        for (Map.Entry<String, TreeEntry> e : merged.files.entrySet()) {
            TreeEntry now = e.getValue();
            pile.addObject(e.getKey(), now.getId(), now.getPermissions(), oursSnap);
        }
        for (String path : oursSnap.getFiles().keySet()) {
            if (!merged.files.containsKey(path) && !merged.conflictContent.containsKey(path)) {
                pile.markDeleted(path, oursSnap);
            }
        }
        repo.savePile();
        Workspace workspace = repo.getWorkspace();
        for (Map.Entry<String, byte[]> e : merged.conflictContent.entrySet()) {
            workspace.writeFile(e.getKey(), e.getValue(), permissionsOf(e.getKey(), oursSnap, theirsSnap));
        }
        MergeState.builder()
                .timeline(ours.getName())
                .theirsName(theirsName)
                .oursHead(oursHead)
                .theirsHead(theirsHead)
                .baseShove(base)
                .conflicts(merged.conflicts)
                .build()
                .save(repo.getPocketDir());
        log.info("merge of {} into {} stopped with {} conflicts", theirsName, ours.getName(), unresolved.size());
        return MergeResult.builder().success(false).fastForward(false).head(oursHead).base(base)
                .conflicts(merged.conflicts)
                .message("Automatic merge failed; fix conflicts and then shove the result.").build();
    }

    private void fastForward(Timeline ours, ShoveId theirsHead, RepoStatus status, String action)
            throws PocketException, IOException {
        Snapshot target = repo.snapshot(theirsHead);
        repo.checkUntrackedOverwrite(status, target.getFiles(), Set.of(), action);
        repo.checkout(repo.snapshot(ours.getHead()), target);
        ours.updateHead(theirsHead);
        repo.getRefs().saveTimeline(ours);
        log.info("fast-forwarded {} to {}", ours.getName(), theirsHead.shortId());
    }

    private Shove createMergeShove(Timeline ours, String theirsName, ShoveId theirsHead,
                                   SortedMap<String, TreeEntry> files) throws PocketException, IOException {
        ObjectId treeId = TreeWalker.build(repo.getObjects(), files);
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        Shove shove = Shove.create(List.of(ours.getHead(), theirsHead), repo.currentAuthor(now), now,
                "Merge timeline '" + theirsName + "' into " + ours.getName(), treeId);
        repo.writeShove(ours, shove);
        return shove;
    }

    // ---------- 三路合并 ----------

    /** 按路径合并的中间结果。 */
    private static final class TreeMerge {
        private final SortedMap<String, TreeEntry> files = new TreeMap<>();
        private final List<MergeConflict> conflicts = new ArrayList<>();
        /** 冲突文件写入工作区的内容（带冲突标记）。 */
        private final Map<String, byte[]> conflictContent = new LinkedHashMap<>();
    }

    /**
     * 逐路径合并：一侧未变取另一侧；两侧相同取任一侧；两侧都是文本时尝试按行合并；
     * 否则为冲突。OURS/THEIRS 策略为每个冲突预先设定解决方式。
     */
    private TreeMerge threeWay(Snapshot base, Snapshot ours, Snapshot theirs, MergeStrategy strategy)
            throws PocketException, IOException {
        ObjectStore objects = repo.getObjects();
        TreeMerge result = new TreeMerge();
        Set<String> paths = new TreeSet<>();
        paths.addAll(base.getFiles().keySet());
        paths.addAll(ours.getFiles().keySet());
        paths.addAll(theirs.getFiles().keySet());

        for (String path : paths) {
            TreeEntry b = base.getFiles().get(path);
            TreeEntry o = ours.getFiles().get(path);
            TreeEntry t = theirs.getFiles().get(path);
            if (same(o, t)) {
                put(result.files, path, o);
            } else if (same(b, o)) {
                put(result.files, path, t);
            } else if (same(b, t)) {
                put(result.files, path, o);
            } else {
                mergeContent(result, path, b, o, t, strategy, objects);
            }
        }
        log.debug("three-way merge paths={} conflicts={}", paths.size(), result.conflicts.size());
        return result;
    }

    private void mergeContent(TreeMerge result, String path, TreeEntry b, TreeEntry o, TreeEntry t,
                              MergeStrategy strategy, ObjectStore objects) throws PocketException, IOException {
        byte[] baseBytes = b != null ? objects.get(b.getId()) : new byte[0];
        byte[] oursBytes = o != null ? objects.get(o.getId()) : null;
        byte[] theirsBytes = t != null ? objects.get(t.getId()) : null;
        boolean text = oursBytes != null && theirsBytes != null
                && !DiffEngine.isBinary(baseBytes) && !DiffEngine.isBinary(oursBytes) && !DiffEngine.isBinary(theirsBytes);
        byte[] markers;
        if (text) {
            TextMerger.MergedText merged = textMerger.merge(decode(baseBytes), decode(oursBytes), decode(theirsBytes));
            if (!merged.isConflict()) {
                ObjectId id = objects.store(merged.getText().getBytes(StandardCharsets.UTF_8));
                result.files.put(path, TreeEntry.file(path, id, o.getPermissions()));
                log.debug("line-merged {} cleanly", path);
                return;
            }
            markers = merged.getText().getBytes(StandardCharsets.UTF_8);
        } else if (oursBytes != null && theirsBytes != null) {
            // 二进制：工作区保留 ours
            markers = oursBytes;
        } else if ((oursBytes != null && !DiffEngine.isBinary(oursBytes))
                || (theirsBytes != null && !DiffEngine.isBinary(theirsBytes))) {
            markers = TextMerger.conflictMarkers(oursBytes != null ? decode(oursBytes) : "",
                    theirsBytes != null ? decode(theirsBytes) : "").getBytes(StandardCharsets.UTF_8);
        } else {
            markers = oursBytes != null ? oursBytes : theirsBytes;
        }
        MergeConflict conflict = MergeConflict.builder()
                .path(path)
                .baseId(b != null ? b.getId() : null)
                .oursId(o != null ? o.getId() : null)
                .theirsId(t != null ? t.getId() : null)
                .build();
        if (strategy == MergeStrategy.OURS) {
            conflict = conflict.withResolution(ConflictResolution.useOurs());
        } else if (strategy == MergeStrategy.THEIRS) {
            conflict = conflict.withResolution(ConflictResolution.useTheirs());
        }
        result.conflicts.add(conflict);
        result.conflictContent.put(path, markers);
        log.debug("conflict in {} (base={}, ours={}, theirs={})", path, b != null, o != null, t != null);
    }

    private static void applyResolution(SortedMap<String, TreeEntry> files, MergeConflict c,
                                        Snapshot ours, Snapshot theirs) {
        ObjectId id = c.resolvedId();
        if (id == null) {
            files.remove(c.getPath());
            return;
        }
        files.put(c.getPath(), TreeEntry.file(c.getPath(), id, permissionsOf(c.getPath(), ours, theirs)));
    }

    private static int permissionsOf(String path, Snapshot ours, Snapshot theirs) {
        TreeEntry e = ours.getFiles().get(path);
        if (e == null) {
            e = theirs.getFiles().get(path);
        }
        return e != null ? e.getPermissions() : TreeEntry.MODE_REGULAR;
    }

    private static boolean same(TreeEntry x, TreeEntry y) {
        if (x == null || y == null) {
            return x == y;
        }
        return x.getId().equals(y.getId()) && x.getPermissions() == y.getPermissions();
    }

    private static void put(SortedMap<String, TreeEntry> files, String path, TreeEntry entry) {
        if (entry != null) {
            files.put(path, entry);
        }
    }

    private static String decode(byte[] content) {
        return new String(content, StandardCharsets.UTF_8);
    }

    // ---------- 冲突处理 ----------

    /**
     * 以 ours 或 theirs 的版本解决某个冲突：写入工作区、暂存并记录到合并状态。
     */
    public void resolve(String path, ConflictResolution resolution) throws PocketException, IOException {
        MergeState state = MergeState.load(repo.getPocketDir())
                .orElseThrow(() -> new MergeException("no merge in progress"));
        MergeConflict conflict = state.find(path)
                .orElseThrow(() -> new MergeException("no conflict recorded for '" + path + "'"));
        MergeConflict resolved = conflict.withResolution(resolution);
        ObjectId id = resolved.resolvedId();
        Snapshot head = repo.headSnapshot();
        Snapshot theirs = repo.snapshot(state.getTheirsHead());
        Pile pile = repo.getPile();
        Workspace workspace = repo.getWorkspace();
        if (id == null) {
            if (workspace.exists(path)) {
                workspace.deleteFile(path);
            }
            if (head.contains(path)) {
                pile.markDeleted(path, head);
            } else if (pile.contains(path)) {
                pile.removePath(path);
            }
        } else {
            int permissions = permissionsOf(path, resolution.getKind() == ConflictResolution.Kind.USE_THEIRS ? theirs : head,
                    head);
            workspace.writeFile(path, repo.getObjects().get(id), permissions);
            pile.addObject(path, id, permissions, head);
        }
        repo.savePile();
        state.resolve(path, resolution).save(repo.getPocketDir());
        log.info("resolved {} using {}", path, resolution.getKind());
    }

    /**
     * 放弃未完成的合并：恢复 HEAD 版本的文件，清空 pile 与合并状态。
     */
    public void abortMerge() throws PocketException, IOException {
        MergeState state = MergeState.load(repo.getPocketDir())
                .orElseThrow(() -> new MergeException("no merge in progress"));
        Snapshot head = repo.headSnapshot();
        Workspace workspace = repo.getWorkspace();
        Set<String> touched = new TreeSet<>();
        for (MergeConflict c : state.getConflicts()) {
            touched.add(c.getPath());
        }
        for (PileEntry e : repo.getPile().getEntries()) {
            touched.add(e.getPath());
            if (e.getOriginalPath() != null) {
                touched.add(e.getOriginalPath());
            }
        }
        for (String path : touched) {
            TreeEntry entry = head.getFiles().get(path);
            if (entry != null) {
                workspace.writeFile(path, repo.getObjects().get(entry.getId()), entry.getPermissions());
            } else if (workspace.exists(path) && !workspace.isDirectory(path)) {
                workspace.deleteFile(path);
            }
        }
        repo.getPile().clear();
        repo.savePile();
        MergeState.clear(repo.getPocketDir());
        log.info("aborted merge of {}", state.getTheirsName());
    }

    // ---------- 祖先查找 ----------

    /** ancestor 是否为 descendant 本身或其祖先。 */
    public boolean isAncestor(ShoveId ancestor, ShoveId descendant) throws PocketException, IOException {
        Deque<ShoveId> queue = new ArrayDeque<>();
        Set<ShoveId> seen = new HashSet<>();
        queue.add(descendant);
        while (!queue.isEmpty()) {
            ShoveId id = queue.poll();
            if (!seen.add(id)) {
                continue;
            }
            if (id.equals(ancestor)) {
                return true;
            }
            queue.addAll(repo.getRefs().loadShove(id).getParentIds());
        }
        return false;
    }

    /**
     * 最近公共祖先：一方是另一方的祖先时直接返回它；
     * 否则从两侧同时按层 BFS，第一个被两侧都访问到的 shove。
     */
    public Optional<ShoveId> findCommonAncestor(ShoveId a, ShoveId b) throws PocketException, IOException {
        if (a.equals(b) || isAncestor(a, b)) {
            return Optional.of(a);
        }
        if (isAncestor(b, a)) {
            return Optional.of(b);
        }
        Deque<ShoveId> queueA = new ArrayDeque<>(List.of(a));
        Deque<ShoveId> queueB = new ArrayDeque<>(List.of(b));
        Set<ShoveId> seenA = new HashSet<>();
        Set<ShoveId> seenB = new HashSet<>();
        while (!queueA.isEmpty() || !queueB.isEmpty()) {
            ShoveId found = step(queueA, seenA, seenB);
            if (found != null) {
                return Optional.of(found);
            }
            found = step(queueB, seenB, seenA);
            if (found != null) {
                return Optional.of(found);
            }
        }
        return Optional.empty();
    }

    /** 展开一层；返回第一个已被另一侧访问过的 shove。 */
    private ShoveId step(Deque<ShoveId> queue, Set<ShoveId> seen, Set<ShoveId> other)
            throws PocketException, IOException {
        int levelSize = queue.size();
        for (int i = 0; i < levelSize; i++) {
            ShoveId id = queue.poll();
            if (!seen.add(id)) {
                continue;
            }
            if (other.contains(id)) {
                return id;
            }
            queue.addAll(repo.getRefs().loadShove(id).getParentIds());
        }
        return null;
    }
}
