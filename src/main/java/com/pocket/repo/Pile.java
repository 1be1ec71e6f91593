package com.pocket.repo;

import com.pocket.exception.PileException;
import com.pocket.obj.ObjectId;
import com.pocket.obj.ShoveId;
import com.pocket.obj.TreeEntry;
import com.pocket.utils.TomlUtils;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 暂存区（pile）：记录待提交的变更，shove 只从这里读取内容，从不直接读工作区。
 * 每个路径至多一条记录。持久化为 .pocket/piles/current.toml：
 * base_shove（pile 建立时的 head）与按 path 排序的 entries。
 */
@EqualsAndHashCode
public final class Pile {

    private static final Logger log = LoggerFactory.getLogger(Pile.class);

    private final SortedMap<String, PileEntry> entries = new TreeMap<>();
    private ShoveId baseShove;

    /**
     * 从文件加载；文件不存在视为空 pile。
     */
    public static Pile load(Path file) throws IOException {
        Pile pile = new Pile();
        if (!Files.exists(file)) {
            log.debug("pile file not found, using empty pile");
            return pile;
        }
        PileFile data = TomlUtils.read(file, PileFile.class);
        pile.baseShove = data.getBaseShove();
        for (PileEntry e : data.getEntries()) {
            pile.entries.put(e.getPath(), e);
        }
        log.debug("loaded pile entries={} base={}", pile.entries.size(), pile.baseShove);
        return pile;
    }

    /** 写入文件（原子替换）。 */
    public void save(Path file) throws IOException {
        TomlUtils.write(file, PileFile.builder()
                .baseShove(baseShove)
                .entries(new ArrayList<>(entries.values()))
                .build());
        log.debug("saved pile entries={} base={}", entries.size(), baseShove);
    }

    /**
     * 暂存文件内容：写入对象库，HEAD 中没有该路径为 ADDED，内容不同为 MODIFIED。
     * 内容与 HEAD 相同时移除已有记录并返回空。
     */
    public Optional<PileEntry> addPath(String path, byte[] content, int permissions,
                                       ObjectStore store, Snapshot head) throws IOException {
        return addObject(path, store.store(content), permissions, head);
    }

    /**
     * 暂存对象库中已有的内容，规则同 {@link #addPath}。
     */
    public Optional<PileEntry> addObject(String path, ObjectId id, int permissions, Snapshot head) {
        TreeEntry headEntry = head.getFiles().get(path);
        if (headEntry != null && headEntry.getId().equals(id) && headEntry.getPermissions() == permissions) {
            if (entries.remove(path) != null) {
                log.debug("unpiled {} (identical to HEAD)", path);
            }
            if (entries.isEmpty()) {
                baseShove = null;
            }
            return Optional.empty();
        }
        anchor(head);
        PileEntry entry = PileEntry.builder()
                .path(path)
                .status(headEntry == null ? PileStatus.ADDED : PileStatus.MODIFIED)
                .objectId(id)
                .permissions(permissions)
                .build();
        entries.put(path, entry);
        log.debug("piled {} status={} id={}", path, entry.getStatus(), id.shortHex());
        return Optional.of(entry);
    }

    /** 暂存内容，权限使用普通文件 0644。 */
    public Optional<PileEntry> addPath(String path, byte[] content, ObjectStore store, Snapshot head)
            throws IOException {
        return addPath(path, content, TreeEntry.MODE_REGULAR, store, head);
    }

    /** 暂存删除；路径必须存在于 HEAD。 */
    public PileEntry markDeleted(String path, Snapshot head) throws PileException {
        if (!head.contains(path)) {
            throw new PileException("cannot pile deletion of '" + path + "': not tracked");
        }
        anchor(head);
        PileEntry entry = PileEntry.builder().path(path).status(PileStatus.DELETED).build();
        entries.put(path, entry);
        log.debug("piled deletion {}", path);
        return entry;
    }

    /** 暂存改名：旧路径从 tree 中移除，新路径指向 id。 */
    public PileEntry markRenamed(String oldPath, String newPath, ObjectId id, Snapshot head) throws PileException {
        TreeEntry old = head.getFiles().get(oldPath);
        if (old == null) {
            throw new PileException("cannot rename '" + oldPath + "': not tracked");
        }
        anchor(head);
        entries.remove(oldPath);
        PileEntry entry = PileEntry.builder()
                .path(newPath)
                .status(PileStatus.RENAMED)
                .objectId(id)
                .originalPath(oldPath)
                .permissions(old.getPermissions())
                .build();
        entries.put(newPath, entry);
        log.debug("piled rename {} -> {}", oldPath, newPath);
        return entry;
    }

    /**
     * 把内容与权限都相同的一对 DELETED、ADDED 记录合并为 RENAMED，返回新生成的记录。
     */
    public List<PileEntry> pairRenames(Snapshot head) throws PileException {
        Map<ObjectId, String> deletedById = new HashMap<>();
        for (PileEntry e : entries.values()) {
            TreeEntry old = head.getFiles().get(e.getPath());
            if (e.getStatus() == PileStatus.DELETED && old != null) {
                deletedById.putIfAbsent(old.getId(), e.getPath());
            }
        }
        List<PileEntry> renamed = new ArrayList<>();
        if (deletedById.isEmpty()) {
            return renamed;
        }
        for (PileEntry e : new ArrayList<>(entries.values())) {
            if (e.getStatus() != PileStatus.ADDED) {
                continue;
            }
            String oldPath = deletedById.get(e.getObjectId());
            if (oldPath != null && head.getFiles().get(oldPath).getPermissions() == e.getPermissions()) {
                deletedById.remove(e.getObjectId());
                renamed.add(markRenamed(oldPath, e.getPath(), e.getObjectId(), head));
            }
        }
        return renamed;
    }

    /** path 是否作为某条 RENAMED 记录的原路径。 */
    public boolean isRenamedFrom(String path) {
        for (PileEntry e : entries.values()) {
            if (e.getStatus() == PileStatus.RENAMED && path.equals(e.getOriginalPath())) {
                return true;
            }
        }
        return false;
    }

    /** 移除一条记录；不存在时抛 PileException。 */
    public PileEntry removePath(String path) throws PileException {
        PileEntry removed = entries.remove(path);
        if (removed == null) {
            throw new PileException("'" + path + "' is not in the pile");
        }
        if (entries.isEmpty()) {
            baseShove = null;
        }
        log.debug("unpiled {}", path);
        return removed;
    }

    /** 清空 pile。 */
    public void clear() {
        entries.clear();
        baseShove = null;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public boolean contains(String path) {
        return entries.containsKey(path);
    }

    public PileEntry get(String path) {
        return entries.get(path);
    }

    /** 按 path 排序的全部记录（只读副本）。 */
    public List<PileEntry> getEntries() {
        return new ArrayList<>(entries.values());
    }

    /** pile 建立时的 head；空 pile 为 null。 */
    public ShoveId getBaseShove() {
        return baseShove;
    }

    /** pile 非空且建立时的 head 不是当前 head。 */
    public boolean isStale(ShoveId currentHead) {
        return !entries.isEmpty() && baseShove != null && !baseShove.equals(currentHead);
    }

    /**
     * 把 pile 应用到 HEAD 的扁平视图上：ADDED/MODIFIED 写入，DELETED 删除，RENAMED 删除旧路径。
     */
    public SortedMap<String, TreeEntry> applyTo(SortedMap<String, TreeEntry> headFiles) {
        SortedMap<String, TreeEntry> result = new TreeMap<>(headFiles);
        for (PileEntry e : entries.values()) {
            switch (e.getStatus()) {
                case DELETED:
                    result.remove(e.getPath());
                    break;
                case RENAMED:
                    result.remove(e.getOriginalPath());
                    TreeWalker.put(result, e.getPath(), e.toTreeEntry());
                    break;
                default:
                    TreeWalker.put(result, e.getPath(), e.toTreeEntry());
                    break;
            }
        }
        return result;
    }

    /** 第一次往空 pile 加记录时记下基准 head。 */
    private void anchor(Snapshot head) {
        if (entries.isEmpty()) {
            baseShove = head.getShoveId();
        }
    }

    @Value
    @Builder
    @Jacksonized
    static class PileFile {
        ShoveId baseShove;
        @Builder.Default
        List<PileEntry> entries = new ArrayList<>();
    }
}
