package com.pocket.repo;

import com.pocket.exception.CorruptObjectException;
import com.pocket.exception.ObjectException;
import com.pocket.obj.FileChange;
import com.pocket.obj.ObjectId;
import com.pocket.obj.Tree;
import com.pocket.obj.TreeEntry;
import lombok.experimental.UtilityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * tree 与扁平路径映射之间的转换，以及两个扁平视图之间的文件级差异。
 */
@UtilityClass
public class TreeWalker {

    private static final Logger log = LoggerFactory.getLogger(TreeWalker.class);

    /**
     * 递归展开 tree，返回 "dir/file" → 文件条目（条目的 name 为完整路径）。
     * rootId 为 null 时返回空映射。
     */
    public static SortedMap<String, TreeEntry> flatten(ObjectStore store, ObjectId rootId)
            throws ObjectException, IOException {
        SortedMap<String, TreeEntry> files = new TreeMap<>();
        if (rootId != null) {
            flatten(store, rootId, "", files, new HashSet<>());
        }
        return files;
    }

    private static void flatten(ObjectStore store, ObjectId treeId, String prefix,
                                SortedMap<String, TreeEntry> out, Set<ObjectId> path)
            throws ObjectException, IOException {
        if (!path.add(treeId)) {
            throw new CorruptObjectException("tree " + treeId + " contains itself");
        }
        Tree tree = store.getTree(treeId);
        for (TreeEntry entry : tree.getEntries()) {
            String full = prefix + entry.getName();
            if (entry.isTree()) {
                flatten(store, entry.getId(), full + "/", out, path);
            } else {
                out.put(full, entry.withName(full));
            }
        }
        path.remove(treeId);
    }

    /**
     * 由扁平路径映射递归构建嵌套 tree 并全部写入对象库，返回根 tree id。
     * prefix 为当前目录相对仓库根的路径（如 "" 或 "dir/"）。
     */
    public static ObjectId build(ObjectStore store, SortedMap<String, TreeEntry> files) throws IOException {
        return build(store, files, "");
    }

    private static ObjectId build(ObjectStore store, SortedMap<String, TreeEntry> files, String prefix)
            throws IOException {
        List<TreeEntry> entries = new ArrayList<>();
        Set<String> dirNames = new TreeSet<>();
        SortedMap<String, TreeEntry> scoped = prefix.isEmpty() ? files : files.subMap(prefix, prefix + Character.MAX_VALUE);
        for (Map.Entry<String, TreeEntry> e : scoped.entrySet()) {
            String local = e.getKey().substring(prefix.length());
            if (local.isEmpty()) {
                continue;
            }
            int slash = local.indexOf('/');
            if (slash < 0) {
                entries.add(e.getValue().withName(local));
            } else {
                dirNames.add(local.substring(0, slash));
            }
        }
        for (String dirName : dirNames) {
            ObjectId childId = build(store, files, prefix + dirName + "/");
            entries.add(TreeEntry.tree(dirName, childId));
            log.debug("tree entry dir {}{} -> {}", prefix, dirName, childId.shortHex());
        }
        ObjectId treeId = store.storeTree(Tree.of(entries));
        log.debug("stored tree prefix='{}' id={}", prefix, treeId.shortHex());
        return treeId;
    }

    /**
     * 把文件放入扁平映射，同时移除与之冲突的条目：
     * 新路径 a/b 会移除文件 a，新路径 a 会移除 a/ 下的所有文件。
     */
    public static void put(SortedMap<String, TreeEntry> files, String path, TreeEntry entry) {
        files.remove(path);
        files.subMap(path + "/", path + "/" + Character.MAX_VALUE).clear();
        int slash = path.indexOf('/');
        while (slash >= 0) {
            files.remove(path.substring(0, slash));
            slash = path.indexOf('/', slash + 1);
        }
        files.put(path, entry.withName(path));
    }

    /**
     * 比较两个扁平视图。只在一侧出现且内容相同的一对删除/新增识别为 RENAMED。
     */
    public static List<FileChange> diff(SortedMap<String, TreeEntry> oldFiles, SortedMap<String, TreeEntry> newFiles) {
        List<FileChange> changes = new ArrayList<>();
        Map<ObjectId, String> deletedById = new HashMap<>();
        for (Map.Entry<String, TreeEntry> e : oldFiles.entrySet()) {
            TreeEntry now = newFiles.get(e.getKey());
            if (now == null) {
                deletedById.putIfAbsent(e.getValue().getId(), e.getKey());
            } else if (!now.getId().equals(e.getValue().getId())) {
                changes.add(FileChange.modified(e.getKey(), e.getValue().getId(), now.getId()));
            }
        }
        Set<String> renameSources = new HashSet<>();
        for (Map.Entry<String, TreeEntry> e : newFiles.entrySet()) {
            if (oldFiles.containsKey(e.getKey())) {
                continue;
            }
            String oldPath = deletedById.remove(e.getValue().getId());
            if (oldPath != null) {
                renameSources.add(oldPath);
                changes.add(FileChange.renamed(oldPath, e.getKey(), e.getValue().getId()));
            } else {
                changes.add(FileChange.added(e.getKey(), e.getValue().getId()));
            }
        }
        for (Map.Entry<String, TreeEntry> e : oldFiles.entrySet()) {
            if (!newFiles.containsKey(e.getKey()) && !renameSources.contains(e.getKey())) {
                changes.add(FileChange.deleted(e.getKey(), e.getValue().getId()));
            }
        }
        changes.sort(Comparator.comparing(FileChange::getPath));
        return changes;
    }
}
