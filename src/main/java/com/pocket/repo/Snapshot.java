package com.pocket.repo;

import com.pocket.obj.ObjectId;
import com.pocket.obj.ShoveId;
import com.pocket.obj.TreeEntry;
import lombok.Value;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 某个 shove 的扁平化文件视图：相对路径（/ 分隔）到文件条目的有序映射。
 * shoveId 为 null 表示空 timeline（尚无提交）。
 */
@Value
public class Snapshot {
    ShoveId shoveId;
    SortedMap<String, TreeEntry> files;

    public Snapshot(ShoveId shoveId, SortedMap<String, TreeEntry> files) {
        this.shoveId = shoveId;
        this.files = Collections.unmodifiableSortedMap(new TreeMap<>(files));
    }

    public static Snapshot empty() {
        return new Snapshot(null, new TreeMap<>());
    }

    public boolean contains(String path) {
        return files.containsKey(path);
    }

    /** 路径对应的对象 id，不存在返回 null。 */
    public ObjectId idOf(String path) {
        TreeEntry entry = files.get(path);
        return entry != null ? entry.getId() : null;
    }
}
