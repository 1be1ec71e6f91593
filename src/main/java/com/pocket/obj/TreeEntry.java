package com.pocket.obj;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Tree 中的一条记录：名称 + 对象 id + 类型 + 权限位。
 * 子目录以 id 引用另一个 tree 对象，不持有内存指针。
 */
@Value
@Builder
@Jacksonized
public class TreeEntry {

    public static final int MODE_REGULAR = 0644;
    public static final int MODE_EXECUTABLE = 0755;
    public static final int MODE_DIRECTORY = 0755;

    String name;
    ObjectId id;
    EntryType entryType;
    int permissions;

    /**
     * 条目名是否可以安全地落到工作区：非空，不是 . 或 ..，不含路径分隔符与 NUL，也不是 .pocket。
     */
    public static boolean isValidName(String name) {
        if (name == null || name.isEmpty() || name.equals(".") || name.equals("..") || name.equals(".pocket")) {
            return false;
        }
        return name.indexOf('/') < 0 && name.indexOf('\\') < 0 && name.indexOf('\0') < 0;
    }

    /** 普通文件条目，权限 0644。 */
    public static TreeEntry file(String name, ObjectId id) {
        return file(name, id, MODE_REGULAR);
    }

    public static TreeEntry file(String name, ObjectId id, int permissions) {
        return new TreeEntry(name, id, EntryType.FILE, permissions);
    }

    /** 子目录条目。 */
    public static TreeEntry tree(String name, ObjectId id) {
        return new TreeEntry(name, id, EntryType.TREE, MODE_DIRECTORY);
    }

    @JsonIgnore
    public boolean isFile() {
        return entryType == EntryType.FILE;
    }

    @JsonIgnore
    public boolean isTree() {
        return entryType == EntryType.TREE;
    }

    /** 返回改名后的副本，用于把扁平路径映射回 tree 条目。 */
    public TreeEntry withName(String newName) {
        return new TreeEntry(newName, id, entryType, permissions);
    }
}
