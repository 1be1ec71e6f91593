package com.pocket.obj;

import lombok.Value;

/**
 * 单个文件的变化。ADDED 无 oldId，DELETED 无 newId，RENAMED 带 oldPath。
 */
@Value
public class FileChange {
    String path;
    ChangeType changeType;
    ObjectId oldId;
    ObjectId newId;
    String oldPath;

    public static FileChange added(String path, ObjectId newId) {
        return new FileChange(path, ChangeType.ADDED, null, newId, null);
    }

    public static FileChange deleted(String path, ObjectId oldId) {
        return new FileChange(path, ChangeType.DELETED, oldId, null, null);
    }

    public static FileChange modified(String path, ObjectId oldId, ObjectId newId) {
        return new FileChange(path, ChangeType.MODIFIED, oldId, newId, null);
    }

    public static FileChange renamed(String oldPath, String newPath, ObjectId id) {
        return new FileChange(newPath, ChangeType.RENAMED, id, id, oldPath);
    }
}
