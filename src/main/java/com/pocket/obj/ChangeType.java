package com.pocket.obj;

/** 两个 tree 之间单个文件的变化类型。 */
public enum ChangeType {
    ADDED,
    MODIFIED,
    DELETED,
    RENAMED
}
