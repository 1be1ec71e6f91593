package com.pocket.repo;

/** pile 条目的状态。 */
public enum PileStatus {
    ADDED,
    MODIFIED,
    DELETED,
    /** 改名，entry 的 originalPath 为旧路径。 */
    RENAMED
}
