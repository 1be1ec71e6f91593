package com.pocket.repo;

import com.pocket.obj.ObjectId;
import com.pocket.obj.TreeEntry;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * pile 中的一条记录：相对路径（/ 分隔）、状态、暂存内容的对象 id。
 * DELETED 没有 objectId；RENAMED 带 originalPath。
 */
@Value
@Builder
@Jacksonized
public class PileEntry {
    String path;
    PileStatus status;
    ObjectId objectId;
    String originalPath;
    @Builder.Default
    int permissions = TreeEntry.MODE_REGULAR;

    /** 转成 tree 中的文件条目，DELETED 返回 null。 */
    public TreeEntry toTreeEntry() {
        if (status == PileStatus.DELETED) {
            return null;
        }
        return TreeEntry.file(path, objectId, permissions);
    }
}
