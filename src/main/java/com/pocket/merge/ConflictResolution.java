package com.pocket.merge;

import com.pocket.obj.ObjectId;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 冲突的解决方式：取 ours、取 theirs，或使用给定内容（mergedId 为 null 表示删除该文件）。
 */
@Value
@Builder
@Jacksonized
public class ConflictResolution {

    public enum Kind {
        USE_OURS,
        USE_THEIRS,
        USE_MERGED
    }

    Kind kind;
    ObjectId mergedId;

    public static ConflictResolution useOurs() {
        return new ConflictResolution(Kind.USE_OURS, null);
    }

    public static ConflictResolution useTheirs() {
        return new ConflictResolution(Kind.USE_THEIRS, null);
    }

    public static ConflictResolution useMerged(ObjectId mergedId) {
        return new ConflictResolution(Kind.USE_MERGED, mergedId);
    }
}
