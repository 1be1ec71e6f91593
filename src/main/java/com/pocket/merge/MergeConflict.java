package com.pocket.merge;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.pocket.obj.ObjectId;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 一个冲突路径：base/ours/theirs 三个版本的对象 id（某侧不存在时为 null）与可选的解决方式。
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MergeConflict {
    String path;
    ObjectId baseId;
    ObjectId oursId;
    ObjectId theirsId;
    ConflictResolution resolution;

    @JsonIgnore
    public boolean isResolved() {
        return resolution != null;
    }

    public MergeConflict withResolution(ConflictResolution r) {
        return toBuilder().resolution(r).build();
    }

    /** 按解决方式得到最终内容 id；null 表示文件被删除。未解决时抛 IllegalStateException。 */
    public ObjectId resolvedId() {
        if (resolution == null) {
            throw new IllegalStateException("conflict in " + path + " is not resolved");
        }
        switch (resolution.getKind()) {
            case USE_OURS:
                return oursId;
            case USE_THEIRS:
                return theirsId;
            default:
                return resolution.getMergedId();
        }
    }
}
