package com.pocket.merge;

import com.pocket.obj.ShoveId;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 合并结果。冲突不是异常：success=false 且 conflicts 非空时调用方需要处理冲突。
 */
@Value
@Builder
public class MergeResult {
    boolean success;
    boolean fastForward;
    /** 新生成的合并 shove；快进、无操作或未完成时为 null。 */
    ShoveId newShove;
    /** 合并后当前 timeline 的 head。 */
    ShoveId head;
    ShoveId base;
    @Builder.Default
    List<MergeConflict> conflicts = List.of();
    String message;

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
