package com.pocket.repo;

import com.pocket.obj.ShoveId;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 仓库状态（不持久化）：每次查询时比较 HEAD tree、pile 与工作区重新计算。
 */
@Value
@Builder
public class RepoStatus {
    String currentTimeline;
    ShoveId headShove;
    @Builder.Default
    List<PileEntry> piledEntries = List.of();
    @Builder.Default
    List<String> modifiedFiles = List.of();
    @Builder.Default
    List<String> untrackedFiles = List.of();
    /** HEAD 中有、工作区中已不存在且未暂存删除的文件。 */
    @Builder.Default
    List<String> deletedFiles = List.of();
    /** 未完成合并中尚未解决的冲突路径。 */
    @Builder.Default
    List<String> conflicts = List.of();
    /** pile 基于的 head 已不是当前 head。 */
    boolean stalePile;

    /** pile 为空且没有修改、删除、冲突（未跟踪文件不算）。 */
    public boolean isClean() {
        return piledEntries.isEmpty() && modifiedFiles.isEmpty() && deletedFiles.isEmpty() && conflicts.isEmpty();
    }
}
