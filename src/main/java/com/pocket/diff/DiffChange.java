package com.pocket.diff;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;

/**
 * hunk 内一段连续的变化。行号从 1 开始。
 */
public abstract class DiffChange {

    /** 在新文件 start 行起新增 lines。 */
    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Added extends DiffChange {
        int start;
        List<String> lines;
    }

    /** 从旧文件 start 行起删除 lines。 */
    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Removed extends DiffChange {
        int start;
        List<String> lines;
    }

    /** 旧文件 oldStart 起的 oldLines 被替换为新文件 newStart 起的 newLines。 */
    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Changed extends DiffChange {
        int oldStart;
        List<String> oldLines;
        int newStart;
        List<String> newLines;
    }
}
