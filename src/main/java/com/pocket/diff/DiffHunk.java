package com.pocket.diff;

import lombok.Value;

import java.util.List;

/** 一个 hunk：旧/新文件中的起始行（1 起）与行数、变化列表、带上下文的展示行。 */
@Value
public class DiffHunk {
    int oldStart;
    int oldCount;
    int newStart;
    int newCount;
    List<DiffChange> changes;
    List<DiffLine> lines;

    /** @@ -oldStart,oldCount +newStart,newCount @@ */
    public String header() {
        return "@@ -" + oldStart + "," + oldCount + " +" + newStart + "," + newCount + " @@";
    }
}
