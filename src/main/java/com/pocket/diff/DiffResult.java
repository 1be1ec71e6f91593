package com.pocket.diff;

import lombok.Value;

import java.util.List;

/** 两个文本的差异。binary 为 true 时没有 hunk。 */
@Value
public class DiffResult {
    String oldPath;
    String newPath;
    boolean binary;
    List<DiffHunk> hunks;

    /** 文本相同（非二进制且没有 hunk）。 */
    public boolean isIdentical() {
        return !binary && hunks.isEmpty();
    }
}
