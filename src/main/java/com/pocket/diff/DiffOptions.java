package com.pocket.diff;

import lombok.Builder;
import lombok.Value;

/** 行比较选项。 */
@Value
@Builder
public class DiffOptions {
    public static final int DEFAULT_CONTEXT_LINES = 3;

    /** 比较时把连续空白折叠为一个空格并去掉首尾空白。 */
    boolean ignoreWhitespace;
    boolean ignoreCase;
    @Builder.Default
    int contextLines = DEFAULT_CONTEXT_LINES;

    public static DiffOptions defaults() {
        return DiffOptions.builder().build();
    }
}
