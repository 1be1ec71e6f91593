package com.pocket.diff;

import lombok.Value;

/** hunk 中用于展示的一行：' ' 上下文，'-' 删除，'+' 新增。 */
@Value
public class DiffLine {
    char marker;
    String text;

    @Override
    public String toString() {
        return marker + text;
    }
}
