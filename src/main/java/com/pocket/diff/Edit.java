package com.pocket.diff;

import lombok.Value;

/**
 * 编辑脚本中的一步。oldIndex/newIndex 为 0 起的行号：
 * KEEP 两侧都有；DELETE 的 newIndex 与 INSERT 的 oldIndex 表示另一侧的插入位置。
 */
@Value
public class Edit {

    public enum Type {
        KEEP,
        INSERT,
        DELETE
    }

    Type type;
    int oldIndex;
    int newIndex;
    String text;

    public boolean isKeep() {
        return type == Type.KEEP;
    }
}
