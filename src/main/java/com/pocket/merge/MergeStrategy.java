package com.pocket.merge;

import java.util.Locale;

/** 合并策略。 */
public enum MergeStrategy {
    /** 能快进则快进，否则三路合并，冲突留给用户。 */
    AUTO,
    /** 只允许快进。 */
    FAST_FORWARD_ONLY,
    /** 即使可以快进也生成双父 shove。 */
    ALWAYS_CREATE_SHOVE,
    /** 冲突一律取当前 timeline 的版本。 */
    OURS,
    /** 冲突一律取被合并 timeline 的版本。 */
    THEIRS;

    /** 解析命令行写法，如 fast-forward-only。 */
    public static MergeStrategy parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
