package com.pocket.remote;

import com.pocket.obj.ShoveId;
import lombok.Builder;
import lombok.Value;

/** 一次 push 的结果。 */
@Value
@Builder
public class PushResult {
    String remote;
    String timeline;
    /** push 前远端的 head，远端 timeline 不存在时为 null。 */
    ShoveId oldHead;
    ShoveId newHead;
    int shovesSent;
    int objectsSent;
    boolean forced;
    boolean upToDate;
}
