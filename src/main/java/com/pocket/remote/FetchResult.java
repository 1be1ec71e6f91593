package com.pocket.remote;

import com.pocket.obj.ShoveId;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/** 一次 fetch 的结果：更新了哪些远端跟踪 timeline。 */
@Value
@Builder
public class FetchResult {
    String remote;
    /** 远端 timeline 名 -> 新 head，仅包含发生变化的。 */
    Map<String, ShoveId> updated;
    /** 远端已不存在、本地已删除的跟踪 timeline。 */
    List<String> pruned;
    int shovesFetched;
    int objectsFetched;

    public boolean isUpToDate() {
        return updated.isEmpty() && pruned.isEmpty();
    }
}
