package com.pocket.repo;

import com.pocket.obj.ShoveId;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** 本地 timeline 与远端 timeline 的对应关系，以及上次同步到的 shove。 */
@Value
@Builder
@Jacksonized
public class RemoteTracking {
    String remoteName;
    String remoteTimeline;
    ShoveId lastKnownShove;
}
