package com.pocket.remote;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 远端仓库配置：名称、URL、认证方式、fetch/push refspec。
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Remote {

    public static final String DEFAULT_PUSH_REFSPEC = "timelines/*:timelines/*";

    String name;
    String url;
    @Builder.Default
    RemoteAuth auth = RemoteAuth.none();
    String fetchRefspec;
    String pushRefspec;

    /** 默认 refspec：fetch 到 timelines/&lt;remote&gt;/remote/*，push 一一对应。 */
    public static Remote of(String name, String url) {
        return Remote.builder()
                .name(name)
                .url(url)
                .fetchRefspec(defaultFetchRefspec(name))
                .pushRefspec(DEFAULT_PUSH_REFSPEC)
                .build();
    }

    public static String defaultFetchRefspec(String remoteName) {
        return "timelines/*:timelines/" + remoteName + "/remote/*";
    }
}
