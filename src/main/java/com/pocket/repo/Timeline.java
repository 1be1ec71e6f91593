package com.pocket.repo;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pocket.obj.ShoveId;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.regex.Pattern;

/**
 * 分支（timeline）：名称唯一，head 为可变指针，可选记录远端跟踪信息。
 * 修改后需通过 {@link Refs#saveTimeline} 显式持久化。
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Timeline {

    private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    private final String name;
    private ShoveId head;
    private RemoteTracking remoteTracking;

    @JsonCreator
    public Timeline(@JsonProperty("name") String name,
                    @JsonProperty("head") ShoveId head,
                    @JsonProperty("remote_tracking") RemoteTracking remoteTracking) {
        this.name = name;
        this.head = head;
        this.remoteTracking = remoteTracking;
    }

    public Timeline(String name, ShoveId head) {
        this(name, head, null);
    }

    /** 名称只允许字母数字与 . _ -，且不以 . 或 - 开头，不含 ".."。 */
    public static boolean isValidName(String name) {
        return name != null && VALID_NAME.matcher(name).matches() && !name.contains("..")
                && !name.endsWith(".toml");
    }

    /** 推进 head。 */
    public void updateHead(ShoveId newHead) {
        this.head = newHead;
    }

    /** 记录远端跟踪，lastKnownShove 取当前 head。 */
    public void setRemoteTracking(String remoteName, String remoteTimeline) {
        this.remoteTracking = RemoteTracking.builder()
                .remoteName(remoteName)
                .remoteTimeline(remoteTimeline)
                .lastKnownShove(head)
                .build();
    }

    @JsonIgnore
    public boolean hasHead() {
        return head != null;
    }
}
