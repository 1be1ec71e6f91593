package com.pocket.remote;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 远端认证方式，在 config.toml 中以 type 字段区分：None / Basic / SshKey / Token。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RemoteAuth.None.class, name = "None"),
        @JsonSubTypes.Type(value = RemoteAuth.Basic.class, name = "Basic"),
        @JsonSubTypes.Type(value = RemoteAuth.SshKey.class, name = "SshKey"),
        @JsonSubTypes.Type(value = RemoteAuth.Token.class, name = "Token")
})
public abstract class RemoteAuth {

    public static RemoteAuth none() {
        return new None();
    }

    /** 不认证。 */
    @EqualsAndHashCode(callSuper = false)
    @ToString
    public static final class None extends RemoteAuth {
    }

    @Value
    @Builder
    @Jacksonized
    @EqualsAndHashCode(callSuper = false)
    public static class Basic extends RemoteAuth {
        String username;
        @ToString.Exclude
        String password;
    }

    @Value
    @Builder
    @Jacksonized
    @EqualsAndHashCode(callSuper = false)
    public static class SshKey extends RemoteAuth {
        String username;
        String keyPath;
    }

    @Value
    @Builder
    @Jacksonized
    @EqualsAndHashCode(callSuper = false)
    public static class Token extends RemoteAuth {
        @ToString.Exclude
        String token;
    }
}
