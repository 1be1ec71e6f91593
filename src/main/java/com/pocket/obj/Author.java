package com.pocket.obj;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/** shove 的作者：名字、邮箱、时间。 */
@Value
@Builder
@Jacksonized
public class Author {
    String name;
    String email;
    Instant timestamp;

    /** 格式：Name &lt;email&gt;。 */
    public String display() {
        return name + " <" + email + ">";
    }
}
