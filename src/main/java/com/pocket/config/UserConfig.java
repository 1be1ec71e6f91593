package com.pocket.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** [user] 段：shove 作者。 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserConfig {
    public static final String DEFAULT_NAME = "Unknown User";
    public static final String DEFAULT_EMAIL = "user@example.com";

    private String name = DEFAULT_NAME;
    private String email = DEFAULT_EMAIL;
}
