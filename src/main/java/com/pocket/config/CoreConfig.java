package com.pocket.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/** [core] 段：默认 timeline 与没有 .pocketignore 时使用的忽略规则。 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CoreConfig {
    public static final String DEFAULT_TIMELINE = "main";

    private String defaultTimeline = DEFAULT_TIMELINE;
    private List<String> ignorePatterns = new ArrayList<>(List.of(".DS_Store", "*.log"));
}
