package com.pocket.repo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * 忽略规则（glob）。每条规则针对相对路径匹配；不含 / 的规则还会逐段匹配路径的每一级；
 * 以 / 结尾的规则只匹配目录。.pocket 始终被忽略。
 */
public final class IgnoreRules {

    private static final Logger log = LoggerFactory.getLogger(IgnoreRules.class);

    static final String POCKET_DIR = ".pocket";

    private final List<String> patterns;
    private final List<Rule> rules = new ArrayList<>();

    public IgnoreRules(List<String> patterns) {
        this.patterns = List.copyOf(patterns);
        for (String raw : patterns) {
            String p = raw.trim();
            if (p.isEmpty() || p.startsWith("#")) {
                continue;
            }
            boolean dirOnly = p.endsWith("/");
            if (dirOnly) {
                p = p.substring(0, p.length() - 1);
            }
            boolean anchored = p.startsWith("/");
            if (anchored) {
                p = p.substring(1);
            }
            if (p.isEmpty()) {
                continue;
            }
            try {
                PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + p);
                rules.add(new Rule(matcher, dirOnly, anchored || p.contains("/")));
            } catch (IllegalArgumentException e) {
                log.warn("skipping invalid ignore pattern '{}': {}", raw, e.getMessage());
            }
        }
    }

    /** 解析 .pocketignore 内容：忽略空行与 # 注释行。 */
    public static List<String> parse(String content) {
        List<String> result = new ArrayList<>();
        for (String line : content.split("\\r?\\n")) {
            String t = line.trim();
            if (!t.isEmpty() && !t.startsWith("#")) {
                result.add(t);
            }
        }
        return result;
    }

    /** 原始规则列表。 */
    public List<String> getPatterns() {
        return patterns;
    }

    /**
     * relativePath 为 / 分隔的相对路径；directory 表示该路径是否为目录。
     */
    public boolean isIgnored(String relativePath, boolean directory) {
        if (relativePath.isEmpty()) {
            return false;
        }
        String[] segments = relativePath.split("/");
        if (POCKET_DIR.equals(segments[0])) {
            return true;
        }
        Path path = Paths.get(relativePath);
        for (Rule rule : rules) {
            if (rule.dirOnly && !directory) {
                continue;
            }
            if (rule.matcher.matches(path)) {
                return true;
            }
            if (!rule.pathOnly && rule.matcher.matches(Paths.get(segments[segments.length - 1]))) {
                return true;
            }
        }
        return false;
    }

    /**
     * 文件本身或其任一上级目录被忽略。
     */
    public boolean isIgnoredFile(String relativePath) {
        String[] segments = relativePath.split("/");
        StringBuilder prefix = new StringBuilder();
        for (int i = 0; i < segments.length - 1; i++) {
            if (i > 0) {
                prefix.append('/');
            }
            prefix.append(segments[i]);
            if (isIgnored(prefix.toString(), true)) {
                return true;
            }
        }
        return isIgnored(relativePath, false);
    }

    private static final class Rule {
        private final PathMatcher matcher;
        private final boolean dirOnly;
        private final boolean pathOnly;

        private Rule(PathMatcher matcher, boolean dirOnly, boolean pathOnly) {
            this.matcher = matcher;
            this.dirOnly = dirOnly;
            this.pathOnly = pathOnly;
        }
    }
}
