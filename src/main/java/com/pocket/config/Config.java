package com.pocket.config;

import com.pocket.exception.ConfigException;
import com.pocket.repo.Timeline;
import com.pocket.utils.TomlUtils;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;

/**
 * .pocket/config.toml：[user]、[core]、[remote] 三段，缺失的段使用默认值。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Config {

    private static final Logger log = LoggerFactory.getLogger(Config.class);

    private UserConfig user = new UserConfig();
    private CoreConfig core = new CoreConfig();
    private RemoteConfig remote = new RemoteConfig();

    /**
     * 新仓库的默认配置；作者名取系统属性 user.name，没有时为 Unknown User。
     */
    public static Config defaults() {
        Config config = new Config();
        String systemUser = System.getProperty("user.name");
        if (systemUser != null && !systemUser.isBlank()) {
            config.getUser().setName(systemUser);
        }
        return config;
    }

    /**
     * 读取并校验配置；文件缺失、无法解析或字段非法时抛 ConfigException。
     */
    public static Config load(Path file) throws ConfigException {
        if (!Files.exists(file)) {
            throw new ConfigException("config file missing: " + file);
        }
        Config config;
        try {
            config = TomlUtils.read(file, Config.class);
        } catch (IOException e) {
            throw new ConfigException("invalid config " + file.getFileName() + ": " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ConfigException("invalid config " + file.getFileName() + ": empty document");
        }
        config.fillDefaults();
        config.validate();
        log.debug("loaded config user={} defaultTimeline={} remotes={}",
                config.getUser().getName(), config.getCore().getDefaultTimeline(), config.getRemote().getRemotes().size());
        return config;
    }

    /** 原子写入配置文件。 */
    public void save(Path file) throws IOException {
        TomlUtils.write(file, this);
        log.debug("saved config {}", file);
    }

    private void fillDefaults() {
        if (user == null) {
            user = new UserConfig();
        }
        if (core == null) {
            core = new CoreConfig();
        }
        if (remote == null) {
            remote = new RemoteConfig();
        }
        if (core.getIgnorePatterns() == null) {
            core.setIgnorePatterns(new ArrayList<>());
        }
        if (remote.getRemotes() == null) {
            remote.setRemotes(new ArrayList<>());
        }
    }

    private void validate() throws ConfigException {
        if (user.getName() == null || user.getName().isBlank()) {
            throw new ConfigException("invalid config: user.name must not be empty");
        }
        if (user.getEmail() == null || user.getEmail().isBlank()) {
            throw new ConfigException("invalid config: user.email must not be empty");
        }
        if (!Timeline.isValidName(core.getDefaultTimeline())) {
            throw new ConfigException("invalid config: core.default_timeline '" + core.getDefaultTimeline() + "'");
        }
        if (remote.getDefaultRemote() != null && remote.find(remote.getDefaultRemote()).isEmpty()) {
            throw new ConfigException("invalid config: remote.default_remote '" + remote.getDefaultRemote()
                    + "' is not a configured remote");
        }
    }
}
