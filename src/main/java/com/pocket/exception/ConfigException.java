package com.pocket.exception;

/** config.toml 缺失、无法解析或内容非法。 */
public class ConfigException extends RepositoryException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
