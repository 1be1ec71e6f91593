package com.pocket.exception;

/** pile 基于的 shove 与 timeline 当前 head 不一致。 */
public class StalePileException extends RepositoryException {
    public StalePileException(String message) {
        super(message);
    }

    public StalePileException(String message, Throwable cause) {
        super(message, cause);
    }
}
