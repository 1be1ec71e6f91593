package com.pocket.exception;

/** 对象完整性错误：对象缺失或无法反序列化，必须立即失败。 */
public class ObjectException extends PocketException {
    public ObjectException(String message) {
        super(message);
    }

    public ObjectException(String message, Throwable cause) {
        super(message, cause);
    }
}
