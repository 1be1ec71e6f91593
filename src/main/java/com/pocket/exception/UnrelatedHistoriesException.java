package com.pocket.exception;

/** 两个 head 没有任何共同祖先。 */
public class UnrelatedHistoriesException extends MergeException {
    public UnrelatedHistoriesException(String message) {
        super(message);
    }

    public UnrelatedHistoriesException(String message, Throwable cause) {
        super(message, cause);
    }
}
