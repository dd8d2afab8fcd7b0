package com.datasetsearch.error;

/**
 * 搜索服务所有业务异常的基类。
 */
public class DatasetSearchException extends RuntimeException {
    private final ErrorCode errorCode;

    public DatasetSearchException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public DatasetSearchException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }
}
