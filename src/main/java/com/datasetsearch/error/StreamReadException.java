package com.datasetsearch.error;

/**
 * 建索引过程中行流读取失败，本次构建整体作废。
 */
public class StreamReadException extends DatasetSearchException {

    public StreamReadException(String message) {
        super(ErrorCode.BUILD_FAILED, message);
    }

    public StreamReadException(String message, Throwable cause) {
        super(ErrorCode.BUILD_FAILED, message, cause);
    }
}
