package com.datasetsearch.error;

/**
 * 查询阶段读取索引文件或行存储失败。
 */
public class RowStoreException extends DatasetSearchException {

    public RowStoreException(String message) {
        super(ErrorCode.TRANSIENT_FAILURE, message);
    }

    public RowStoreException(String message, Throwable cause) {
        super(ErrorCode.TRANSIENT_FAILURE, message, cause);
    }
}
