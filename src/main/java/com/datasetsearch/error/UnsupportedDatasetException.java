package com.datasetsearch.error;

/**
 * 数据集不满足搜索的固定前提（缺少列式导出、无字符串列、无法识别的特征类型）。
 */
public class UnsupportedDatasetException extends DatasetSearchException {

    public UnsupportedDatasetException(String message) {
        super(ErrorCode.UNSUPPORTED_DATASET, message);
    }

    public UnsupportedDatasetException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public UnsupportedDatasetException(String message, Throwable cause) {
        super(ErrorCode.UNSUPPORTED_DATASET, message, cause);
    }
}
