package com.datasetsearch.error;

/**
 * 对调用方可见的错误分类，决定是否值得重试。
 */
public enum ErrorCode {
    /** 请求参数缺失或非法 */
    BAD_REQUEST(false),
    /** 该 split 的索引尚未构建完成 */
    INDEX_NOT_READY(true),
    /** 数据集没有所需的列式导出 */
    UNSUPPORTED_DATASET(false),
    /** 数据集没有任何可索引的字符串列 */
    NO_INDEXABLE_COLUMNS(false),
    /** 单行文本抽取失败 */
    EXTRACTION_FAILED(false),
    /** 建索引时读取行流失败 */
    BUILD_FAILED(true),
    /** 读取索引或行存储时的临时故障 */
    TRANSIENT_FAILURE(true);

    private final boolean retryable;

    ErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
