package com.datasetsearch.error;

import com.datasetsearch.index.SplitKey;

/**
 * 请求的 split 还没有可用索引，外部构建完成后重试即可。
 */
public class IndexNotFoundException extends DatasetSearchException {
    private final SplitKey splitKey;

    public IndexNotFoundException(SplitKey splitKey) {
        super(ErrorCode.INDEX_NOT_READY, "索引尚未就绪: " + splitKey);
        this.splitKey = splitKey;
    }

    public SplitKey getSplitKey() {
        return splitKey;
    }
}
